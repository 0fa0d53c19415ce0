package org.pragmatica.pegrep.pattern;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegrep.error.CompileException;
import org.pragmatica.pegrep.error.ParseError;
import org.pragmatica.pegrep.error.TokenizeException;
import org.pragmatica.pegrep.lang.JavaLanguage;
import org.pragmatica.pegrep.match.Relaxation;
import org.pragmatica.pegrep.tree.SequenceKind;
import org.pragmatica.pegrep.tree.SyntaxNode;

import static org.junit.jupiter.api.Assertions.*;

class PatternCompilerTest {

    private final PatternCompiler compiler = new PatternCompiler(JavaLanguage.instance());

    @Test
    void compile_identifier_isExpression() throws Exception {
        var pattern = compiler.compile("x");

        assertEquals("Expr", pattern.hypothesis().startRule());
        var token = assertInstanceOf(SyntaxNode.Token.class, pattern.root());
        assertEquals("Identifier", token.rule());
    }

    @Test
    void compile_statement_isStatement() throws Exception {
        var pattern = compiler.compile("foo();");

        assertEquals("BlockStmt", pattern.hypothesis().startRule());
        assertEquals("Stmt", pattern.root().rule());
    }

    @Test
    void compile_primitive_isType() throws Exception {
        assertEquals("Type", compiler.compile("int").hypothesis().startRule());
        assertEquals("Type", compiler.compile("List<$T>").hypothesis().startRule());
    }

    @Test
    void compile_method_isDeclaration() throws Exception {
        var pattern = compiler.compile("void $m() { $*_; }");

        assertEquals("ClassMember", pattern.hypothesis().startRule());
        assertEquals("MethodDecl", pattern.root().rule());
    }

    @Test
    void compile_packageDeclaration_isFile() throws Exception {
        assertEquals("CompilationUnit", compiler.compile("package a.b;").hypothesis().startRule());
    }

    @Test
    void compile_wildcard_becomesWildcardNode() throws Exception {
        var pattern = compiler.compile("$x");

        var wildcard = assertInstanceOf(SyntaxNode.Wildcard.class, pattern.root());
        assertEquals("x", pattern.wildcards().get(wildcard.id()).name());
    }

    @Test
    void compile_loneWildcardStatement_isStatementOnly() throws Exception {
        var pattern = compiler.compile("$x;");

        assertEquals("BlockStmt", pattern.hypothesis().startRule());
        assertInstanceOf(SyntaxNode.Wildcard.class, pattern.root());
        assertTrue(pattern.statementOnly());
        assertFalse(compiler.compile("$x").statementOnly());
        assertFalse(compiler.compile("foo();").statementOnly());
    }

    @Test
    void compile_wildcardStatementBelowRoot_collapses() throws Exception {
        var pattern = compiler.compile("if ($c) $s;");

        assertEquals("Stmt", pattern.root().rule());
        assertInstanceOf(SyntaxNode.Wildcard.class, pattern.root().children().get(4));
        assertFalse(pattern.statementOnly());
    }

    @Test
    void compile_statementList_isSequence() throws Exception {
        var pattern = compiler.compile("$*_; return $x;");

        assertEquals("BlockStmts", pattern.hypothesis().startRule());
        var sequence = assertInstanceOf(SyntaxNode.Sequence.class, pattern.root());
        assertEquals(SequenceKind.STATEMENTS, sequence.kind());
        assertEquals(2, sequence.elements().size());
        assertInstanceOf(SyntaxNode.Wildcard.class, sequence.elements().get(0));
        assertEquals("Stmt", sequence.elements().get(1).rule());
    }

    @Test
    void compile_expressionList_isSequence() throws Exception {
        var sequence = assertInstanceOf(SyntaxNode.Sequence.class, compiler.compile("a, $b").root());

        assertEquals(SequenceKind.EXPRESSIONS, sequence.kind());
        assertEquals(2, sequence.elements().size());
    }

    @Test
    void compile_aggressiveMarker_enablesRelaxations() throws Exception {
        var aggressive = compiler.compile("#f($x)");
        var strict = compiler.compile("f($x)");

        assertTrue(aggressive.isAggressive());
        assertTrue(aggressive.allows(Relaxation.PARENTHESES));
        assertTrue(aggressive.allows(Relaxation.SINGLE_STATEMENT_BLOCKS));
        assertFalse(strict.isAggressive());
        assertTrue(SyntaxNode.sameStructure(aggressive.root(), strict.root()));
    }

    @Test
    void compile_twice_givesSameTree() throws Exception {
        var first = compiler.compile("if ($c) { $*body; }");
        var second = compiler.compile("if ($c) { $*body; }");

        assertEquals(first.root(), second.root());
        assertEquals(first.wildcards(), second.wildcards());
    }

    @Test
    void compile_errorAfterWildcard_reportsOriginalColumn() {
        var e = assertThrows(CompileException.class, () -> compiler.compile("$x + )"));

        assertEquals("1:6", e.location().toString());
        var error = assertInstanceOf(ParseError.UnexpectedInput.class, e.error());
        assertEquals(")", error.found());
        assertTrue(e.getMessage().startsWith("cannot parse pattern: 1:6: unexpected ')'"));
    }

    @Test
    void compile_errorAfterShorterEncoding_reportsOriginalColumn() {
        var e = assertThrows(CompileException.class, () -> compiler.compile("foo($*rest, ])"));

        assertEquals("1:13", e.location().toString());
        assertEquals(12, e.location().offset());
    }

    @Test
    void compile_diagnostic_pointsIntoPattern() {
        var e = assertThrows(CompileException.class, () -> compiler.compile("$x + )"));

        var rendered = e.diagnostic().format("$x + )", "pattern");
        assertTrue(rendered.contains("--> pattern:1:6"));
        assertTrue(rendered.contains("1 | $x + )"));
        assertTrue(rendered.contains("     ^ found ')'"));
    }

    @Test
    void compile_badRegex_isTokenizeError() {
        var e = assertThrows(TokenizeException.class, () -> compiler.compile("$(_, /[a/)"));

        assertEquals(7, e.location().column());
    }

    @Test
    void compile_emptyPattern_fails() {
        assertThrows(CompileException.class, () -> compiler.compile("   "));
    }
}
