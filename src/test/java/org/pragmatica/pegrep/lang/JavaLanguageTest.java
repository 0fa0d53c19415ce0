package org.pragmatica.pegrep.lang;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegrep.error.ParseException;
import org.pragmatica.pegrep.tree.SequenceKind;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JavaLanguageTest {

    private final JavaLanguage java = JavaLanguage.instance();

    @Test
    void parse_sampleFile_succeeds() throws Exception {
        var source = resource("Sample.java.txt");

        var tree = java.parser().parse(source);

        assertEquals("OrdinaryUnit", tree.rule());
        assertThat(collect(tree, "MethodDecl")).hasSize(3);
        assertThat(collect(tree, "ConstructorDecl")).hasSize(1);
        assertThat(collect(tree, "RecordDecl")).hasSize(1);
        assertThat(collect(tree, "EnumDecl")).hasSize(1);
        assertThat(collect(tree, "DimExprs")).hasSize(1);
    }

    @Test
    void parse_sampleFile_keepsListNodes() throws Exception {
        var tree = java.parser().parse(resource("Sample.java.txt"));

        var args = collect(tree, "Args");
        assertThat(args).isNotEmpty();
        assertThat(args).allMatch(node -> node instanceof SyntaxNode.NonTerminal);
        var runParams = collect(tree, "Params").stream()
                                               .filter(node -> node.children().isEmpty())
                                               .toList();
        assertThat(runParams).hasSize(1);
        assertThat(collect(tree, "ClassBody")).hasSize(1);
        assertThat(collect(tree, "RecordBody")).hasSize(1);
    }

    @Test
    void parse_syntaxError_fails() {
        assertThrows(ParseException.class, () -> java.parser().parse("class A { void f( }"));
    }

    @Test
    void parse_call_hasArgumentList() throws ParseException {
        var node = java.parser().parse("f()", "Expr");

        var call = assertInstanceOf(SyntaxNode.NonTerminal.class, node);
        assertEquals("Call", call.rule());
        assertEquals(new SyntaxNode.Token(call.children().get(0).span(), "Identifier", "f"), call.children().get(0));
        var args = call.children().get(2);
        assertEquals("Args", args.rule());
        assertTrue(args.children().isEmpty());
    }

    @Test
    void parse_assignment_hasSelectTarget() throws ParseException {
        var node = java.parser().parse("a.b = a", "Expr");

        assertEquals("Assignment", node.rule());
        assertEquals(3, node.children().size());
        assertEquals("Select", node.children().get(0).rule());
        assertEquals("Identifier", node.children().get(2).rule());
    }

    @Test
    void parse_binaryChain_nestsToTheLeft() throws ParseException {
        var node = java.parser().parse("a + b - c", "Expr");

        assertEquals("Additive", node.rule());
        assertEquals(3, node.children().size());
        var left = node.children().get(0);
        assertEquals("Additive", left.rule());
        assertEquals("a + b", left.span().extract("a + b - c"));
        assertEquals("c", ((SyntaxNode.Token) node.children().get(2)).text());
    }

    @Test
    void parse_memberChain_nestsEveryPrefix() throws ParseException {
        var source = "a.b.close()";
        var node = java.parser().parse(source, "Expr");

        assertEquals("Call", node.rule());
        var select = node.children().get(0);
        assertEquals("Select", select.rule());
        assertEquals("a.b.close", select.span().extract(source));
        var receiver = select.children().get(0);
        assertEquals("Select", receiver.rule());
        assertEquals("a.b", receiver.span().extract(source));
        assertThat(collect(node, "PostOp")).isEmpty();
        assertThat(collect(node, "QualifiedName")).isEmpty();
    }

    @Test
    void parse_callReceiver_hasSameShapeAsName() throws ParseException {
        var source = "get().close()";
        var node = java.parser().parse(source, "Expr");

        var select = node.children().get(0);
        assertEquals("Select", select.rule());
        var receiver = select.children().get(0);
        assertEquals("Call", receiver.rule());
        assertEquals("get()", receiver.span().extract(source));
    }

    @Test
    void parse_indexAndIncrement_foldIntoReceiver() throws ParseException {
        var source = "xs[i]++";
        var node = java.parser().parse(source, "Expr");

        assertEquals("Postfix", node.rule());
        assertEquals("Index", node.children().get(0).rule());
        assertTrue(node.children().get(1).isPunctuation());
    }

    @Test
    void parse_multiDimensionalArrayCreation_succeeds() throws ParseException {
        var node = java.parser().parse("new int[1000][]", "Expr");

        assertThat(collect(node, "DimExprs")).hasSize(1);
        assertDoesNotThrow(() -> java.parser().parse("new double[0][][]", "Expr"));
        assertDoesNotThrow(() -> java.parser().parse("new int[a][b]", "Expr"));
    }

    @Test
    void parse_encodedWildcard_isIdentifier() throws ParseException {
        var node = java.parser().parse("$$0", "Expr");

        var token = assertInstanceOf(SyntaxNode.Token.class, node);
        assertEquals("Identifier", token.rule());
        assertEquals("$$0", token.text());
    }

    @Test
    void parse_keywords_areNotIdentifiers() {
        assertThrows(ParseException.class, () -> java.parser().parse("class", "Expr"));
    }

    @Test
    void sequenceKind_coversListRules() {
        assertEquals(SequenceKind.EXPRESSIONS, java.sequenceKind("Args").orElseThrow());
        assertEquals(SequenceKind.STATEMENTS, java.sequenceKind("Block").orElseThrow());
        assertEquals(SequenceKind.DECLARATIONS, java.sequenceKind("ClassBody").orElseThrow());
        assertEquals(SequenceKind.PARAMETERS, java.sequenceKind("Params").orElseThrow());
        assertTrue(java.sequenceKind("Expr").isEmpty());
        assertFalse(java.isListRule("Stmt"));
    }

    @Test
    void hypotheses_areOrderedNarrowestFirst() {
        var rules = java.hypotheses().stream().map(Hypothesis::startRule).toList();

        assertEquals(List.of("Expr", "ExprList", "BlockStmt", "BlockStmts", "Type", "ClassMember", "ClassMembers",
                             "CompilationUnit"), rules);
        assertTrue(java.hypotheses().get(0).listKind().isEmpty());
        assertEquals(SequenceKind.STATEMENTS, java.hypotheses().get(3).listKind().orElseThrow());
    }

    @Test
    void isSyntaxOnly_skipsPunctuationAndKeywords() throws ParseException {
        var stmt = java.parser().parse("return x;", "BlockStmt");

        assertEquals("Stmt", stmt.rule());
        assertTrue(java.isSyntaxOnly(stmt.children().get(0)));
        assertFalse(java.isSyntaxOnly(stmt.children().get(1)));
        assertTrue(java.isSyntaxOnly(stmt.children().get(2)));
        assertFalse(java.isSyntaxOnly(stmt));
    }

    @Test
    void isStatement_acceptsStatementsOnly() throws ParseException {
        var block = java.parser().parse("{ f(); int x = 1; return; }", "Block");
        var statements = block.children().subList(1, 4);

        assertThat(statements).allMatch(java::isStatement);
        assertFalse(java.isStatement(block));
        assertFalse(java.isStatement(statements.get(0).children().get(0)));
    }

    @Test
    void unwrapParentheses_returnsInnerExpression() throws ParseException {
        var parenthesized = java.parser().parse("(x + 1)", "Expr");
        var plain = java.parser().parse("x + 1", "Expr");

        assertTrue(SyntaxNode.sameStructure(plain, java.unwrapParentheses(parenthesized).orElseThrow()));
        assertTrue(java.unwrapParentheses(plain).isEmpty());
    }

    @Test
    void unwrapSingleStatementBlock_onlyForOneStatement() throws ParseException {
        var single = java.parser().parse("{ return; }", "BlockStmt");
        var twice = java.parser().parse("{ a(); b(); }", "BlockStmt");

        assertEquals("Stmt", java.unwrapSingleStatementBlock(single).orElseThrow().rule());
        assertTrue(java.unwrapSingleStatementBlock(twice).isEmpty());
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = JavaLanguageTest.class.getResourceAsStream(name)) {
            assertNotNull(in, name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static List<SyntaxNode> collect(SyntaxNode node, String rule) {
        var found = new ArrayList<SyntaxNode>();
        collect(node, rule, found);
        return found;
    }

    private static void collect(SyntaxNode node, String rule, List<SyntaxNode> found) {
        if (node.rule().equals(rule)) {
            found.add(node);
        }
        for (var child : node.children()) {
            collect(child, rule, found);
        }
    }
}
