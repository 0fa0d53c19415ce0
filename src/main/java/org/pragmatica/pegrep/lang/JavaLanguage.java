package org.pragmatica.pegrep.lang;

import org.pragmatica.pegrep.error.ParseException;
import org.pragmatica.pegrep.grammar.GrammarParser;
import org.pragmatica.pegrep.parser.Parser;
import org.pragmatica.pegrep.parser.ParserConfig;
import org.pragmatica.pegrep.parser.PegParser;
import org.pragmatica.pegrep.tree.SequenceKind;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Java as the host language, driven by the bundled {@code java.peg} grammar.
 */
public final class JavaLanguage implements HostLanguage {
    private static final Logger logger = LogManager.getLogger(JavaLanguage.class);

    static final String GRAMMAR_RESOURCE = "java.peg";

    private static final Map<String, SequenceKind> LIST_RULES = Map.of(
        "Args", SequenceKind.EXPRESSIONS,
        "ExprList", SequenceKind.EXPRESSIONS,
        "Block", SequenceKind.STATEMENTS,
        "BlockStmts", SequenceKind.STATEMENTS,
        "ClassBody", SequenceKind.DECLARATIONS,
        "ClassMembers", SequenceKind.DECLARATIONS,
        "RecordBody", SequenceKind.DECLARATIONS,
        "Params", SequenceKind.PARAMETERS);

    private static final List<Hypothesis> HYPOTHESES = List.of(
        Hypothesis.single("Expr"),
        Hypothesis.list("ExprList", SequenceKind.EXPRESSIONS),
        Hypothesis.single("BlockStmt"),
        Hypothesis.list("BlockStmts", SequenceKind.STATEMENTS),
        Hypothesis.single("Type"),
        Hypothesis.single("ClassMember"),
        Hypothesis.list("ClassMembers", SequenceKind.DECLARATIONS),
        Hypothesis.single("CompilationUnit"));

    private static final Set<String> STATEMENT_RULES = Set.of("Stmt", "LocalVar", "LocalTypeDecl");

    private static final JavaLanguage INSTANCE = new JavaLanguage(loadParser());

    private final Parser parser;

    private JavaLanguage(Parser parser) {
        this.parser = parser;
    }

    public static JavaLanguage instance() {
        return INSTANCE;
    }

    private static Parser loadParser() {
        var grammarText = readGrammar();
        try {
            var grammar = GrammarParser.parse(grammarText);
            logger.debug("Loaded Java grammar with {} rules", grammar.rules().size());
            var parser = PegParser.fromGrammar(grammar, ParserConfig.DEFAULT.withListRules(LIST_RULES.keySet()));
            return new FoldingParser(parser);
        } catch (ParseException e) {
            throw new IllegalStateException("Bundled Java grammar is invalid: " + e.getMessage(), e);
        }
    }

    private static String readGrammar() {
        try (InputStream in = JavaLanguage.class.getResourceAsStream(GRAMMAR_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing grammar resource: " + GRAMMAR_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read grammar resource: " + GRAMMAR_RESOURCE, e);
        }
    }

    @Override
    public Parser parser() {
        return parser;
    }

    @Override
    public List<Hypothesis> hypotheses() {
        return HYPOTHESES;
    }

    @Override
    public Optional<SequenceKind> sequenceKind(String rule) {
        return Optional.ofNullable(LIST_RULES.get(rule));
    }

    @Override
    public String identifierRule() {
        return "Identifier";
    }

    @Override
    public boolean isSyntaxOnly(SyntaxNode node) {
        if (node.isPunctuation()) {
            return true;
        }
        if (node instanceof SyntaxNode.Token token) {
            return token.rule().endsWith("KW");
        }
        // an empty argument or parameter list
        return node instanceof SyntaxNode.NonTerminal nt && nt.children().isEmpty();
    }

    @Override
    public boolean isStatement(SyntaxNode node) {
        return STATEMENT_RULES.contains(node.rule());
    }

    @Override
    public Optional<SyntaxNode> unwrapParentheses(SyntaxNode node) {
        return enclosed(node, "Primary", "(", ")");
    }

    @Override
    public Optional<SyntaxNode> unwrapSingleStatementBlock(SyntaxNode node) {
        return enclosed(node, "Block", "{", "}");
    }

    @Override
    public String fileExtension() {
        return ".java";
    }

    private static Optional<SyntaxNode> enclosed(SyntaxNode node, String rule, String open, String close) {
        if (!(node instanceof SyntaxNode.NonTerminal nt) || !nt.rule().equals(rule)) {
            return Optional.empty();
        }
        var children = nt.children();
        if (children.size() != 3
            || !ChainFolder.isPunctuation(children.get(0), open)
            || !ChainFolder.isPunctuation(children.get(2), close)) {
            return Optional.empty();
        }
        return Optional.of(children.get(1));
    }

    /**
     * Parses with the PEG engine, then nests operator and member chains.
     */
    private record FoldingParser(Parser delegate) implements Parser {
        @Override
        public SyntaxNode parse(String input) throws ParseException {
            return ChainFolder.fold(delegate.parse(input));
        }

        @Override
        public SyntaxNode parse(String input, String startRule) throws ParseException {
            return ChainFolder.fold(delegate.parse(input, startRule));
        }
    }
}
