package org.pragmatica.pegrep.lang;

import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds flat operator and member chains as left-nested nodes, so that every prefix of a
 * chain is a subtree of its own.
 *
 * <p>{@code a + b + c} becomes {@code Additive[Additive[a + b] + c]}. Names and postfix
 * operators become {@code Select}, {@code Call}, {@code Index} and {@code Postfix} nodes:
 * {@code a.b.close()} is {@code Call[Select[Select[a . b] . close] ( Args )]}, the same
 * shape as {@code get().close()} gives for its receiver.
 */
final class ChainFolder {
    private static final String SELECT = "Select";
    private static final String CALL = "Call";
    private static final String INDEX = "Index";
    private static final String POSTFIX = "Postfix";

    private static final Set<String> BINARY_RULES = Set.of(
        "LogOr", "LogAnd", "BitOr", "BitXor", "BitAnd", "Equality", "Shift", "Additive", "Multiplicative");
    private static final String QUALIFIED_NAME = "QualifiedName";
    private static final String POST_OP = "PostOp";

    private ChainFolder() {}

    static SyntaxNode fold(SyntaxNode node) {
        if (!(node instanceof SyntaxNode.NonTerminal nt)) {
            return node;
        }
        var children = new ArrayList<SyntaxNode>(nt.children().size());
        for (var child : nt.children()) {
            children.add(fold(child));
        }
        var rule = nt.rule();
        if (BINARY_RULES.contains(rule) || QUALIFIED_NAME.equals(rule)) {
            return foldOperands(rule, children);
        }
        if (POSTFIX.equals(rule)) {
            return foldPostOps(children);
        }
        return new SyntaxNode.NonTerminal(nt.span(), rule, List.copyOf(children));
    }

    /**
     * Operands sit at even positions, separators at odd ones.
     */
    private static SyntaxNode foldOperands(String rule, List<SyntaxNode> children) {
        var nestedRule = QUALIFIED_NAME.equals(rule) ? SELECT : rule;
        var current = children.get(0);
        for (int i = 1; i + 1 < children.size(); i += 2) {
            current = node(nestedRule, List.of(current, children.get(i), children.get(i + 1)));
        }
        return current;
    }

    private static SyntaxNode foldPostOps(List<SyntaxNode> children) {
        var current = children.get(0);
        for (var op : children.subList(1, children.size())) {
            current = applyPostOp(current, parts(op));
        }
        return current;
    }

    private static List<SyntaxNode> parts(SyntaxNode op) {
        if (op instanceof SyntaxNode.NonTerminal nt && POST_OP.equals(nt.rule())) {
            return nt.children();
        }
        // a lone '++' or '--' carries the PostOp name; it is punctuation inside the folded node
        if (op instanceof SyntaxNode.Terminal terminal && POST_OP.equals(terminal.rule())) {
            return List.of(new SyntaxNode.Terminal(terminal.span(), "", terminal.text()));
        }
        return List.of(op);
    }

    private static SyntaxNode applyPostOp(SyntaxNode receiver, List<SyntaxNode> parts) {
        if (startsWith(parts, ".")) {
            var open = indexOf(parts, "(");
            if (open < 0) {
                return withReceiver(SELECT, receiver, parts);
            }
            var select = withReceiver(SELECT, receiver, parts.subList(0, open));
            return withReceiver(CALL, select, parts.subList(open, parts.size()));
        }
        if (startsWith(parts, "(")) {
            return withReceiver(CALL, receiver, parts);
        }
        if (startsWith(parts, "[")) {
            return withReceiver(INDEX, receiver, parts);
        }
        return withReceiver(POSTFIX, receiver, parts);
    }

    private static SyntaxNode withReceiver(String rule, SyntaxNode receiver, List<SyntaxNode> parts) {
        var children = new ArrayList<SyntaxNode>(parts.size() + 1);
        children.add(receiver);
        children.addAll(parts);
        return node(rule, children);
    }

    private static SyntaxNode node(String rule, List<SyntaxNode> children) {
        var span = children.get(0).span()
            .merge(children.get(children.size() - 1).span());
        return new SyntaxNode.NonTerminal(span, rule, List.copyOf(children));
    }

    private static boolean startsWith(List<SyntaxNode> parts, String text) {
        return !parts.isEmpty() && isPunctuation(parts.get(0), text);
    }

    private static int indexOf(List<SyntaxNode> parts, String text) {
        for (int i = 0; i < parts.size(); i++ ) {
            if (isPunctuation(parts.get(i), text)) {
                return i;
            }
        }
        return -1;
    }

    static boolean isPunctuation(SyntaxNode node, String text) {
        return node instanceof SyntaxNode.Terminal terminal
            && terminal.isPunctuation()
            && terminal.text().equals(text);
    }
}
