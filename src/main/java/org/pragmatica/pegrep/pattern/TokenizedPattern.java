package org.pragmatica.pegrep.pattern;

import java.util.List;

/**
 * Output of {@link WildcardTokenizer}: the lexemes of a pattern and its wildcard table.
 *
 * @param source     pattern as the user wrote it
 * @param tokens     lexemes in source order; whitespace between them is not tokenized
 * @param wildcards  wildcard side table
 * @param aggressive whether the pattern starts with the aggressive marker
 */
public record TokenizedPattern(String source, List<PatternToken> tokens, WildcardTable wildcards, boolean aggressive) {
    static final String WILDCARD_PREFIX = "$$";

    public TokenizedPattern {
        tokens = List.copyOf(tokens);
    }

    /**
     * Rewrite the pattern into text the host parser accepts. Every wildcard becomes the
     * identifier {@code $$<id>}; the aggressive marker becomes a space; everything else,
     * including the whitespace between tokens, is copied unchanged.
     */
    public PositionTracker encode() {
        var tracker = new PositionTracker();
        int cursor = 0;
        for (var token : tokens) {
            tracker.write(source.substring(cursor, token.start().offset()));
            switch (token.kind()) {
                case WILDCARD -> tracker.substitute(WILDCARD_PREFIX + token.wildcardId(), token.text().length());
                case AGGRESSIVE -> tracker.write(" ");
                default -> tracker.write(token.text());
            }
            cursor = token.end();
        }
        tracker.write(source.substring(cursor));
        return tracker;
    }
}
