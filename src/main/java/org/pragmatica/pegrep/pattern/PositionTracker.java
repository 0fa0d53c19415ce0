package org.pragmatica.pegrep.pattern;

import org.pragmatica.pegrep.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the rewritten pattern text and remembers where its length departs from the original,
 * so that parser locations can be mapped back to what the user typed.
 */
public final class PositionTracker {
    private final StringBuilder text = new StringBuilder();
    private final List<PosOffset> offsets = new ArrayList<>();
    private int line = 1;
    private int column = 1;

    /**
     * Append text that has the same length in the original pattern.
     */
    public void write(String chunk) {
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            text.append(c);
            if (c == '\n') {
                line++ ;
                column = 1;
            } else {
                column++ ;
            }
        }
    }

    /**
     * Append text standing in for {@code originalLength} characters of the original pattern.
     */
    public void substitute(String replacement, int originalLength) {
        var delta = replacement.length() - originalLength;
        if (delta != 0) {
            offsets.add(new PosOffset(line, column, text.length(), delta));
        }
        write(replacement);
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, text.length());
    }

    public String text() {
        return text.toString();
    }

    public List<PosOffset> offsets() {
        return List.copyOf(offsets);
    }

    /**
     * Map a location in the rewritten text back to the original pattern.
     */
    public SourceLocation correct(SourceLocation location) {
        int correctedColumn = location.column();
        int correctedOffset = location.offset();
        for (var offset : offsets) {
            if (offset.atLine() == location.line() && location.column() > offset.atColumn()) {
                correctedColumn -= offset.length();
            }
            if (location.offset() > offset.atOffset()) {
                correctedOffset -= offset.length();
            }
        }
        return SourceLocation.at(location.line(), correctedColumn, correctedOffset);
    }
}
