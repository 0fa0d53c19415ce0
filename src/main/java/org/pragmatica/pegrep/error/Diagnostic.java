package org.pragmatica.pegrep.error;

import org.pragmatica.pegrep.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rust-style rendering of a pattern error against the pattern text.
 *
 * <p>Example output:
 * <pre>
 * error: cannot parse pattern
 *   --> pattern:1:6
 *   |
 * 1 | $x + )
 *   |      ^ found ')'
 *   |
 *   = help: expected Unary
 * </pre>
 *
 * @param message Primary error message
 * @param span    Source span where error occurred
 * @param labels  Labeled spans shown under the source line
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(
 String message,
 SourceSpan span,
 List<Label> labels,
 List<String> notes) {
    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message
     * @param primary Whether this is the primary label (shown with ^^^)
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, labelMessage));
        return new Diagnostic(message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, labelMessage));
        return new Diagnostic(message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text
     * @param filename Name shown in the location line
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        sb.append("error: ")
          .append(message)
          .append("\n");
        var loc = span.start();
        sb.append("  --> ")
          .append(filename)
          .append(":")
          .append(loc.line())
          .append(":")
          .append(loc.column())
          .append("\n");
        int minLine = span.start()
                          .line();
        int maxLine = span.end()
                          .line();
        for (var label : labels) {
            minLine = Math.min(minLine,
                               label.span()
                                    .start()
                                    .line());
            maxLine = Math.max(maxLine,
                               label.span()
                                    .end()
                                    .line());
        }
        int gutterWidth = String.valueOf(maxLine)
                                .length();
        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = lines[lineNum - 1];
            var lineNumStr = String.format("%" + gutterWidth + "d", lineNum);
            sb.append(lineNumStr)
              .append(" | ")
              .append(lineContent)
              .append("\n");
            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth))
                  .append(" | ")
                  .append(formatUnderlines(lineNum, lineContent, lineLabels))
                  .append("\n");
            }
        }
        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1))
              .append("= ")
              .append(note)
              .append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line format: {@code filename:line:column: error: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: error: %s", filename, loc.line(), loc.column(), message);
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && span.start().line() <= lineNum && span.end().line() >= lineNum) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (label.span().start().line() <= lineNum && label.span().end().line() >= lineNum) {
                result.add(label);
            }
        }
        return result;
    }

    private String formatUnderlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;
        var sorted = lineLabels.stream()
                               .sorted(Comparator.comparingInt(label -> label.span().start().column()))
                               .toList();
        for (var label : sorted) {
            int startCol = label.span()
                                .start()
                                .line() == lineNum
                           ? label.span()
                                  .start()
                                  .column()
                           : 1;
            int endCol = label.span()
                              .end()
                              .line() == lineNum
                         ? label.span()
                                .end()
                                .column()
                         : lineContent.length() + 1;
            while (currentCol < startCol) {
                sb.append(" ");
                currentCol++ ;
            }
            char underlineChar = label.primary()
                                 ? '^'
                                 : '-';
            int underlineLen = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(underlineChar)
                            .repeat(underlineLen));
            currentCol += underlineLen;
            if (!label.message()
                      .isEmpty()) {
                sb.append(" ")
                  .append(label.message());
            }
        }
        return sb.toString();
    }
}
