package org.pragmatica.pegrep.source;

import org.pragmatica.pegrep.match.Match;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Formats matches as {@code file:line:col: text} lines.
 */
public final class ResultReporter {
    private final Path workingDirectory;

    public ResultReporter(Path workingDirectory) {
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    public String format(SourceFile file, Match match) {
        var position = match.position();
        return displayPath(file.path()) + ":" + position.line() + ":" + position.column() + ": "
               + render(match.node(), file.text());
    }

    /**
     * Source text of a node on a single line: every line trimmed, blank lines dropped,
     * the rest joined by single spaces.
     */
    public static String render(SyntaxNode node, String source) {
        return node.span()
                   .extract(source)
                   .lines()
                   .map(String::strip)
                   .filter(line -> !line.isEmpty())
                   .collect(Collectors.joining(" "));
    }

    /**
     * Files under the working directory are shown relative to it.
     */
    String displayPath(Path path) {
        var absolute = path.toAbsolutePath()
                           .normalize();
        if (absolute.startsWith(workingDirectory)) {
            return workingDirectory.relativize(absolute)
                                   .toString();
        }
        return path.toString();
    }
}
