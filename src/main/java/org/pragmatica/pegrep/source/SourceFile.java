package org.pragmatica.pegrep.source;

import org.pragmatica.pegrep.tree.SyntaxNode;

import java.nio.file.Path;

/**
 * A parsed corpus file.
 *
 * @param path file location as given or discovered
 * @param text file contents
 * @param tree syntax tree of the whole file
 */
public record SourceFile(Path path, String text, SyntaxNode tree) {}
