package org.pragmatica.pegrep.grammar;

import org.pragmatica.pegrep.tree.SourceSpan;

/**
 * A grammar rule: Name <- Expression
 */
public record Rule(SourceSpan span, String name, Expression expression) {}
