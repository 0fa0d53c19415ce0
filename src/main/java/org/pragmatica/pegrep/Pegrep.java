package org.pragmatica.pegrep;

import org.pragmatica.pegrep.error.CompileException;
import org.pragmatica.pegrep.error.TokenizeException;
import org.pragmatica.pegrep.lang.HostLanguage;
import org.pragmatica.pegrep.lang.JavaLanguage;
import org.pragmatica.pegrep.match.Match;
import org.pragmatica.pegrep.match.SearchEngine;
import org.pragmatica.pegrep.pattern.CompiledPattern;
import org.pragmatica.pegrep.pattern.PatternCompiler;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.List;

/**
 * Entry point for structural search.
 *
 * <p>Example usage:
 * <pre>{@code
 * var pegrep = Pegrep.forJava();
 * var pattern = pegrep.compile("$x.equals($x)");
 * var tree = pegrep.language().parser().parse(source);
 *
 * for (var match : pegrep.search(pattern, tree)) {
 *     System.out.println(match.position());
 * }
 * }</pre>
 *
 * <p>A compiled pattern may be searched against any number of trees, from any number of threads.
 */
public final class Pegrep {
    private final HostLanguage language;
    private final PatternCompiler compiler;
    private final SearchEngine engine;

    private Pegrep(HostLanguage language) {
        this.language = language;
        this.compiler = new PatternCompiler(language);
        this.engine = new SearchEngine(language);
    }

    public static Pegrep forJava() {
        return forLanguage(JavaLanguage.instance());
    }

    public static Pegrep forLanguage(HostLanguage language) {
        return new Pegrep(language);
    }

    public CompiledPattern compile(String pattern) throws TokenizeException, CompileException {
        return compiler.compile(pattern);
    }

    public List<Match> search(CompiledPattern pattern, SyntaxNode tree) {
        return engine.search(pattern, tree);
    }

    public HostLanguage language() {
        return language;
    }
}
