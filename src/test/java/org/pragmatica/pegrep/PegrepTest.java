package org.pragmatica.pegrep;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegrep.error.CompileException;
import org.pragmatica.pegrep.error.TokenizeException;
import org.pragmatica.pegrep.lang.JavaLanguage;

import static org.junit.jupiter.api.Assertions.*;

class PegrepTest {

    @Test
    void forJava_usesJavaLanguage() {
        assertSame(JavaLanguage.instance(), Pegrep.forJava().language());
    }

    @Test
    void search_compiledPatternIsReusable() throws Exception {
        var pegrep = Pegrep.forJava();
        var pattern = pegrep.compile("$x != null");
        var parser = pegrep.language().parser();

        var first = pegrep.search(pattern, parser.parse("class A { boolean f(Object a) { return a != null; } }"));
        var second = pegrep.search(pattern, parser.parse("class B { void g() { if (b != null && c != null) {} } }"));

        assertEquals(1, first.size());
        assertEquals(2, second.size());
    }

    @Test
    void compile_reportsTokenizeAndCompileErrorsSeparately() {
        var pegrep = Pegrep.forJava();

        assertThrows(TokenizeException.class, () -> pegrep.compile("\"open"));
        assertThrows(CompileException.class, () -> pegrep.compile("a +"));
    }
}
