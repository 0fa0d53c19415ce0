package org.pragmatica.pegrep.source;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegrep.Pegrep;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ResultReporterTest {

    private final Pegrep pegrep = Pegrep.forJava();

    @Test
    void format_multiLineMatch_isJoinedOnOneLine() throws Exception {
        var text = "class A {\n    void run() {\n        call(a,\n\n             b);\n    }\n}\n";
        var file = new SourceFile(Path.of("/work/src/A.java"), text, pegrep.language().parser().parse(text));
        var match = pegrep.search(pegrep.compile("call($*_)"), file.tree()).get(0);

        var line = new ResultReporter(Path.of("/work")).format(file, match);

        assertEquals("src/A.java:3:9: call(a, b)", line.replace('\\', '/'));
    }

    @Test
    void displayPath_outsideWorkingDirectory_isKept() {
        var reporter = new ResultReporter(Path.of("/work"));

        assertEquals(Path.of("/elsewhere/B.java").toString(), reporter.displayPath(Path.of("/elsewhere/B.java")));
        assertEquals("B.java", reporter.displayPath(Path.of("/work/B.java")));
    }
}
