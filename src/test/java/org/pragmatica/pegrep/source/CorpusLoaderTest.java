package org.pragmatica.pegrep.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.pegrep.error.LoadException;
import org.pragmatica.pegrep.lang.JavaLanguage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CorpusLoaderTest {

    @TempDir
    Path root;

    private final CorpusLoader loader = new CorpusLoader(JavaLanguage.instance());

    @Test
    void load_directory_readsOnlyDirectJavaFiles() throws Exception {
        write("b/B.java", "class B {}");
        write("A.java", "class A {}");
        write("notes.txt", "not java");

        var files = loader.loadUntyped(List.of(root), false);

        assertThat(files).extracting(file -> root.relativize(file.path()).toString())
                         .containsExactly("A.java");
    }

    @Test
    void load_recursive_descendsInPathOrder() throws Exception {
        write("z/Z.java", "class Z {}");
        write("b/B.java", "class B {}");
        write("A.java", "class A {}");

        var files = loader.loadUntyped(List.of(root), true);

        assertThat(files).extracting(file -> root.relativize(file.path()).toString().replace('\\', '/'))
                         .containsExactly("A.java", "b/B.java", "z/Z.java");
    }

    @Test
    void load_explicitFile_keepsArgumentOrder() throws Exception {
        var second = write("Second.java", "class Second {}");
        var first = write("First.java", "class First {}");

        var files = loader.loadUntyped(List.of(second, first), false);

        assertEquals(List.of(second, first), files.stream().map(SourceFile::path).toList());
        assertEquals("class Second {}", files.get(0).text());
        assertEquals("OrdinaryUnit", files.get(0).tree().rule());
    }

    @Test
    void load_multiDimensionalArrays_parses() throws Exception {
        write("Grid.java", "class Grid {\n    int[][] cells = new int[1000][];\n    double[][] m = new double[0][];\n}\n");

        var files = loader.loadUntyped(List.of(root), false);

        assertEquals(1, files.size());
    }

    @Test
    void load_missingPath_fails() {
        var missing = root.resolve("nowhere");

        var error = assertThrows(LoadException.class, () -> loader.loadUntyped(List.of(missing), false));

        assertEquals(missing, error.path());
        assertThat(error.getMessage()).contains("cannot find path");
    }

    @Test
    void load_unparsableFile_reportsLocation() throws Exception {
        var broken = write("Broken.java", "class Broken {\n  int x = ;\n}\n");

        var error = assertThrows(LoadException.class, () -> loader.loadUntyped(List.of(root), false));

        assertEquals(broken, error.path());
        assertThat(error.getMessage()).startsWith(broken + ":2:");
    }

    private Path write(String relative, String content) throws IOException {
        var file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
