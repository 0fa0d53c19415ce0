package org.pragmatica.pegrep.source;

import org.pragmatica.pegrep.error.LoadException;
import org.pragmatica.pegrep.error.ParseException;
import org.pragmatica.pegrep.lang.HostLanguage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves command line paths to parsed source files.
 *
 * <p>A file path is loaded as is. A directory contributes the source files directly inside it,
 * or every source file below it when loading recursively. Files of one directory are loaded
 * in path order.
 */
public final class CorpusLoader {
    private static final Logger logger = LogManager.getLogger(CorpusLoader.class);

    private final HostLanguage language;

    public CorpusLoader(HostLanguage language) {
        this.language = language;
    }

    public List<SourceFile> loadUntyped(List<Path> paths, boolean recursive) throws LoadException {
        var files = new ArrayList<SourceFile>();
        for (var path : paths) {
            for (var file : resolve(path, recursive)) {
                files.add(load(file));
            }
        }
        return List.copyOf(files);
    }

    private List<Path> resolve(Path path, boolean recursive) throws LoadException {
        if (!Files.exists(path)) {
            throw LoadException.missing(path);
        }
        if (!Files.isDirectory(path)) {
            return List.of(path);
        }
        try (Stream<Path> entries = recursive
                                    ? Files.walk(path)
                                    : Files.list(path)) {
            return entries.filter(Files::isRegularFile)
                          .filter(file -> file.getFileName().toString().endsWith(language.fileExtension()))
                          .sorted()
                          .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new LoadException(path, "cannot list directory " + path + ": " + e.getMessage(), e);
        }
    }

    private SourceFile load(Path file) throws LoadException {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoadException(file, "cannot read " + file + ": " + e.getMessage(), e);
        }
        try {
            var tree = language.parser()
                               .parse(text);
            logger.debug("Loaded {}", file);
            return new SourceFile(file, text, tree);
        } catch (ParseException e) {
            throw LoadException.unparsable(file, e);
        }
    }
}
