package org.pragmatica.pegrep.cli;

import org.pragmatica.pegrep.Pegrep;
import org.pragmatica.pegrep.error.CompileException;
import org.pragmatica.pegrep.error.PegrepException;
import org.pragmatica.pegrep.error.TokenizeException;
import org.pragmatica.pegrep.source.CorpusLoader;
import org.pragmatica.pegrep.source.ResultReporter;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/**
 * Search Java sources for a structural pattern.
 */
@CommandLine.Command(name = "pegrep",
    mixinStandardHelpOptions = true,
    version = "pegrep 0.1.0",
    header = "Search Java sources for code matching a pattern",
    description = {
        "Patterns are Java fragments with wildcards:",
        "  $name     any node, bound to name; repeated names must match the same code",
        "  $_        any node, not bound",
        "  $*name    any number of list elements (arguments, statements, members)",
        "  $(name, /regex/)  an identifier whose name matches the regex",
        "A leading # enables aggressive matching: redundant parentheses and",
        "single-statement blocks are ignored."},
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: no errors, with or without matches",
        "1: invalid pattern or unreadable sources",
        "2: usage error"
    })
public class PegrepCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PegrepCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-x"}, paramLabel = "<pattern>", description = "Pattern to search for")
    private List<String> commands = new ArrayList<>();

    @CommandLine.Option(names = {"-r"}, description = "Also search subdirectories of the given directories")
    private boolean recursive;

    @CommandLine.Parameters(paramLabel = "path", description = "Files and directories to search (default: .)")
    private List<String> positional = new ArrayList<>();

    private final Path workingDirectory;

    public PegrepCommand() {
        this(Path.of("")
                 .toAbsolutePath());
    }

    PegrepCommand(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PegrepCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var out = spec.commandLine()
                      .getOut();
        var err = spec.commandLine()
                      .getErr();
        var patterns = new ArrayList<>(commands);
        var paths = new ArrayList<>(positional);
        if (patterns.isEmpty() && !paths.isEmpty()) {
            patterns.add(paths.remove(0));
        }
        if (patterns.isEmpty()) {
            err.println("need at least one command");
            spec.commandLine()
                .usage(err);
            return EXIT_USAGE;
        }
        if (patterns.size() > 1) {
            err.println("command composability is not yet supported");
            return EXIT_ERROR;
        }
        if (paths.isEmpty()) {
            paths.add(".");
        }
        try {
            search(patterns.get(0), paths, out);
            return EXIT_OK;
        } catch (PegrepException e) {
            logger.error("Search failed: {}", e.getMessage());
            report(patterns.get(0), e, err);
            return EXIT_ERROR;
        }
    }

    private void search(String patternText, List<String> paths, PrintWriter out) throws PegrepException {
        var pegrep = Pegrep.forJava();
        var pattern = pegrep.compile(patternText);
        var loader = new CorpusLoader(pegrep.language());
        var reporter = new ResultReporter(workingDirectory);
        var resolved = paths.stream()
                            .map(workingDirectory::resolve)
                            .toList();
        var files = loader.loadUntyped(resolved, recursive);
        for (var file : files) {
            for (var match : pegrep.search(pattern, file.tree())) {
                out.println(reporter.format(file, match));
            }
        }
        out.flush();
    }

    private static void report(String patternText, PegrepException e, PrintWriter err) {
        err.println(e.getMessage());
        if (e instanceof TokenizeException tokenize) {
            err.print(tokenize.diagnostic()
                              .format(patternText, "pattern"));
        } else if (e instanceof CompileException compile) {
            err.print(compile.diagnostic()
                             .format(patternText, "pattern"));
        }
        err.flush();
    }
}
