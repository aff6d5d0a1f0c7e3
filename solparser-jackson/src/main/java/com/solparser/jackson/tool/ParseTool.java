package com.solparser.jackson.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.flogger.GoogleLogger;
import com.solparser.Diagnostic;
import com.solparser.ErrorReporter;
import com.solparser.Parser;
import com.solparser.ParserOptions;
import com.solparser.ast.SourceUnit;
import com.solparser.jackson.SolparserJackson;
import com.solparser.version.SemVerVersion;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

/**
 * Batch front end: parses every source file given on the command line, prints its
 * diagnostics and optionally its AST as JSON.
 *
 * Usage:
 *   java -cp ... com.solparser.jackson.tool.ParseTool [options] <files or dirs...>
 *
 * Options:
 *   --recovery                 Keep parsing after syntax errors
 *   --json                     Print the AST of each file as JSON
 *   --threads=N                Number of worker threads (default: available processors)
 *   --compiler-version=X.Y.Z   Version that version pragmas are checked against
 *   --extensions=ext,...       File extensions picked up in directories (default: sol)
 *   --verbose                  Also report files without diagnostics
 *
 * Exits with 1 if any file has errors, 2 on bad usage.
 */
public class ParseTool {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private static final ObjectMapper mapper = SolparserJackson.createObjectMapper();

    private final Config config;
    private final ExecutorService executor;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage(System.out);
            System.exit(2);
        }
        ParseTool tool = new ParseTool(config);
        try {
            System.exit(tool.run(System.out, System.err));
        } catch (IOException e) {
            System.err.println("Fatal error: " + e.getMessage());
            System.exit(1);
        } finally {
            tool.shutdown();
        }
    }

    public ParseTool(Config config) {
        this.config = config;
        this.executor = Executors.newFixedThreadPool(config.threads);
    }

    /**
     * Parses all configured files, one parser per file, and prints results in file
     * order. Returns the process exit code.
     */
    public int run(PrintStream out, PrintStream err) throws IOException {
        List<Path> files = discoverFiles(err);
        logger.atFine().log("Parsing %d files on %d threads", files.size(), config.threads);

        List<Future<FileResult>> futures = new ArrayList<>();
        for (Path file : files) {
            futures.add(executor.submit(() -> processFile(file)));
        }

        boolean anyErrors = false;
        for (int i = 0; i < futures.size(); i++) {
            FileResult result;
            try {
                result = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while parsing " + files.get(i));
            } catch (ExecutionException e) {
                throw new IOException("Failed to parse " + files.get(i), e.getCause());
            }
            anyErrors |= result.hasErrors();
            printResult(result, out);
        }
        return anyErrors ? 1 : 0;
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private FileResult processFile(Path file) throws IOException {
        String source = Files.readString(file);
        ErrorReporter reporter = new ErrorReporter();
        SourceUnit unit = Parser.parse(source, file.toString(), reporter, config.parserOptions());
        String json = null;
        if (config.json && unit != null) {
            try {
                json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(unit);
            } catch (JsonProcessingException e) {
                throw new IOException("Failed to write AST of " + file, e);
            }
        }
        return new FileResult(file, reporter.diagnostics(), reporter.hasErrors(), json);
    }

    private void printResult(FileResult result, PrintStream out) {
        for (Diagnostic diagnostic : result.diagnostics()) {
            out.println(diagnostic.format());
        }
        if (config.verbose && result.diagnostics().isEmpty()) {
            out.println("[OK] " + result.file());
        }
        if (result.json() != null) {
            out.println(result.json());
        }
    }

    private List<Path> discoverFiles(PrintStream err) throws IOException {
        List<Path> files = new ArrayList<>();

        for (Path input : config.inputs) {
            if (!Files.exists(input)) {
                err.println("Warning: Input does not exist: " + input);
                continue;
            }
            if (Files.isRegularFile(input)) {
                files.add(input);
                continue;
            }
            try (Stream<Path> paths = Files.walk(input)) {
                paths.filter(Files::isRegularFile)
                     .filter(this::hasValidExtension)
                     .sorted()
                     .forEach(files::add);
            }
        }
        return files;
    }

    private boolean hasValidExtension(Path path) {
        String name = path.getFileName().toString();
        return config.extensions.stream().anyMatch(ext -> name.endsWith("." + ext));
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: ParseTool [options] <files or dirs...>");
        out.println();
        out.println("Options:");
        out.println("  --recovery                 Keep parsing after syntax errors");
        out.println("  --json                     Print the AST of each file as JSON");
        out.println("  --threads=N                Number of worker threads (default: CPU count)");
        out.println("  --compiler-version=X.Y.Z   Version checked by version pragmas (default: "
            + ParserOptions.defaults().compilerVersion() + ")");
        out.println("  --extensions=ext,...       File extensions to process (default: sol)");
        out.println("  --verbose                  Also report files without diagnostics");
        out.println("  --help                     Show this help");
    }

    public record FileResult(Path file, List<Diagnostic> diagnostics, boolean hasErrors, String json) {}

    public static class Config {
        boolean recovery = false;
        boolean json = false;
        int threads = Runtime.getRuntime().availableProcessors();
        SemVerVersion compilerVersion = ParserOptions.defaults().compilerVersion();
        List<String> extensions = List.of("sol");
        List<Path> inputs = new ArrayList<>();
        boolean verbose = false;

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.equals("--recovery")) {
                    config.recovery = true;
                } else if (arg.equals("--json")) {
                    config.json = true;
                } else if (arg.startsWith("--threads=")) {
                    try {
                        config.threads = Integer.parseInt(arg.substring(10));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid thread count: " + arg.substring(10));
                        return null;
                    }
                    if (config.threads < 1) {
                        System.err.println("Thread count must be positive");
                        return null;
                    }
                } else if (arg.startsWith("--compiler-version=")) {
                    try {
                        config.compilerVersion = SemVerVersion.parse(arg.substring(19));
                    } catch (IllegalArgumentException e) {
                        System.err.println("Invalid compiler version: " + arg.substring(19));
                        return null;
                    }
                } else if (arg.startsWith("--extensions=")) {
                    config.extensions = Arrays.asList(arg.substring(13).split(","));
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.inputs.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.inputs.isEmpty()) {
                System.err.println("Error: No input files specified");
                return null;
            }

            return config;
        }

        ParserOptions parserOptions() {
            ParserOptions defaults = ParserOptions.defaults();
            return new ParserOptions(recovery, defaults.maxRecursionDepth(), compilerVersion, defaults.assemblyParser());
        }
    }
}
