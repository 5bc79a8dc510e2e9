package com.sleuth;

import com.sleuth.json.JsonNode;
import com.sleuth.json.SleuthJsonParser;
import com.sleuth.output.OutputFormatter;
import com.sleuth.path.PathParseException;
import com.sleuth.path.PathValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "sleuth", mixinStandardHelpOptions = true, version = "1.0",
         description = "Resolve JSONPath expressions and enumerate paths in JSON documents",
         subcommands = {Sleuth.Resolve.class, Sleuth.Find.class, Sleuth.Extract.class})
public class Sleuth implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Sleuth.class);

    static final int EXIT_ERROR = 1;
    static final int EXIT_BAD_PATH = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    boolean sortKeys = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Sleuth()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    OutputFormatter formatter() {
        return new OutputFormatter(!compactOutput, sortKeys);
    }

    static JsonNode readDocument(File inputFile) throws IOException {
        SleuthJsonParser parser = new SleuthJsonParser();
        if (inputFile == null) {
            return parser.parse(System.in, false);
        }
        try (InputStream input = new FileInputStream(inputFile)) {
            return parser.parse(input);
        }
    }

    static int fail(CommandSpec spec, Exception e) {
        LOGGER.debug("Command {} failed", spec.name(), e);
        spec.commandLine().getErr().println("Error: " + e.getMessage());
        return e instanceof PathParseException ? EXIT_BAD_PATH : EXIT_ERROR;
    }

    @Command(name = "resolve", mixinStandardHelpOptions = true,
             description = "Print every value matched by a path expression")
    static class Resolve implements Callable<Integer> {
        @ParentCommand
        Sleuth parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "The path expression, e.g. $.store.book[*].title")
        String path;

        @Parameters(index = "1", arity = "0..1", description = "Input JSON file (default: stdin)")
        File inputFile;

        @Option(names = {"-r", "--raw-output"}, description = "Output raw strings, not JSON texts")
        boolean rawOutput = false;

        @Override
        public Integer call() {
            try {
                JsonNode document = readDocument(inputFile);
                OutputFormatter formatter = parent.formatter();
                PrintWriter out = spec.commandLine().getOut();
                for (JsonNode result : JsonPathSleuth.resolveJsonPath(document, path)) {
                    if (rawOutput && result instanceof JsonNode.JsonString s) {
                        out.println(s.value());
                    } else {
                        out.println(formatter.format(result));
                    }
                }
                out.flush();
                return 0;
            } catch (IOException | RuntimeException e) {
                return fail(spec, e);
            }
        }
    }

    @Command(name = "find", mixinStandardHelpOptions = true,
             description = "Print the canonical path of every node equal to a JSON value")
    static class Find implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "The value to look for, as JSON text, e.g. 1 or '\"red\"'")
        String value;

        @Parameters(index = "1", arity = "0..1", description = "Input JSON file (default: stdin)")
        File inputFile;

        @Override
        public Integer call() {
            try {
                JsonNode target = new SleuthJsonParser().parse(value);
                JsonNode document = readDocument(inputFile);
                PrintWriter out = spec.commandLine().getOut();
                JsonPathSleuth.findJsonPathsByValue(document, target).forEach(out::println);
                out.flush();
                return 0;
            } catch (IOException | RuntimeException e) {
                return fail(spec, e);
            }
        }
    }

    @Command(name = "extract", mixinStandardHelpOptions = true,
             description = "Print the canonical path and value of every leaf, tab separated")
    static class Extract implements Callable<Integer> {
        @ParentCommand
        Sleuth parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "Input JSON file (default: stdin)")
        File inputFile;

        @Override
        public Integer call() {
            try {
                JsonNode document = readDocument(inputFile);
                OutputFormatter formatter = parent.formatter();
                PrintWriter out = spec.commandLine().getOut();
                for (PathValue pair : JsonPathSleuth.extractJsonPathsAndValues(document)) {
                    out.println(formatter.format(pair));
                }
                out.flush();
                return 0;
            } catch (IOException | RuntimeException e) {
                return fail(spec, e);
            }
        }
    }
}
