package org.pyken.cli;

import org.pyken.ArtifactWriteException;
import org.pyken.PyKen;
import org.pyken.TranspileReport;
import org.pyken.TranspilerOptions;
import org.pyken.diagnostic.Diagnostic;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line front end: {@code pyken [options] <path>}.
 * <p>
 * Exit status is 0 when every function was emitted, 1 when any fatal
 * diagnostic was reported and 2 for invocation errors.
 */
public final class Main {

    static final int OK = 0;
    static final int FATAL_DIAGNOSTICS = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = String.join("\n",
            "Usage: pyken [options] <path>",
            "",
            "Translates Python validator sources (a .py file or a directory) to Aiken.",
            "",
            "Options:",
            "  -o, --output <dir>  output directory (default: " + TranspilerOptions.DEFAULT_OUTPUT + ")",
            "      --strict        treat warnings as fatal",
            "  -j, --jobs <n>      number of worker threads (default: available processors)",
            "      --json          print the report as JSON on stdout",
            "  -h, --help          show this help");

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        TranspilerOptions.Builder options;
        try {
            options = TranspilerOptions.builder();
        } catch (IllegalArgumentException e) {
            err.println("pyken: " + e.getMessage());
            return USAGE;
        }

        boolean json = false;
        String input = null;
        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-h":
                    case "--help":
                        out.println(USAGE_TEXT);
                        return OK;
                    case "-o":
                    case "--output":
                        options.output(Paths.get(value(args, ++i, arg)));
                        break;
                    case "--strict":
                        options.strict(true);
                        break;
                    case "-j":
                    case "--jobs":
                        options.parallelism(jobs(value(args, ++i, arg)));
                        break;
                    case "--json":
                        json = true;
                        break;
                    default:
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (input != null) {
                            throw new IllegalArgumentException("Only one input path may be given");
                        }
                        input = arg;
                }
            }
            if (input == null) {
                throw new IllegalArgumentException("No input path given");
            }
        } catch (IllegalArgumentException e) {
            err.println("pyken: " + e.getMessage());
            err.println(USAGE_TEXT);
            return USAGE;
        }

        TranspileReport report;
        try {
            report = new PyKen(options.build()).run(Path.of(input));
        } catch (IllegalArgumentException | ArtifactWriteException e) {
            err.println("pyken: " + e.getMessage());
            return USAGE;
        }

        for (Diagnostic diagnostic : report.diagnostics()) {
            err.println(diagnostic.format());
        }
        if (json) {
            out.println(report.toJson());
        } else {
            out.printf("%d file(s), %d artifact(s), %d function(s) emitted, %d excluded%n",
                       report.filesProcessed(), report.artifactsWritten(),
                       report.functionsEmitted(), report.functionsExcluded());
        }
        return report.exitCode() == 0 ? OK : FATAL_DIAGNOSTICS;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static int jobs(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + value, e);
        }
    }
}
