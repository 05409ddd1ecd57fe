package info.isaksson.erland.yangprinter;

import info.isaksson.erland.yangprinter.json.SchemaJson;
import info.isaksson.erland.yangprinter.model.Module;
import info.isaksson.erland.yangprinter.yang.YangPrinter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: load a JSON schema model and print its modules as YANG.
 */
public final class Main {

    private static final YangPrinter PRINTER = new YangPrinter();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        return run(args, System.out);
    }

    static int run(String[] args, PrintStream stdout) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp(System.err);
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp(stdout);
            return 0;
        }

        if (parsed.model == null) {
            System.err.println("Error: --model is required.");
            System.err.println();
            CliArgs.printHelp(System.err);
            return 1;
        }

        final Path modelPath;
        try {
            modelPath = Paths.get(parsed.model).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            System.err.println("Error: invalid --model path: " + e.getMessage());
            return 1;
        }
        if (!Files.exists(modelPath) || Files.isDirectory(modelPath)) {
            System.err.println("Error: --model must point to an existing JSON file: " + modelPath);
            return 1;
        }

        final List<Module> modules;
        try {
            modules = SchemaJson.read(modelPath);
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: could not load model: " + modelPath);
            System.err.println(e.getMessage());
            return 2;
        }

        final List<Module> selected = select(modules, parsed.module);
        if (selected.isEmpty()) {
            System.err.println(parsed.module == null
                    ? "Error: model contains no modules: " + modelPath
                    : "Error: no module named " + parsed.module + " in " + modelPath);
            return 1;
        }

        if (parsed.output == null) {
            try {
                for (Module m : selected) {
                    PRINTER.print(m, stdout);
                }
            } catch (RuntimeException | IOException e) {
                System.err.println("Error: could not write to stdout.");
                System.err.println(e.getMessage());
                return 2;
            }
            // PrintStream reports write failures only through checkError()
            if (stdout.checkError()) {
                System.err.println("Error: could not write to stdout.");
                return 2;
            }
            return 0;
        }

        final boolean singleFile = parsed.output.toLowerCase().endsWith(".yang");
        if (singleFile && selected.size() != 1) {
            System.err.println("Error: --output " + parsed.output + " names a single file but " + selected.size()
                    + " modules are selected; use --module or an output directory.");
            return 1;
        }

        final Path outputPath;
        try {
            outputPath = Paths.get(parsed.output).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            System.err.println("Error: invalid --output path: " + e.getMessage());
            return 1;
        }

        final List<Path> written = new ArrayList<>();
        for (Module m : selected) {
            Path out = outputPath;
            try {
                out = resolveYangOutput(outputPath, singleFile, m);
                PRINTER.write(m, out);
            } catch (RuntimeException | IOException e) {
                System.err.println("Error: could not write YANG for module " + m.name + " to: " + out);
                System.err.println(e.getMessage());
                return 2;
            }
            written.add(out);
        }

        StringBuilder summary = new StringBuilder("yang-printer\n");
        summary.append("- Model: ").append(modelPath).append('\n');
        for (Path p : written) {
            summary.append("- YANG: ").append(p).append('\n');
        }
        stdout.print(summary);
        return 0;
    }

    private static List<Module> select(List<Module> modules, String name) {
        if (name == null) return modules;
        List<Module> out = new ArrayList<>();
        for (Module m : modules) {
            if (m.name.equals(name)) out.add(m);
        }
        return out;
    }

    private static Path resolveYangOutput(Path output, boolean singleFile, Module module) {
        // A path ending with .yang is the file itself; anything else is a directory.
        if (singleFile) {
            return output;
        }
        return output.resolve(module.name + ".yang");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String model;
        String module;
        String output;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--model":
                        out.model = requireValue(args, ++i, "--model");
                        break;
                    case "--module":
                        out.module = requireValue(args, ++i, "--module");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --model
                        if (out.model == null) {
                            out.model = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static void printHelp(PrintStream out) {
            out.println(
                    "yang-printer\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar yang-printer.jar --model <model.json> [--module <name>] [--output <dir|file.yang>]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --model <path>         JSON schema model to print (required)\n" +
                    "  --module <name>        Print only the named module (default: all modules)\n" +
                    "  --output <path>        A path ending in .yang is written as a single file;\n" +
                    "                         any other path is a directory receiving <module>.yang\n" +
                    "                         per module. Default: print to stdout.\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/yang-printer.jar --model model.json\n" +
                    "  java -jar target/yang-printer.jar model.json --module ietf-system --output out/system.yang\n"
            );
        }
    }
}
