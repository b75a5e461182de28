package com.docview.cli;

import com.docview.bridge.DocumentBridge;
import com.docview.format.FormatResult;
import com.docview.format.IndentStyle;
import com.docview.format.ValidationResult;
import com.docview.gate.TaskGate;
import com.docview.tree.ItemRole;
import com.docview.tree.TreeIndex;
import com.docview.tree.TreeModel;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Command-line front end: formats, minifies, validates or prints the tree of JSON and
 * XML files.
 *
 * Usage:
 *   java -jar docview-bridge.jar [options] <files...>
 *
 * Options:
 *   --mode=format|minify|validate|tree   What to do with each file (default: format)
 *   --indent=spaces:N|tabs               Indentation for format mode (default: spaces:2)
 *   --type=json|xml                      Document type (default: by file extension)
 *   --verbose                            Also print node paths in tree mode
 *
 * The exit code is 1 when any file could not be read or processed.
 */
public class DocviewTool {

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }
        System.exit(new DocviewTool(config, System.out, System.err).run());
    }

    public DocviewTool(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    private static void printUsage() {
        System.out.println("Usage: docview [options] <files...>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --mode=MODE        format, minify, validate or tree (default: format)");
        System.out.println("  --indent=STYLE     spaces:N or tabs (default: spaces:2)");
        System.out.println("  --type=TYPE        json or xml (default: by file extension)");
        System.out.println("  --verbose, -v      Print node paths in tree mode");
        System.out.println("  --help, -h         Show this help");
    }

    /**
     * Processes every file in order through one gate.
     *
     * @return 0 when all files succeeded, 1 otherwise
     */
    public int run() {
        boolean allSucceeded = true;
        try (TaskGate gate = new TaskGate()) {
            DocumentBridge bridge = new DocumentBridge(gate);
            for (Path file : config.files) {
                if (config.files.size() > 1) {
                    out.println("==> " + file + " <==");
                }
                allSucceeded &= process(bridge, file);
            }
        }
        return allSucceeded ? 0 : 1;
    }

    private boolean process(DocumentBridge bridge, Path file) {
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            err.println("[ERROR] Cannot read " + file + ": " + e.getMessage());
            return false;
        }
        DocumentType type = config.type != null ? config.type : typeOf(file);
        if (type == null) {
            err.println("[ERROR] Cannot tell whether " + file + " is JSON or XML; use --type");
            return false;
        }
        try {
            return switch (config.mode) {
                case FORMAT -> report(file, await(type == DocumentType.JSON
                    ? bridge.formatJson(text, config.indent.toString())
                    : bridge.formatXml(text, config.indent.toString())));
                case MINIFY -> report(file, await(type == DocumentType.JSON
                    ? bridge.minifyJson(text)
                    : bridge.minifyXml(text)));
                case VALIDATE -> validate(bridge, file, type, text);
                case TREE -> tree(bridge, file, type, text);
            };
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            err.println("[ERROR] " + file + ": " + cause.getMessage());
            return false;
        }
    }

    private boolean report(Path file, FormatResult result) {
        if (result.success()) {
            out.println(result.result());
            return true;
        }
        err.println("[FAIL] " + file + ": " + result.error());
        return false;
    }

    private boolean validate(DocumentBridge bridge, Path file, DocumentType type, String text) {
        if (type == DocumentType.JSON) {
            ValidationResult result = await(bridge.validateJson(text));
            out.println(bridge.toJson(result));
            return result.isValid();
        }
        boolean loaded = await(bridge.loadXmlTree(text));
        if (loaded) {
            out.println("[OK] " + file + " (" + bridge.xmlModel().totalNodeCount() + " nodes)");
        } else {
            printLoadError(file, bridge.xmlModel());
        }
        return loaded;
    }

    private boolean tree(DocumentBridge bridge, Path file, DocumentType type, String text) {
        TreeModel<?> model = type == DocumentType.JSON ? bridge.jsonModel() : bridge.xmlModel();
        boolean loaded = await(type == DocumentType.JSON ? bridge.loadJsonTree(text) : bridge.loadXmlTree(text));
        if (!loaded) {
            printLoadError(file, model);
            return false;
        }
        printRows(model, TreeIndex.INVALID, 0);
        return true;
    }

    private void printRows(TreeModel<?> model, TreeIndex parent, int depth) {
        for (int row = 0; row < model.rowCount(parent); row++) {
            TreeIndex index = model.index(row, 0, parent);
            StringBuilder line = new StringBuilder("  ".repeat(depth))
                .append(model.data(index, ItemRole.DISPLAY));
            if (config.verbose) {
                line.append("    ").append(model.data(index, ItemRole.PATH));
            }
            out.println(line);
            printRows(model, index, depth + 1);
        }
    }

    private void printLoadError(Path file, TreeModel<?> model) {
        err.println("[FAIL] " + file + ": " + model.lastErrorMessage()
            + " at line " + model.lastErrorLine() + ", column " + model.lastErrorColumn());
    }

    private static <T> T await(CompletableFuture<T> future) {
        return future.join();
    }

    /**
     * Type implied by the file extension, or {@code null} when the extension is not known.
     */
    static DocumentType typeOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return DocumentType.JSON;
        }
        if (name.endsWith(".xml") || name.endsWith(".xsd") || name.endsWith(".xsl") || name.endsWith(".svg")) {
            return DocumentType.XML;
        }
        return null;
    }

    public enum Mode {
        FORMAT,
        MINIFY,
        VALIDATE,
        TREE
    }

    public static class Config {
        Mode mode = Mode.FORMAT;
        IndentStyle indent = IndentStyle.TWO_SPACES;
        DocumentType type;
        boolean verbose = false;
        List<Path> files = new ArrayList<>();

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        System.err.println("Invalid mode: " + mode);
                        return null;
                    }
                } else if (arg.startsWith("--indent=")) {
                    try {
                        config.indent = IndentStyle.parse(arg.substring(9));
                    } catch (IllegalArgumentException e) {
                        System.err.println(e.getMessage());
                        return null;
                    }
                } else if (arg.startsWith("--type=")) {
                    String type = arg.substring(7).toUpperCase(Locale.ROOT);
                    if (!type.equals("JSON") && !type.equals("XML")) {
                        System.err.println("Invalid type: " + type);
                        return null;
                    }
                    config.type = DocumentType.valueOf(type);
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.files.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.files.isEmpty()) {
                System.err.println("Error: No input files specified");
                return null;
            }

            return config;
        }
    }
}
