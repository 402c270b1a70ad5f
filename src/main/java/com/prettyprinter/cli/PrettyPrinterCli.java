package com.prettyprinter.cli;

import com.prettyprinter.api.PrintResult;
import com.prettyprinter.api.error.PrintError;
import com.prettyprinter.config.ConfigurationLoader;
import com.prettyprinter.config.FormattingConfig;
import com.prettyprinter.core.AstDocumentPrinter;
import com.prettyprinter.util.ErrorFormatter;
import com.prettyprinter.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface of the pretty printer.
 */
public class PrettyPrinterCli {
    private static final Logger logger = LoggerUtil.getLogger(PrettyPrinterCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".prettyprinter.yml";
    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args) {
        if (args.length < 1) {
            _printUsage();
            return 1;
        }

        // Check for color disabling early
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        } else {
            LoggerUtil.setConsoleLevel(Level.WARNING);
        }

        try {
            String command = args[0];
            switch (command) {
                case "print":
                    return _printDocuments(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (_hasOption(args, "--verbose")) {
                e.printStackTrace();
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return 1;
        }
    }

    private static void _printVersion() {
        System.out.println("Pretty Printer version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Pretty Printer CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  prettyprinter print <ast-document>... - Print programs from JSON or YAML AST documents");
        System.out.println("  prettyprinter init [--force]          - Initialize configuration file");
        System.out.println("  prettyprinter --help|-h               - Show this help");
        System.out.println("  prettyprinter --version|-v            - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                       - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --output=<file>                       - Write the output to a file (single document only)");
        System.out.println("  --html                                - Produce HTML output");
        System.out.println("  --verbose                             - Show detailed output");
        System.out.println("  --no-color                            - Disable colored output");
        System.out.println("  --force                               - Force overwrite (with init command)");
    }

    private static int _printDocuments(String[] args) throws IOException {
        List<Path> documents = _positionalArguments(args);
        if (documents.isEmpty()) {
            _printError("Error: Missing AST document argument");
            _printUsage();
            return 1;
        }

        String outputFile = _getOptionValue(args, "--output");
        if (outputFile != null && documents.size() > 1) {
            _printError("Error: --output requires a single AST document");
            return 1;
        }

        FormattingConfig config = _loadConfig(args);
        if (_hasOption(args, "--html")) {
            config = config.withHtml(true);
        }
        AstDocumentPrinter printer = new AstDocumentPrinter(config);

        Map<Path, List<PrintError>> failures = new LinkedHashMap<>();
        for (Path document : documents) {
            if (!Files.isRegularFile(document)) {
                _printError("Error: AST document does not exist: " + document);
                failures.put(document, List.of());
                continue;
            }

            String content = Files.readString(document, StandardCharsets.UTF_8);
            PrintResult result = printer.printDocument(document, content);
            if (!result.isSuccessful()) {
                _printError("Failed to print " + document + ":");
                for (PrintError error : result.getErrors()) {
                    _printError("  " + errorFormatter.formatError(error));
                }
                failures.put(document, result.getErrors());
                continue;
            }

            if (outputFile != null) {
                Files.writeString(Paths.get(outputFile), result.getOutput(), StandardCharsets.UTF_8);
                _printSuccess("Printed " + document + " to " + outputFile);
            } else {
                System.out.print(result.getOutput());
            }
        }

        logger.info("Printed documents: processed=" + printer.getProcessedCount()
                + ", success=" + printer.getSuccessCount() + ", errors=" + printer.getErrorCount());

        if (failures.isEmpty()) {
            return 0;
        }
        if (documents.size() > 1) {
            System.out.println();
            System.out.println(errorFormatter.formatErrorSummary(failures));
        }
        return 1;
    }

    private static FormattingConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        if (configFile != null && !Files.exists(configPath)) {
            _printWarning("Configuration file not found: " + configFile + ", using defaults");
        }
        return ConfigurationLoader.loadConfig(configPath);
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return 0;
        }

        FormattingConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    private static List<Path> _positionalArguments(String[] args) {
        List<Path> paths = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            if (!args[i].startsWith("--")) {
                paths.add(Paths.get(args[i]));
            }
        }
        return paths;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.err.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.err.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.err.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
