package com.prettyprinter.util;

import com.prettyprinter.api.error.PrintError;
import com.prettyprinter.api.error.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Utility for formatting error messages consistently.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * Creates a new error formatter.
     *
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats a print error, with its source position when known.
     */
    public String formatError(PrintError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED + ANSI_BOLD, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        if (error.getPosition() > 0) {
            sb.append(" (Position ").append(error.getPosition()).append(")");
        }

        return sb.toString();
    }

    /**
     * Creates a summary of errors per document.
     */
    public String formatErrorSummary(Map<Path, List<PrintError>> documentErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        int totalFatals = 0;
        int totalErrors = 0;

        for (Map.Entry<Path, List<PrintError>> entry : documentErrors.entrySet()) {
            List<PrintError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            long fatals = errors.stream().filter(e -> e.getSeverity() == Severity.FATAL).count();
            long errs = errors.size() - fatals;
            totalFatals += fatals;
            totalErrors += errs;

            sb.append(entry.getKey().getFileName()).append(": ");
            sb.append(_counts(fatals, errs)).append("\n");
        }

        sb.append("\nTotal: ").append(_counts(totalFatals, totalErrors));
        return sb.toString();
    }

    private String _counts(long fatals, long errors) {
        StringBuilder sb = new StringBuilder();
        if (fatals > 0) {
            sb.append(colorize(ANSI_RED, fatals + " fatal"));
        }
        if (errors > 0) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(colorize(ANSI_RED, errors + " errors"));
        }
        if (sb.length() == 0) {
            sb.append(colorize(ANSI_GREEN, "no errors"));
        }
        return sb.toString();
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
