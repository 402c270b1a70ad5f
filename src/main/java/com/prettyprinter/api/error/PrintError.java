package com.prettyprinter.api.error;

/**
 * A problem that prevented a document from being printed.
 */
public class PrintError {
    private final Severity severity;
    private final String message;
    private final int position;

    public PrintError(Severity severity, String message) {
        this(severity, message, 0);
    }

    public PrintError(Severity severity, String message, int position) {
        this.severity = severity;
        this.message = message;
        this.position = position;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }

    /** Source position the problem refers to, or 0 when unknown. */
    public int getPosition() { return position; }

    @Override
    public String toString() {
        return severity + ": " + message;
    }
}
