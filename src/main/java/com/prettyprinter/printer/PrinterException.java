package com.prettyprinter.printer;

import com.prettyprinter.ast.Positions;

import java.io.IOException;

/**
 * A fatal condition that aborts a print session. Output written before the failure is
 * incomplete and must be discarded by the caller.
 */
public class PrinterException extends RuntimeException {
    private final int position;

    private PrinterException(String message, int position) {
        super(message);
        this.position = position;
    }

    private PrinterException(String message, Throwable cause) {
        super(message, cause);
        this.position = Positions.UNKNOWN;
    }

    public static PrinterException writeFailed(IOException cause) {
        return new PrinterException("print error - output sink failed: " + cause.getMessage(), cause);
    }

    public static PrinterException unreachable(String what, int position) {
        return new PrinterException("internal printing error: unreachable " + what, position);
    }

    /**
     * Gets the source position the session had reached, or {@link Positions#UNKNOWN}.
     */
    public int getPosition() {
        return position;
    }
}
