package com.prettyprinter.api;

import java.util.ArrayList;
import java.util.List;

import com.prettyprinter.api.error.PrintError;

/**
 * Result of printing one document.
 */
public class PrintResult {
    private final boolean successful;
    private final String output;
    private final List<PrintError> errors;

    private PrintResult(Builder builder) {
        this.successful = builder.successful;
        this.output = builder.output;
        this.errors = List.copyOf(builder.errors);
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * Gets the printed text, or {@code null} when printing failed.
     */
    public String getOutput() {
        return output;
    }

    public List<PrintError> getErrors() {
        return errors;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String output;
        private final List<PrintError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder addError(PrintError error) {
            this.errors.add(error);
            return this;
        }

        public PrintResult build() {
            return new PrintResult(this);
        }
    }
}
