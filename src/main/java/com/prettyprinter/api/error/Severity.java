package com.prettyprinter.api.error;

public enum Severity {
    FATAL,   // The print session aborted; its output is discarded
    ERROR    // The document could not be read or is not a program
}
