package com.prettyprinter.codec;

import java.nio.file.Path;

/**
 * Thrown when an AST document cannot be read or does not describe a valid program.
 */
public class AstDocumentException extends Exception {
    private final Path documentPath;

    public AstDocumentException(Path documentPath, String message, Throwable cause) {
        super(message, cause);
        this.documentPath = documentPath;
    }

    public AstDocumentException(Path documentPath, String message) {
        this(documentPath, message, null);
    }

    public Path getDocumentPath() {
        return documentPath;
    }
}
