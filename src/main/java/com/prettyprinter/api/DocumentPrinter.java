package com.prettyprinter.api;

import java.nio.file.Path;

/**
 * Prints serialized syntax trees.
 */
public interface DocumentPrinter {
    /**
     * Prints the program held by {@code content}; the path selects the document format
     * and is used in messages.
     */
    PrintResult printDocument(Path documentPath, String content);
}
