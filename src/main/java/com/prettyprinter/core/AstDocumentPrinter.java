package com.prettyprinter.core;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.prettyprinter.api.DocumentPrinter;
import com.prettyprinter.api.PrintResult;
import com.prettyprinter.api.error.PrintError;
import com.prettyprinter.api.error.Severity;
import com.prettyprinter.ast.Program;
import com.prettyprinter.codec.AstDocumentException;
import com.prettyprinter.codec.AstDocumentReader;
import com.prettyprinter.config.FormattingConfig;
import com.prettyprinter.printer.PrettyPrinter;
import com.prettyprinter.printer.PrinterException;
import com.prettyprinter.util.LoggerUtil;

/**
 * Prints AST documents with a fixed configuration. Each document is printed in its own
 * session, so one instance may serve several threads.
 */
public class AstDocumentPrinter implements DocumentPrinter {
    private static final Logger logger = LoggerUtil.getLogger(AstDocumentPrinter.class);

    private final FormattingConfig config;
    private final AstDocumentReader reader;

    private final AtomicInteger processedCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public AstDocumentPrinter(FormattingConfig config) {
        this(config, new AstDocumentReader());
    }

    public AstDocumentPrinter(FormattingConfig config, AstDocumentReader reader) {
        this.config = config;
        this.reader = reader;
        logger.fine("Document printer initialized with " + config);
    }

    @Override
    public PrintResult printDocument(Path documentPath, String content) {
        processedCount.incrementAndGet();

        Program program;
        try {
            program = reader.read(documentPath, content, AstDocumentReader.formatOf(documentPath));
        } catch (AstDocumentException e) {
            errorCount.incrementAndGet();
            logger.warning("Failed to read " + documentPath + " - " + e.getMessage());
            return PrintResult.builder()
                    .successful(false)
                    .addError(new PrintError(Severity.ERROR, e.getMessage()))
                    .build();
        }

        return _print(documentPath, program);
    }

    /**
     * Prints an already loaded program.
     */
    public PrintResult printProgram(Path documentPath, Program program) {
        processedCount.incrementAndGet();
        return _print(documentPath, program);
    }

    private PrintResult _print(Path documentPath, Program program) {
        try {
            String output = PrettyPrinter.print(program, config);
            successCount.incrementAndGet();
            logger.fine("Successfully printed: " + documentPath);

            return PrintResult.builder()
                    .successful(true)
                    .output(output)
                    .build();
        } catch (PrinterException e) {
            // partial output is discarded
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Printing aborted: " + documentPath, e);

            return PrintResult.builder()
                    .successful(false)
                    .addError(new PrintError(Severity.FATAL, e.getMessage(), e.getPosition()))
                    .build();
        }
    }

    public FormattingConfig getConfig() {
        return config;
    }

    /**
     * Gets the number of documents processed.
     */
    public int getProcessedCount() {
        return processedCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    /**
     * Gets the number of documents that could not be read or printed.
     */
    public int getErrorCount() {
        return errorCount.get();
    }
}
