package com.prettyprinter.printer;

import com.prettyprinter.ast.Comment;
import com.prettyprinter.ast.Expr;
import com.prettyprinter.ast.Positions;
import com.prettyprinter.ast.Program;
import com.prettyprinter.ast.Token;
import com.prettyprinter.config.FormattingConfig;
import com.prettyprinter.output.TabWriter;
import com.prettyprinter.util.LoggerUtil;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Entry points of the pretty printer. Each call is an independent print session writing
 * through a column-aligning {@link TabWriter} that is flushed before returning. An aborted
 * session surfaces as {@link PrinterException}.
 */
public final class PrettyPrinter {
    private static final Logger logger = LoggerUtil.getLogger(PrettyPrinter.class);

    private PrettyPrinter() {
    }

    /**
     * Prints a whole program, including its comments, to {@code out}.
     */
    public static void print(Writer out, boolean html, Program program, FormattingConfig config) {
        FormattingConfig effective = config.withHtml(html);
        logger.fine(() -> "Printing package " + program.name().name() + " with " + effective);

        _session(out, effective, program.comments(), printer -> {
            printer.htmlPrologue("package " + program.name().name());
            new AstPrinter(printer).program(program);
            printer.htmlEpilogue();
        });
    }

    public static String print(Program program, FormattingConfig config) {
        StringWriter out = new StringWriter();
        print(out, config.isHtml(), program, config);
        return out.toString();
    }

    /**
     * Prints a single expression without comments.
     */
    public static void printExpression(Writer out, Expr x, FormattingConfig config) {
        _session(out, config, List.of(), printer -> new AstPrinter(printer).expr(x));
    }

    public static String printExpression(Expr x, FormattingConfig config) {
        StringWriter out = new StringWriter();
        printExpression(out, x, config);
        return out.toString();
    }

    /**
     * Prints the text of a single token.
     */
    public static void printToken(Writer out, Token tok, FormattingConfig config) {
        _session(out, config, List.of(), printer -> printer.token(Positions.UNKNOWN, tok));
    }

    public static String printToken(Token tok, FormattingConfig config) {
        StringWriter out = new StringWriter();
        printToken(out, tok, config);
        return out.toString();
    }

    private static void _session(Writer out, FormattingConfig config, List<Comment> comments,
                                 Consumer<Printer> body) {
        char padChar = config.isUseTabs() ? '\t' : ' ';
        TabWriter tabs = new TabWriter(out, config.getTabWidth(), 1, padChar, config.isHtml());
        Printer printer = new Printer(tabs, config, comments);

        body.accept(printer);
        printer.flush();
        try {
            tabs.flush();
        } catch (IOException e) {
            throw PrinterException.writeFailed(e);
        }
    }
}
