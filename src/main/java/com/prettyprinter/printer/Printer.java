package com.prettyprinter.printer;

import com.prettyprinter.ast.Comment;
import com.prettyprinter.ast.Expr;
import com.prettyprinter.ast.Positions;
import com.prettyprinter.ast.Symbol;
import com.prettyprinter.ast.Token;
import com.prettyprinter.config.FormattingConfig;
import com.prettyprinter.util.LoggerUtil;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Low-level output of a print session.
 *
 * <p>Every string goes through {@link #taggedString}, which prints the pending separator,
 * interleaves the comments positioned before the string, applies the semantic state and
 * pending newlines, and finally writes the string. Tabs written here are cell boundaries
 * for the column-aligning sink.
 */
public class Printer {
    private static final Logger logger = LoggerUtil.getLogger(Printer.class);
    private static final Pattern TAB_RUN = Pattern.compile("\t{2,}");

    private final Writer out;
    private final FormattingConfig config;
    private final List<Comment> comments;
    private final PrinterState state = new PrinterState();

    public Printer(Writer out, FormattingConfig config, List<Comment> comments) {
        this.out = out;
        this.config = config;
        this.comments = comments != null ? comments : List.of();
        nextComment();
    }

    public PrinterState state() {
        return state;
    }

    public FormattingConfig config() {
        return config;
    }

    // ----------------------------------------------------------------------------
    // Comments

    private boolean hasComment(int pos) {
        return config.isPrintComments() && state.getCommentPosition() < pos;
    }

    private void nextComment() {
        int index = state.getCommentIndex() + 1;
        int next = index < comments.size() ? comments.get(index).pos() : Positions.INFINITY;
        state.advanceComment(next);
    }

    // ----------------------------------------------------------------------------
    // Printing support

    /**
     * Escapes {@code <} and {@code &} in HTML mode; returns {@code s} unchanged otherwise.
     */
    public String htmlEscape(String s) {
        if (!config.isHtml() || (s.indexOf('<') < 0 && s.indexOf('&') < 0)) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '<' -> sb.append("&lt;");
                case '&' -> sb.append("&amp;");
                default -> sb.append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * Reduces each run of tabs to a single tab. Tabs in comments are cell boundaries
     * for the sink too, so collapsing them keeps reformatted output stable.
     */
    static String untabify(String s) {
        return TAB_RUN.matcher(s).replaceAll("\t");
    }

    private void write(String s) {
        try {
            out.write(s);
        } catch (IOException e) {
            throw PrinterException.writeFailed(e);
        }
    }

    private void newline(int n) {
        if (n > 0) {
            int m = config.getMaxNewlines();
            if (n > m) {
                n = m;
            }
            StringBuilder sb = new StringBuilder(n + state.getIndentation());
            for (; n > 0; n--) {
                sb.append('\n');
            }
            for (int i = state.getIndentation(); i > 0; i--) {
                sb.append('\t');
            }
            write(sb.toString());
        }
    }

    /**
     * Prints the pending separator and returns the whitespace character it ended with,
     * or 0 if it ended with none.
     */
    private char flushSeparator() {
        char trailing = 0;
        switch (state.getSeparator()) {
            case NONE:
                break;
            case BLANK:
                write(" ");
                trailing = ' ';
                break;
            case TAB:
                write("\t");
                trailing = '\t';
                break;
            case COMMA:
                write(",");
                if (state.getNewlines() == 0) {
                    write(" ");
                    trailing = ' ';
                }
                break;
            case SEMICOLON:
                if (state.getLevel() > 0) { // no semicolons at level 0
                    write(";");
                    if (state.getNewlines() == 0) {
                        write(" ");
                        trailing = ' ';
                    }
                }
                break;
            default:
                throw PrinterException.unreachable("separator " + state.getSeparator(), state.getLastPosition());
        }
        state.setSeparator(Separator.NONE);
        return trailing;
    }

    /**
     * Prints the comments positioned before {@code limit} and returns the number of
     * newlines seen after the last printed comment.
     */
    private int interleaveComments(int limit, char trailing) {
        int nlcount = 0;
        for (; hasComment(limit); nextComment()) {
            Comment comment = comments.get(state.getCommentIndex());
            String text = comment.text();

            if (comment.isBlankLine()) {
                nlcount++;
                continue;
            }

            if (nlcount > 0 || state.getCommentPosition() == Positions.UNKNOWN) {
                // only white space before the comment on its line, or the file starts with it
                if (!config.isRespectNewlines() && state.getCommentPosition() != Positions.UNKNOWN) {
                    nlcount = 1;
                }
                newline(nlcount);
                nlcount = 0;
                trailing = 0;
            } else if (comment.isLineComment()) {
                // put in the next cell, unless a scope was just opened: then the whole
                // scope would be indented like that cell
                if (state.getLastSemanticState() == SemanticState.OPENING_SCOPE) {
                    if (trailing == ' ') {
                        write(" ");
                    } else if (trailing != '\t') {
                        write("  ");
                    }
                } else if (trailing != '\t') {
                    write("\t");
                }
            } else {
                if (trailing == 0) {
                    write(" ");
                }
                text += " ";
                trailing = ' ';
            }

            if (config.isDebug()) {
                write("[" + state.getCommentPosition() + "]");
            }
            write(htmlEscape(untabify(text)));

            if (comment.isLineComment()) {
                trailing = 0;
                if (state.getNewlines() == 0) {
                    state.setNewlines(1);
                }
            }
        }
        return nlcount;
    }

    // ----------------------------------------------------------------------------
    // Emission

    /**
     * Prints {@code s} at source position {@code pos}, wrapped in {@code tag} and
     * {@code endTag}. The tags are written as they are; only {@code s} is escaped.
     */
    public void taggedString(int pos, String tag, String s, String endTag) {
        if (pos == Positions.UNKNOWN) {
            pos = state.getLastPosition();
        }
        emit(pos, pos, tag, s, endTag);
    }

    private void emit(int pos, int commentLimit, String tag, String s, String endTag) {
        char trailing = flushSeparator();
        int nlcount = interleaveComments(commentLimit, trailing);

        // any pending separator or comment has been printed in the previous state
        switch (state.getSemanticState()) {
            case NORMAL:
            case OPENING_SCOPE:
            case INSIDE_LIST:
                break;
            case CLOSING_SCOPE:
                state.outdent();
                break;
            default:
                throw PrinterException.unreachable("semantic state " + state.getSemanticState(), state.getLastPosition());
        }

        // Respect additional newlines in the source only if newlines are expected here
        // anyway; not all token positions are known, so elsewhere they would reflow the text.
        if (config.isRespectNewlines()
                && (state.getNewlines() > 0 || state.getSemanticState() == SemanticState.INSIDE_LIST)
                && nlcount > state.getNewlines()) {
            state.setNewlines(nlcount);
        }
        newline(state.getNewlines());
        state.setNewlines(0);

        if (config.isDebug()) {
            write("[" + pos + "]");
        }
        write(tag + htmlEscape(s) + endTag);

        switch (state.getSemanticState()) {
            case NORMAL:
            case INSIDE_LIST:
                break;
            case OPENING_SCOPE:
                state.enterScope();
                state.indent();
                break;
            case CLOSING_SCOPE:
                state.leaveScope();
                break;
            default:
                throw PrinterException.unreachable("semantic state " + state.getSemanticState(), state.getLastPosition());
        }
        state.setLastSemanticState(state.getSemanticState());
        state.setSemanticState(SemanticState.NORMAL);

        state.setOptionalSemicolon(false);
        state.setLastPosition(pos + s.length()); // rough estimate
    }

    public void string(int pos, String s) {
        taggedString(pos, "", s, "");
    }

    public void token(int pos, Token tok) {
        string(pos, tok.getText());
    }

    /**
     * Prints pending separators, newlines and all remaining comments.
     */
    public void flush() {
        emit(state.getLastPosition(), Positions.INFINITY, "", "", "");
        logger.finest(() -> "Flushed session at position " + state.getLastPosition());
    }

    // ----------------------------------------------------------------------------
    // HTML support

    public void htmlPrologue(String title) {
        if (config.isHtml()) {
            taggedString(Positions.UNKNOWN,
                    "<html>\n"
                            + "<head>\n"
                            + "\t<META HTTP-EQUIV=\"Content-Type\" CONTENT=\"text/html; charset=UTF-8\">\n"
                            + "\t<title>" + htmlEscape(title) + "</title>\n"
                            + "\t<style type=\"text/css\">\n"
                            + "\t</style>\n"
                            + "</head>\n"
                            + "<body>\n"
                            + "<pre>\n",
                    "", "");
        }
    }

    /**
     * Closes the HTML page. Remaining comments are printed first so that they stay inside
     * the {@code <pre>} block.
     */
    public void htmlEpilogue() {
        if (config.isHtml()) {
            emit(state.getLastPosition(), Positions.INFINITY,
                    "</pre>\n"
                            + "</body>\n"
                            + "</html>\n",
                    "", "");
        }
    }

    /**
     * Prints an identifier; in HTML mode a resolved identifier becomes an anchor at its
     * declaration and a link everywhere else.
     */
    public void htmlIdentifier(Expr.Ident x) {
        Symbol symbol = x.symbol();
        if (config.isHtml() && symbol != null) {
            String id = Integer.toString(symbol.getId());
            if (symbol.isDeclaredAt(x.pos())) {
                taggedString(x.pos(), "<a name=\"id" + id + "\">", x.name(), "</a>");
            } else {
                taggedString(x.pos(), "<a href=\"#id" + id + "\">", x.name(), "</a>");
            }
        } else {
            string(x.pos(), x.name());
        }
    }

    /**
     * Prints a quoted import path; in HTML mode the path links to the package source.
     */
    public void htmlPackageName(int pos, String name) {
        if (config.isHtml() && name.length() >= 2) {
            String path = name.substring(1, name.length() - 1);
            taggedString(pos, "\"<a href=\"/src/lib/" + path + ".go\">", path, "</a>\"");
        } else {
            string(pos, name);
        }
    }
}
