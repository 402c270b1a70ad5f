package com.prettyprinter.ast;

/**
 * A source comment, or a blank-line marker.
 *
 * <p>The lexer records one marker with text {@code "\n"} per source newline, so a single
 * blank line shows up as two consecutive markers. Real comments start with {@code //} or
 * {@code /*}.
 */
public record Comment(int pos, String text) {
    public static final String NEWLINE = "\n";

    public Comment {
        if (text == null || (!NEWLINE.equals(text) && text.length() < 2)) {
            throw new IllegalArgumentException("Invalid comment text at position " + pos + ": " + text);
        }
    }

    public static Comment newline(int pos) {
        return new Comment(pos, NEWLINE);
    }

    public boolean isBlankLine() {
        return NEWLINE.equals(text);
    }

    public boolean isLineComment() {
        return !isBlankLine() && text.charAt(1) == '/';
    }
}
