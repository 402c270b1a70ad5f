package com.prettyprinter.printer;

/**
 * Separators are printed in a delayed fashion, right before the next string.
 */
public enum Separator {
    NONE,
    BLANK,
    TAB,
    COMMA,
    SEMICOLON
}
