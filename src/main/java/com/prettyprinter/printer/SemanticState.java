package com.prettyprinter.printer;

/**
 * Formatting state applied to the next printed string only.
 */
public enum SemanticState {
    NORMAL,
    /** Increments scope and indentation level after the string. */
    OPENING_SCOPE,
    /** Decrements indentation before and scope level after the string. */
    CLOSING_SCOPE,
    /** Extra source blank lines before the string are respected. */
    INSIDE_LIST
}
