package com.prettyprinter.ast;

/**
 * A positioned syntax tree node. Nodes are immutable and never modified by the printer.
 */
public interface Node {
    int pos();
}
