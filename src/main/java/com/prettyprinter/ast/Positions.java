package com.prettyprinter.ast;

/**
 * Sentinel source positions. Real positions are offsets into the source text.
 */
public final class Positions {
    /** Position of synthetic nodes and tokens; the printer substitutes an estimate. */
    public static final int UNKNOWN = 0;

    /** Smallest synthetic position, below any valid position. */
    public static final int SYNTHETIC = 1;

    /** Position of the next comment once the comment list is exhausted. */
    public static final int INFINITY = 1 << 30;

    private Positions() {
    }
}
