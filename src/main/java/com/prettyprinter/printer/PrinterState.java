package com.prettyprinter.printer;

import com.prettyprinter.ast.Positions;
import com.prettyprinter.ast.Token;

/**
 * Mutable state of one print session. Created fresh for every session and owned by it.
 */
public class PrinterState {
    // pending output
    private Separator separator = Separator.NONE;
    private int newlines;

    // semantic state
    private SemanticState semanticState = SemanticState.NORMAL;
    private SemanticState lastSemanticState = SemanticState.NORMAL;

    // layout
    private int level;
    private int indentation;
    private int lastPosition;

    // comments
    private int commentIndex = -1;
    private int commentPosition = Positions.INFINITY;

    // expressions
    private int precedence = Token.LOWEST_PREC;

    // true if a semicolon separator is optional in a statement list
    private boolean optionalSemicolon;

    public Separator getSeparator() {
        return separator;
    }

    public void setSeparator(Separator separator) {
        this.separator = separator;
    }

    /**
     * Gets the number of newlines to print before the next string.
     */
    public int getNewlines() {
        return newlines;
    }

    public void setNewlines(int newlines) {
        this.newlines = newlines;
    }

    public SemanticState getSemanticState() {
        return semanticState;
    }

    public void setSemanticState(SemanticState semanticState) {
        this.semanticState = semanticState;
    }

    /**
     * Gets the semantic state that applied to the last printed string.
     */
    public SemanticState getLastSemanticState() {
        return lastSemanticState;
    }

    void setLastSemanticState(SemanticState lastSemanticState) {
        this.lastSemanticState = lastSemanticState;
    }

    public int getLevel() {
        return level;
    }

    void enterScope() {
        level++;
    }

    void leaveScope() {
        if (level == 0) {
            throw PrinterException.unreachable("scope level underflow", lastPosition);
        }
        level--;
    }

    public int getIndentation() {
        return indentation;
    }

    public void indent() {
        indentation++;
    }

    public void outdent() {
        if (indentation == 0) {
            throw PrinterException.unreachable("indentation underflow", lastPosition);
        }
        indentation--;
    }

    /**
     * Gets the estimated source position after the last printed string.
     */
    public int getLastPosition() {
        return lastPosition;
    }

    void setLastPosition(int lastPosition) {
        this.lastPosition = lastPosition;
    }

    public int getCommentIndex() {
        return commentIndex;
    }

    /**
     * Gets the position of the next unprinted comment, {@link Positions#INFINITY} if none.
     */
    public int getCommentPosition() {
        return commentPosition;
    }

    void advanceComment(int nextPosition) {
        commentIndex++;
        commentPosition = nextPosition;
    }

    /**
     * Gets the precedence of the operator context an expression is printed in.
     */
    public int getPrecedence() {
        return precedence;
    }

    public void setPrecedence(int precedence) {
        this.precedence = precedence;
    }

    public boolean isOptionalSemicolon() {
        return optionalSemicolon;
    }

    public void setOptionalSemicolon(boolean optionalSemicolon) {
        this.optionalSemicolon = optionalSemicolon;
    }
}
