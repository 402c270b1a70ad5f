package com.prettyprinter.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A statement list opened by {@link Token#LBRACE} and closed at {@code end}, or the body
 * of a case clause opened by {@link Token#COLON}.
 */
public final class Block {
    private final int pos;
    private final Token open;
    private final List<Stat> statements;
    private final int end;

    @JsonCreator
    public Block(@JsonProperty("pos") int pos,
                 @JsonProperty("open") Token open,
                 @JsonProperty("statements") List<Stat> statements,
                 @JsonProperty("end") int end) {
        this.pos = pos;
        this.open = open != null ? open : Token.LBRACE;
        this.statements = statements != null ? List.copyOf(statements) : List.of();
        this.end = end;
    }

    public int getPos() { return pos; }
    public Token getOpen() { return open; }
    public List<Stat> getStatements() { return statements; }
    public int getEnd() { return end; }

    public boolean isBraced() {
        return open == Token.LBRACE;
    }
}
