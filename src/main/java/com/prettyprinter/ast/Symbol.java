package com.prettyprinter.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cross-reference information attached to an identifier by the resolver.
 */
public final class Symbol {
    private final int id;
    private final int declarationPos;

    /**
     * @param id opaque identity, shared by the declaration and all uses
     * @param declarationPos source position of the declaring identifier
     */
    @JsonCreator
    public Symbol(@JsonProperty("id") int id, @JsonProperty("declarationPos") int declarationPos) {
        this.id = id;
        this.declarationPos = declarationPos;
    }

    public int getId() { return id; }
    public int getDeclarationPos() { return declarationPos; }

    public boolean isDeclaredAt(int pos) {
        return pos == declarationPos;
    }
}
