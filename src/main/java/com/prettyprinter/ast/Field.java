package com.prettyprinter.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A parameter, result, struct field or interface method. Names may be empty for
 * anonymous parameters and embedded fields; the tag is only used by struct fields.
 */
public final class Field {
    private final List<Expr.Ident> names;
    private final Expr type;
    private final Expr tag;

    @JsonCreator
    public Field(@JsonProperty("names") List<Expr.Ident> names,
                 @JsonProperty("type") Expr type,
                 @JsonProperty("tag") Expr tag) {
        this.names = names != null ? List.copyOf(names) : List.of();
        this.type = requireNonNull(type, "type");
        this.tag = tag;
    }

    public static Field anonymous(Expr type) {
        return new Field(List.of(), type, null);
    }

    public static Field named(Expr type, Expr.Ident... names) {
        return new Field(List.of(names), type, null);
    }

    public List<Expr.Ident> getNames() { return names; }
    public Expr getType() { return type; }

    /** Gets the struct field tag, or {@code null}. */
    public Expr getTag() { return tag; }

    public boolean isAnonymous() {
        return names.isEmpty();
    }
}
