package com.prettyprinter.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parameters and results of a function. The results are {@code null} when the
 * function has no result.
 */
public final class Signature {
    private final List<Field> params;
    private final List<Field> results;

    @JsonCreator
    public Signature(@JsonProperty("params") List<Field> params,
                     @JsonProperty("results") List<Field> results) {
        this.params = params != null ? List.copyOf(params) : List.of();
        this.results = results != null ? List.copyOf(results) : null;
    }

    public List<Field> getParams() { return params; }
    public List<Field> getResults() { return results; }

    public boolean hasResults() {
        return results != null;
    }
}
