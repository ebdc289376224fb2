package com.bountyscope.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Program scope: ordered inclusion and exclusion patterns.
 * Loaded once per invocation and never mutated afterwards.
 */
public record ScopeDefinition(
    List<String> inScope,
    List<String> outOfScope
) implements Serializable {

    @JsonCreator
    public ScopeDefinition(@JsonProperty("in_scope") List<String> inScope,
                           @JsonProperty("out_of_scope") List<String> outOfScope) {
        this.inScope = copy(inScope);
        this.outOfScope = copy(outOfScope);
    }

    /** Keeps null entries so that loaders can report them as blank patterns. */
    private static List<String> copy(List<String> patterns) {
        return patterns != null ? Collections.unmodifiableList(new ArrayList<>(patterns)) : List.of();
    }
}
