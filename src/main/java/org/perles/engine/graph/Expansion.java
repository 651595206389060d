package org.perles.engine.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Result of a graph expansion.
 *
 * @param ids       Base ids first, then newly reached ids in discovery order
 * @param truncated true when the iteration ceiling stopped an unlimited expansion early
 */
public record Expansion(Set<String> ids, boolean truncated) {

    public Expansion {
        Objects.requireNonNull(ids, "Ids cannot be null");
        ids = Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }
}
