package org.perles.engine.graph;

import org.perles.bql.dsl.ExpandType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable in-memory dependency graph with adjacency in both directions.
 *
 * A stored row {@code (issue_id, depends_on_id, type)} becomes a forward edge
 * issue_id -> depends_on_id (child to parent, blocked to blocker) and the mirrored
 * reverse edge depends_on_id -> issue_id. Both are only ever added together, by
 * {@link Builder#addEdge}.
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY = new Builder().build();

    private final Map<String, List<DependencyEdge>> forward;
    private final Map<String, List<DependencyEdge>> reverse;
    private final int edgeCount;

    private DependencyGraph(Map<String, List<DependencyEdge>> forward,
                            Map<String, List<DependencyEdge>> reverse,
                            int edgeCount) {
        this.forward = freeze(forward);
        this.reverse = freeze(reverse);
        this.edgeCount = edgeCount;
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<DependencyEdge> forward(String id) {
        return forward.getOrDefault(id, List.of());
    }

    public List<DependencyEdge> reverse(String id) {
        return reverse.getOrDefault(id, List.of());
    }

    /**
     * Returns the distinct neighbor ids of a node in the given direction:
     * UP follows forward edges, DOWN reverse edges, ALL both (forward first).
     */
    public Set<String> neighbors(String id, ExpandType direction) {
        Set<String> result = new LinkedHashSet<>();
        if (direction == ExpandType.UP || direction == ExpandType.ALL) {
            forward(id).forEach(edge -> result.add(edge.targetId()));
        }
        if (direction == ExpandType.DOWN || direction == ExpandType.ALL) {
            reverse(id).forEach(edge -> result.add(edge.targetId()));
        }
        return result;
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * @return Every node that appears on either end of an edge
     */
    public Set<String> nodes() {
        Set<String> nodes = new LinkedHashSet<>(forward.keySet());
        nodes.addAll(reverse.keySet());
        return nodes;
    }

    private static Map<String, List<DependencyEdge>> freeze(Map<String, List<DependencyEdge>> adjacency) {
        Map<String, List<DependencyEdge>> copy = new HashMap<>();
        adjacency.forEach((id, edges) -> copy.put(id, List.copyOf(edges)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "DependencyGraph{nodes=" + nodes().size() + ", edges=" + edgeCount + "}";
    }

    /**
     * Builder that keeps forward and reverse adjacency mirrored.
     */
    public static class Builder {
        private final Map<String, List<DependencyEdge>> forward = new LinkedHashMap<>();
        private final Map<String, List<DependencyEdge>> reverse = new LinkedHashMap<>();
        private int edgeCount;

        /**
         * Adds the edge {@code issueId -> dependsOnId} and its reverse mirror.
         */
        public Builder addEdge(String issueId, String dependsOnId, String type) {
            forward.computeIfAbsent(issueId, k -> new ArrayList<>()).add(new DependencyEdge(dependsOnId, type));
            reverse.computeIfAbsent(dependsOnId, k -> new ArrayList<>()).add(new DependencyEdge(issueId, type));
            edgeCount++;
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(forward, reverse, edgeCount);
        }
    }
}
