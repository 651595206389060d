package org.perles.engine.graph;

import java.util.Objects;

/**
 * One directed edge of the dependency graph.
 *
 * @param targetId The issue at the other end of the edge
 * @param type     The dependency type as stored ("parent-child", "blocks", "discovered-from", ...)
 */
public record DependencyEdge(String targetId, String type) {

    public static final String PARENT_CHILD = "parent-child";
    public static final String BLOCKS = "blocks";
    public static final String DISCOVERED_FROM = "discovered-from";

    public DependencyEdge {
        Objects.requireNonNull(targetId, "Target id cannot be null");
        Objects.requireNonNull(type, "Dependency type cannot be null");
    }
}
