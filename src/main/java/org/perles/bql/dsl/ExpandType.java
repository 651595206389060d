package org.perles.bql.dsl;

import java.util.Locale;
import java.util.Optional;

/**
 * Direction of a graph expansion.
 *
 * UP follows forward edges (child to parent, blocked to blocker),
 * DOWN follows reverse edges (parent to children, blocker to blocked),
 * ALL follows both.
 */
public enum ExpandType {
    UP,
    DOWN,
    ALL;

    static final String VALID_KEYWORDS =
            "children, blocks, downstream, down, blockers, parent, parents, upstream, up, deps, all";

    /**
     * Maps an expansion keyword (case-insensitive) to a direction.
     */
    public static Optional<ExpandType> fromKeyword(String keyword) {
        return switch (keyword.toLowerCase(Locale.ROOT)) {
            case "children", "blocks", "downstream", "down" -> Optional.of(DOWN);
            case "blockers", "parent", "parents", "upstream", "up" -> Optional.of(UP);
            case "all", "deps" -> Optional.of(ALL);
            default -> Optional.empty();
        };
    }
}
