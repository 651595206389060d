package org.perles.bql.dsl;

import java.util.Objects;

/**
 * The EXPAND clause: {@code expand down depth 2}, {@code expand all depth *}.
 *
 * @param direction Which edges to follow
 * @param depth     Number of levels (1..10) or {@link #UNLIMITED}
 */
public record ExpandClause(ExpandType direction, int depth) {

    public static final int UNLIMITED = -1;
    public static final int DEFAULT_DEPTH = 1;
    public static final int MAX_DEPTH = 10;

    public ExpandClause {
        Objects.requireNonNull(direction, "Direction cannot be null");
        if (depth != UNLIMITED && (depth < 1 || depth > MAX_DEPTH)) {
            throw new IllegalArgumentException("Depth must be between 1 and " + MAX_DEPTH + ", got " + depth);
        }
    }

    public static ExpandClause of(ExpandType direction) {
        return new ExpandClause(direction, DEFAULT_DEPTH);
    }

    public boolean isUnlimited() {
        return depth == UNLIMITED;
    }
}
