package org.perles.engine.graph;

import com.github.benmanes.caffeine.cache.Ticker;
import org.perles.bql.dsl.ExpandClause;
import org.perles.bql.dsl.ExpandType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Level-by-level breadth-first expansion over a {@link DependencyGraph}.
 *
 * Each node is visited at most once, so cycles and self-loops terminate. An unlimited
 * expansion is capped at {@code iterationCeiling} levels.
 */
public final class GraphExpander {

    private static final Logger LOG = LoggerFactory.getLogger(GraphExpander.class);

    public static final int DEFAULT_ITERATION_CEILING = 100;
    public static final Duration DEFAULT_TIME_BUDGET = Duration.ofSeconds(5);

    private final int iterationCeiling;
    private final Duration timeBudget;
    private final Ticker ticker;

    public GraphExpander() {
        this(DEFAULT_ITERATION_CEILING, DEFAULT_TIME_BUDGET);
    }

    public GraphExpander(int iterationCeiling, Duration timeBudget) {
        this(iterationCeiling, timeBudget, Ticker.systemTicker());
    }

    public GraphExpander(int iterationCeiling, Duration timeBudget, Ticker ticker) {
        if (iterationCeiling < 1) {
            throw new IllegalArgumentException("Iteration ceiling must be positive, got " + iterationCeiling);
        }
        this.iterationCeiling = iterationCeiling;
        this.timeBudget = Objects.requireNonNull(timeBudget, "Time budget cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "Ticker cannot be null");
    }

    /**
     * Expands from the base ids.
     *
     * @param graph     The dependency graph
     * @param baseIds   Starting ids, kept first in the result
     * @param direction Which edges to follow
     * @param depth     Levels to expand, or {@link ExpandClause#UNLIMITED}
     * @return The reached ids and whether the ceiling truncated the walk
     * @throws GraphExpansionException if the thread is interrupted or the time budget runs out
     */
    public Expansion expand(DependencyGraph graph, Collection<String> baseIds, ExpandType direction, int depth) {
        Set<String> visited = new LinkedHashSet<>(baseIds);
        if (visited.isEmpty()) {
            return new Expansion(visited, false);
        }

        boolean unlimited = depth == ExpandClause.UNLIMITED;
        int maxLevels = unlimited ? iterationCeiling : depth;
        long deadline = ticker.read() + timeBudget.toNanos();

        List<String> frontier = new ArrayList<>(visited);
        for (int level = 0; level < maxLevels && !frontier.isEmpty(); level++) {
            checkBudget(deadline, level);
            List<String> next = new ArrayList<>();
            for (String id : frontier) {
                for (String neighbor : graph.neighbors(id, direction)) {
                    if (visited.add(neighbor)) {
                        next.add(neighbor);
                    }
                }
            }
            frontier = next;
        }

        boolean truncated = unlimited && hasUnvisitedNeighbors(graph, frontier, direction, visited);
        if (truncated) {
            LOG.warn("Unlimited expansion stopped after {} levels with {} ids still to visit",
                    iterationCeiling, frontier.size());
        }
        return new Expansion(visited, truncated);
    }

    private void checkBudget(long deadline, int level) {
        if (Thread.currentThread().isInterrupted()) {
            throw new GraphExpansionException("expansion interrupted at level " + level);
        }
        if (ticker.read() - deadline > 0) {
            throw new GraphExpansionException("expansion exceeded time budget of "
                    + timeBudget.toMillis() + "ms at level " + level);
        }
    }

    private static boolean hasUnvisitedNeighbors(DependencyGraph graph, List<String> frontier,
                                                 ExpandType direction, Set<String> visited) {
        for (String id : frontier) {
            for (String neighbor : graph.neighbors(id, direction)) {
                if (!visited.contains(neighbor)) {
                    return true;
                }
            }
        }
        return false;
    }
}
