package org.perles.engine.graph;

import org.perles.engine.store.JdbcQueryRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Loads the whole dependency graph in one query.
 *
 * Only edges whose two endpoints are live issues (not deleted, not tombstoned) are kept.
 */
public class DependencyGraphLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraphLoader.class);

    static final String GRAPH_SQL = """
            SELECT d.issue_id, d.depends_on_id, d.type
            FROM dependencies d
            JOIN issues i1 ON d.issue_id = i1.id
            JOIN issues i2 ON d.depends_on_id = i2.id
            WHERE i1.status NOT IN ('deleted', 'tombstone')
              AND i2.status NOT IN ('deleted', 'tombstone')
              AND i1.deleted_at IS NULL
              AND i2.deleted_at IS NULL
            """;

    private final JdbcQueryRunner runner;

    public DependencyGraphLoader(JdbcQueryRunner runner) {
        this.runner = Objects.requireNonNull(runner, "Query runner cannot be null");
    }

    public DependencyGraph load() throws SQLException {
        long start = System.nanoTime();
        List<EdgeRow> rows = runner.query(GRAPH_SQL, List.of(),
                rs -> new EdgeRow(rs.getString(1), rs.getString(2), rs.getString(3)));

        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (EdgeRow row : rows) {
            builder.addEdge(row.issueId(), row.dependsOnId(), row.type());
        }
        DependencyGraph graph = builder.build();
        LOG.debug("Loaded dependency graph with {} edges in {}ms",
                graph.edgeCount(), (System.nanoTime() - start) / 1_000_000);
        return graph;
    }

    private record EdgeRow(String issueId, String dependsOnId, String type) {
    }
}
