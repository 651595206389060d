package org.perles.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs parameterized read queries against a DataSource.
 *
 * Each call borrows a connection, binds the parameters positionally and maps every row.
 * Connections, statements and result sets are always closed.
 */
public class JdbcQueryRunner {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueryRunner.class);

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    public JdbcQueryRunner(DataSource dataSource, int queryTimeoutSeconds) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource cannot be null");
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Query timeout cannot be negative, got " + queryTimeoutSeconds);
        }
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Executes a query and maps its rows.
     *
     * @param sql    SQL with {@code ?} placeholders
     * @param params One value per placeholder, in order
     * @param mapper Row mapper
     * @return The mapped rows in result order
     * @throws SQLException If the store rejects the query or a row cannot be mapped
     */
    public <T> List<T> query(String sql, List<?> params, RowMapper<T> mapper) throws SQLException {
        long start = System.nanoTime();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (queryTimeoutSeconds > 0) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
            }
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("Query returned {} rows in {}ms with {} params",
                        rows.size(), (System.nanoTime() - start) / 1_000_000, params.size());
            }
            return rows;
        }
    }
}
