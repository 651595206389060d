package org.perles.engine.store;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps the current row of a ResultSet to a value.
 *
 * @param <T> The mapped type
 */
@FunctionalInterface
public interface RowMapper<T> {

    T map(ResultSet rs) throws SQLException;
}
