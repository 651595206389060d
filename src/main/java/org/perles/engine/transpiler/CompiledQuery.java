package org.perles.engine.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * Output of the BQL compiler.
 *
 * @param where   The WHERE clause body, empty when the query has no filter
 * @param orderBy The ORDER BY clause body, never empty
 * @param params  Positional parameters in placeholder order
 */
public record CompiledQuery(String where, String orderBy, List<Object> params) {

    public CompiledQuery {
        Objects.requireNonNull(where, "Where clause cannot be null");
        Objects.requireNonNull(orderBy, "Order by clause cannot be null");
        params = List.copyOf(params);
    }

    public boolean hasWhere() {
        return !where.isEmpty();
    }
}
