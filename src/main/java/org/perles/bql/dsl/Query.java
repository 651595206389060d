package org.perles.bql.dsl;

import java.util.List;
import java.util.Objects;

/**
 * A parsed BQL query.
 *
 * @param filter  The filter expression, or null when the query only orders or expands
 * @param expand  The EXPAND clause, or null
 * @param orderBy The ORDER BY terms, empty when absent
 */
public record Query(Expr filter, ExpandClause expand, List<OrderTerm> orderBy) {

    public Query {
        Objects.requireNonNull(orderBy, "Order terms cannot be null");
        orderBy = List.copyOf(orderBy);
    }

    public static Query filter(Expr filter) {
        return new Query(filter, null, List.of());
    }

    public boolean hasFilter() {
        return filter != null;
    }

    public boolean hasExpand() {
        return expand != null;
    }
}
