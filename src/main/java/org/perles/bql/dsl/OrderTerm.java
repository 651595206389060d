package org.perles.bql.dsl;

import java.util.Objects;

/**
 * A single ORDER BY term.
 *
 * @param field      The field to sort by
 * @param descending true for DESC, false for ASC (the default)
 */
public record OrderTerm(String field, boolean descending) {

    public OrderTerm {
        Objects.requireNonNull(field, "Field cannot be null");
    }

    public static OrderTerm asc(String field) {
        return new OrderTerm(field, false);
    }

    public static OrderTerm desc(String field) {
        return new OrderTerm(field, true);
    }
}
