package org.perles.bql.dsl;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Represents a list membership test: {@code status in (open, in_progress)}.
 *
 * @param field   The field name
 * @param values  The candidate values, never empty
 * @param negated true for NOT IN
 */
public record InExpr(String field, List<Value> values, boolean negated) implements Expr {

    public InExpr {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN requires at least one value");
        }
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitIn(this);
    }

    @Override
    public String toString() {
        return field + (negated ? " NOT IN (" : " IN (")
                + values.stream().map(Value::toString).collect(Collectors.joining(", ")) + ")";
    }
}
