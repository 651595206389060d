package org.perles.engine.transpiler;

import org.perles.bql.dsl.Value;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines; the BQL compiler
 * only reaches the engine's date functions and string aggregation through here.
 */
public interface SQLDialect {

    /**
     * A rendered date expression together with the single parameter it binds.
     *
     * @param sql       SQL fragment containing exactly one {@code ?}
     * @param parameter The value bound to that placeholder
     */
    record DateExpression(String sql, Object parameter) {
    }

    /**
     * @return The dialect name (e.g., "SQLite")
     */
    String name();

    /**
     * Renders a DATE literal (today, yesterday, a signed offset or an absolute date)
     * relative to the store's current time.
     *
     * @param date A value of kind DATE
     * @return The expression and its parameter
     */
    DateExpression dateExpression(Value date);

    /**
     * Normalizes a timestamp column so it compares correctly against {@link #dateExpression}.
     *
     * @param column The column reference
     * @return The wrapped column
     */
    String timestamp(String column);

    /**
     * Aggregates a string expression over a group into one delimited string.
     *
     * @param expression The expression to aggregate
     * @param separator  The delimiter
     * @return The aggregate call
     */
    String stringAggregate(String expression, String separator);

    /**
     * Converts a boolean to the parameter value the engine stores.
     */
    default Object booleanParameter(boolean value) {
        return value ? 1 : 0;
    }
}
