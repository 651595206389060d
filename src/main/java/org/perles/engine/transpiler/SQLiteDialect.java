package org.perles.engine.transpiler;

import org.perles.bql.dsl.Value;

/**
 * SQL dialect implementation for SQLite.
 * Dates are computed with SQLite's date()/datetime() modifiers, bound as parameters.
 */
public final class SQLiteDialect implements SQLDialect {

    public static final SQLiteDialect INSTANCE = new SQLiteDialect();

    private SQLiteDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "SQLite";
    }

    @Override
    public DateExpression dateExpression(Value date) {
        String text = date.text();
        switch (text) {
            case "today":
                return new DateExpression("date('now', ?)", "start of day");
            case "yesterday":
                return new DateExpression("date('now', ?)", "-1 day");
            default:
                break;
        }

        if (date.isRelativeOffset()) {
            char sign = text.charAt(0);
            String amount = text.substring(1, text.length() - 1);
            char unit = Character.toLowerCase(text.charAt(text.length() - 1));
            return switch (unit) {
                case 'd' -> new DateExpression("date('now', ?)", sign + amount + " days");
                // Hours need datetime() for sub-day precision
                case 'h' -> new DateExpression("datetime('now', ?)", sign + amount + " hours");
                case 'm' -> new DateExpression("date('now', ?)", sign + amount + " months");
                default -> throw new IllegalArgumentException("Unknown date unit in: " + text);
            };
        }

        // Absolute date: let SQLite normalize it to the same format as the column
        return new DateExpression("datetime(?)", text);
    }

    @Override
    public String timestamp(String column) {
        // Normalizes ISO 8601 timestamps with a zone to UTC "YYYY-MM-DD HH:MM:SS"
        return "datetime(" + column + ")";
    }

    @Override
    public String stringAggregate(String expression, String separator) {
        return "group_concat(" + expression + ", '" + separator.replace("'", "''") + "')";
    }
}
