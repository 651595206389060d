package org.perles.bql.dsl;

import java.util.Objects;

/**
 * Represents a literal value in BQL.
 *
 * Examples: bug, "hello world", 42, true, P1, today, -7d, "2024-01-15"
 *
 * @param kind   The kind of literal
 * @param raw    The literal exactly as written (without quotes)
 * @param text   The string payload; for DATE values the normalized form
 *               ("today", "yesterday", "-7d", "+2h" or an ISO date)
 * @param number The numeric payload for INT values and the level (0-4) for PRIORITY values
 * @param bool   The boolean payload for BOOL values
 */
public record Value(
        Kind kind,
        String raw,
        String text,
        long number,
        boolean bool) {

    public enum Kind {
        STRING,
        INT,
        BOOL,
        PRIORITY,
        DATE
    }

    public Value {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(raw, "Raw text cannot be null");
        Objects.requireNonNull(text, "Text cannot be null");
    }

    public static Value string(String value) {
        return new Value(Kind.STRING, value, value, 0, false);
    }

    public static Value integer(String raw, long value) {
        return new Value(Kind.INT, raw, raw, value, false);
    }

    public static Value bool(String raw, boolean value) {
        return new Value(Kind.BOOL, raw, raw, 0, value);
    }

    public static Value priority(String raw, int level) {
        return new Value(Kind.PRIORITY, raw, raw, level, false);
    }

    /**
     * Creates a date literal.
     *
     * @param raw        The text as written
     * @param normalized "today", "yesterday", a signed offset like "-7d", or an absolute ISO date
     */
    public static Value date(String raw, String normalized) {
        return new Value(Kind.DATE, raw, normalized, 0, false);
    }

    public int priorityLevel() {
        return (int) number;
    }

    /**
     * @return true for relative offsets such as -7d, +2h or -3m
     */
    public boolean isRelativeOffset() {
        return kind == Kind.DATE && text.length() > 2
                && (text.charAt(0) == '-' || text.charAt(0) == '+')
                && Character.isLetter(text.charAt(text.length() - 1));
    }

    @Override
    public String toString() {
        return kind == Kind.STRING ? "\"" + raw + "\"" : raw;
    }
}
