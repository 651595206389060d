package org.perles.bql.highlight;

import java.util.Objects;

/**
 * A classified character range of a BQL line.
 *
 * @param start    Inclusive 0-based start offset
 * @param end      Exclusive end offset
 * @param category What the range holds
 */
public record SyntaxSpan(int start, int end, Category category) {

    public enum Category {
        KEYWORD,
        OPERATOR,
        PAREN,
        COMMA,
        STRING,
        LITERAL,
        FIELD,
        VALUE
    }

    public SyntaxSpan {
        Objects.requireNonNull(category, "Category cannot be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
