package org.perles.bql.dsl;

/**
 * Represents a token produced by the BQL lexer.
 *
 * @param type     The token type
 * @param literal  The token text (string contents without quotes for STRING tokens)
 * @param position The 0-based offset of the token start in the source string
 * @param end      The exclusive end offset of the token in the source string
 */
public record Token(TokenType type, String literal, int position, int end) {

    public enum TokenType {
        // Identifiers and literals
        IDENT, // type, perles-123, P0
        STRING, // "hello", 'hello'
        NUMBER, // 42, -7d, -24h

        // Comparison operators
        EQ, // =
        NEQ, // !=
        LT, // <
        GT, // >
        LTE, // <=
        GTE, // >=
        CONTAINS, // ~
        NOT_CONTAINS, // !~

        // Delimiters
        LPAREN, // (
        RPAREN, // )
        COMMA, // ,
        STAR, // * (unlimited depth)

        // Keywords
        AND,
        OR,
        NOT,
        IN,
        ORDER,
        BY,
        ASC,
        DESC,
        TRUE,
        FALSE,
        EXPAND,
        DEPTH,

        // Special
        ILLEGAL,
        EOF;

        public boolean isComparisonOperator() {
            return switch (this) {
                case EQ, NEQ, LT, GT, LTE, GTE, CONTAINS, NOT_CONTAINS -> true;
                default -> false;
            };
        }

        public boolean isKeyword() {
            return switch (this) {
                case AND, OR, NOT, IN, ORDER, BY, ASC, DESC, TRUE, FALSE, EXPAND, DEPTH -> true;
                default -> false;
            };
        }
    }

    /**
     * Describes the token for error messages: the quoted literal, or "end of input".
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of input";
        }
        return "'" + literal + "'";
    }

    @Override
    public String toString() {
        return type + (literal != null && !literal.isEmpty() ? "(" + literal + ")" : "") + "@" + position;
    }
}
