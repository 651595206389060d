package org.perles.bql.dsl;

import org.perles.bql.dsl.Token.TokenType;

import java.util.Objects;

/**
 * Represents a field comparison in BQL.
 *
 * Example: type = bug, priority <= P1, title ~ auth
 *
 * @param field    The field name
 * @param operator The comparison operator
 * @param value    The literal compared against
 */
public record CompareExpr(
        String field,
        Operator operator,
        Value value) implements Expr {

    public enum Operator {
        EQUALS("="),
        NOT_EQUALS("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUALS("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUALS(">="),
        CONTAINS("~"),
        NOT_CONTAINS("!~");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isContains() {
            return this == CONTAINS || this == NOT_CONTAINS;
        }

        public boolean isEquality() {
            return this == EQUALS || this == NOT_EQUALS;
        }

        public static Operator fromTokenType(TokenType type) {
            return switch (type) {
                case EQ -> EQUALS;
                case NEQ -> NOT_EQUALS;
                case LT -> LESS_THAN;
                case LTE -> LESS_THAN_OR_EQUALS;
                case GT -> GREATER_THAN;
                case GTE -> GREATER_THAN_OR_EQUALS;
                case CONTAINS -> CONTAINS;
                case NOT_CONTAINS -> NOT_CONTAINS;
                default -> throw new IllegalArgumentException("Not a comparison operator: " + type);
            };
        }
    }

    public CompareExpr {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitCompare(this);
    }

    @Override
    public String toString() {
        return field + " " + operator.symbol() + " " + value;
    }
}
