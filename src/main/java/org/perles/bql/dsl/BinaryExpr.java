package org.perles.bql.dsl;

import java.util.Objects;

/**
 * Represents a logical combination of two filter expressions.
 *
 * @param left     The left operand
 * @param operator AND or OR
 * @param right    The right operand
 */
public record BinaryExpr(Expr left, LogicalOperator operator, Expr right) implements Expr {

    public enum LogicalOperator {
        AND,
        OR
    }

    public BinaryExpr {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryExpr and(Expr left, Expr right) {
        return new BinaryExpr(left, LogicalOperator.AND, right);
    }

    public static BinaryExpr or(Expr left, Expr right) {
        return new BinaryExpr(left, LogicalOperator.OR, right);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
