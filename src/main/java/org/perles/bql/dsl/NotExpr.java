package org.perles.bql.dsl;

import java.util.Objects;

/**
 * Negation of a filter expression: {@code not blocked = true}.
 */
public record NotExpr(Expr inner) implements Expr {

    public NotExpr {
        Objects.requireNonNull(inner, "Inner expression cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        return "NOT (" + inner + ")";
    }
}
