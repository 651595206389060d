package org.perles.bql.dsl;

/**
 * Visitor interface for traversing BQL filter expressions.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExprVisitor<T> {

    T visitBinary(BinaryExpr binary);

    T visitNot(NotExpr not);

    T visitCompare(CompareExpr compare);

    T visitIn(InExpr in);
}
