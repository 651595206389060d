package org.perles.bql.dsl;

/**
 * Sealed interface representing filter expressions in the BQL AST.
 *
 * Type hierarchy:
 * Expr
 * ├── BinaryExpr (left AND|OR right)
 * ├── NotExpr (NOT inner)
 * ├── CompareExpr (field op value)
 * └── InExpr (field [NOT] IN (values))
 */
public sealed interface Expr permits BinaryExpr, NotExpr, CompareExpr, InExpr {

    /**
     * Accept a visitor for traversal.
     */
    <T> T accept(ExprVisitor<T> visitor);
}
