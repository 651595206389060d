package org.perles.bql.validation;

import org.perles.bql.dsl.CompareExpr.Operator;

import java.util.EnumSet;
import java.util.Set;

/**
 * Field categories and the comparison operators each accepts.
 */
public enum FieldType {
    STRING(EnumSet.of(Operator.EQUALS, Operator.NOT_EQUALS, Operator.CONTAINS, Operator.NOT_CONTAINS), true),
    ENUM(EnumSet.of(Operator.EQUALS, Operator.NOT_EQUALS), true),
    PRIORITY(EnumSet.of(Operator.EQUALS, Operator.NOT_EQUALS, Operator.LESS_THAN,
            Operator.LESS_THAN_OR_EQUALS, Operator.GREATER_THAN, Operator.GREATER_THAN_OR_EQUALS), true),
    BOOL(EnumSet.of(Operator.EQUALS, Operator.NOT_EQUALS), false),
    DATE(EnumSet.complementOf(EnumSet.of(Operator.CONTAINS, Operator.NOT_CONTAINS)), false);

    private final Set<Operator> operators;
    private final boolean supportsIn;

    FieldType(Set<Operator> operators, boolean supportsIn) {
        this.operators = operators;
        this.supportsIn = supportsIn;
    }

    public Set<Operator> operators() {
        return EnumSet.copyOf(operators);
    }

    public boolean allows(Operator operator) {
        return operators.contains(operator);
    }

    public boolean supportsIn() {
        return supportsIn;
    }
}
