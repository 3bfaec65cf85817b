package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

/**
 * BoolExpression - TRUE / FALSE
 */
public class BoolExpression implements Expression {

    private final boolean value;

    public BoolExpression(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.BOOL;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BoolExpression && ((BoolExpression) o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return value ? "TRUE" : "FALSE";
    }
}
