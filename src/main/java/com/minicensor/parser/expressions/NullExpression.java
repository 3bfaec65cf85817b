package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

/**
 * NullExpression - NULL
 */
public class NullExpression implements Expression {

    @Override
    public ExpressionType getType() {
        return ExpressionType.NULL;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NullExpression;
    }

    @Override
    public int hashCode() {
        return NullExpression.class.hashCode();
    }

    @Override
    public String toString() {
        return "NULL";
    }
}
