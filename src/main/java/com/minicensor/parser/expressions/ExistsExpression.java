package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * ExistsExpression - EXISTS (SELECT ...)
 */
public class ExistsExpression implements Expression {

    private final SubqueryExpression subquery;

    public ExistsExpression(SubqueryExpression subquery) {
        this.subquery = Objects.requireNonNull(subquery, "subquery");
    }

    public SubqueryExpression getSubquery() {
        return subquery;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.EXISTS;
    }

    @Override
    public String toString() {
        return "EXISTS " + subquery;
    }
}
