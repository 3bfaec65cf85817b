package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * RangeExpression - BETWEEN 范围条件
 *
 * age BETWEEN 18 AND 65 / age NOT BETWEEN 18 AND 65
 */
public class RangeExpression implements Expression {

    private final Expression left;

    private final boolean negated;

    private final Expression from;

    private final Expression to;

    public RangeExpression(Expression left, boolean negated, Expression from, Expression to) {
        this.left = Objects.requireNonNull(left, "left");
        this.negated = negated;
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public Expression getLeft() {
        return left;
    }

    public boolean isNegated() {
        return negated;
    }

    public Expression getFrom() {
        return from;
    }

    public Expression getTo() {
        return to;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.RANGE;
    }

    @Override
    public String toString() {
        return "(" + left + (negated ? " NOT BETWEEN " : " BETWEEN ") + from + " AND " + to + ")";
    }
}
