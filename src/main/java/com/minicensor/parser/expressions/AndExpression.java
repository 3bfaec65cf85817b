package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * AndExpression - 逻辑AND运算 left AND right
 */
public class AndExpression implements Expression {

    private final Expression left;

    private final Expression right;

    public AndExpression(Expression left, Expression right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.AND;
    }

    @Override
    public String toString() {
        return "(" + left + " AND " + right + ")";
    }
}
