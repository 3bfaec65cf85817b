package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * OrExpression - 逻辑OR运算 left OR right
 */
public class OrExpression implements Expression {

    private final Expression left;

    private final Expression right;

    public OrExpression(Expression left, Expression right) {
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
        return ExpressionType.OR;
    }

    @Override
    public String toString() {
        return "(" + left + " OR " + right + ")";
    }
}
