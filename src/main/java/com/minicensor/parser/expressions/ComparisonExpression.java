package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;
import java.util.Optional;

/**
 * ComparisonExpression - 比较表达式
 *
 * 语法示例:
 * <pre>
 * id = 42
 * id IN (1, 2, 3)
 * name NOT LIKE 'a!%' ESCAPE '!'
 * </pre>
 */
public class ComparisonExpression implements Expression {

    private final Expression left;

    private final ComparisonOperator operator;

    private final Expression right;

    /** LIKE的ESCAPE字符(没有时为null) */
    private final Expression escape;

    public ComparisonExpression(Expression left, ComparisonOperator operator, Expression right) {
        this(left, operator, right, null);
    }

    public ComparisonExpression(Expression left, ComparisonOperator operator, Expression right, Expression escape) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
        this.escape = escape;
    }

    public Expression getLeft() {
        return left;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    public Optional<Expression> getEscape() {
        return Optional.ofNullable(escape);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.COMPARISON;
    }

    @Override
    public String toString() {
        String base = "(" + left + " " + operator + " " + right;
        return escape != null ? base + " ESCAPE " + escape + ")" : base + ")";
    }
}
