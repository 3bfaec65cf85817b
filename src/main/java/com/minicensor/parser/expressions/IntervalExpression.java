package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * IntervalExpression - INTERVAL expr unit
 *
 * 例如 created_at > NOW() - INTERVAL 7 DAY。单位大小写不敏感。
 */
public class IntervalExpression implements Expression {

    private final Expression expression;

    private final String unit;

    public IntervalExpression(Expression expression, String unit) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    public Expression getExpression() {
        return expression;
    }

    public String getUnit() {
        return unit;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.INTERVAL;
    }

    @Override
    public String toString() {
        return "INTERVAL " + expression + " " + unit;
    }
}
