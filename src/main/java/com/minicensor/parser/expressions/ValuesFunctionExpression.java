package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * ValuesFunctionExpression - ON DUPLICATE KEY UPDATE 中的 VALUES(col)
 */
public class ValuesFunctionExpression implements Expression {

    private final ColumnExpression column;

    public ValuesFunctionExpression(ColumnExpression column) {
        this.column = Objects.requireNonNull(column, "column");
    }

    public ColumnExpression getColumn() {
        return column;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.VALUES_FUNCTION;
    }

    @Override
    public String toString() {
        return "VALUES(" + column + ")";
    }
}
