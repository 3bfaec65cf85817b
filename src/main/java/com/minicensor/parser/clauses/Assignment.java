package com.minicensor.parser.clauses;

import com.minicensor.parser.Expression;
import com.minicensor.parser.expressions.ColumnExpression;

import java.util.Objects;

/**
 * Assignment - 赋值 column = expr
 *
 * 用于 UPDATE ... SET、INSERT ... ON DUPLICATE KEY UPDATE 和 SET 语句。
 * 顺序有意义,因此语句中以List保存而不是Map。
 */
public final class Assignment {

    private final ColumnExpression column;

    private final Expression value;

    public Assignment(ColumnExpression column, Expression value) {
        this.column = Objects.requireNonNull(column, "column");
        this.value = Objects.requireNonNull(value, "value");
    }

    public ColumnExpression getColumn() {
        return column;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String toString() {
        return column + " = " + value;
    }
}
