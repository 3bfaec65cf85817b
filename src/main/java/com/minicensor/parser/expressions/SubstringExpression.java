package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;
import java.util.Optional;

/**
 * SubstringExpression - SUBSTR(col, from[, len]) / SUBSTRING(col FROM from [FOR len])
 */
public class SubstringExpression implements Expression {

    private final ColumnExpression column;

    private final Expression from;

    /** 长度(没有时为null) */
    private final Expression to;

    public SubstringExpression(ColumnExpression column, Expression from, Expression to) {
        this.column = Objects.requireNonNull(column, "column");
        this.from = Objects.requireNonNull(from, "from");
        this.to = to;
    }

    public ColumnExpression getColumn() {
        return column;
    }

    public Expression getFrom() {
        return from;
    }

    public Optional<Expression> getTo() {
        return Optional.ofNullable(to);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.SUBSTRING;
    }

    @Override
    public String toString() {
        return "SUBSTR(" + column + ", " + from + (to != null ? ", " + to : "") + ")";
    }
}
