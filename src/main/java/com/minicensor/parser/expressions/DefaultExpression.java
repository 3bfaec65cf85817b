package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.clauses.Identifier;

import java.util.Optional;

/**
 * DefaultExpression - DEFAULT 或 DEFAULT(col)
 */
public class DefaultExpression implements Expression {

    /** 列名(单独的DEFAULT时为null) */
    private final Identifier column;

    public DefaultExpression(Identifier column) {
        this.column = column;
    }

    public Optional<Identifier> getColumn() {
        return Optional.ofNullable(column);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.DEFAULT;
    }

    @Override
    public String toString() {
        return column != null ? "DEFAULT(" + column + ")" : "DEFAULT";
    }
}
