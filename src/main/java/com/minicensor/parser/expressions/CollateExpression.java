package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * CollateExpression - expr COLLATE charset
 */
public class CollateExpression implements Expression {

    private final Expression expression;

    private final String charset;

    public CollateExpression(Expression expression, String charset) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    public Expression getExpression() {
        return expression;
    }

    public String getCharset() {
        return charset;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.COLLATE;
    }

    @Override
    public String toString() {
        return expression + " COLLATE " + charset;
    }
}
