package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * ConvertUsingExpression - CONVERT(expr USING charset)
 */
public class ConvertUsingExpression implements Expression {

    private final Expression expression;

    private final String charset;

    public ConvertUsingExpression(Expression expression, String charset) {
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
        return ExpressionType.CONVERT_USING;
    }

    @Override
    public String toString() {
        return "CONVERT(" + expression + " USING " + charset + ")";
    }
}
