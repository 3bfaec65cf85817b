package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.clauses.ConvertType;

import java.util.Objects;

/**
 * ConvertExpression - CONVERT(expr, type) / CAST(expr AS type)
 *
 * 两种写法生成相同的结构。
 */
public class ConvertExpression implements Expression {

    private final Expression expression;

    private final ConvertType convertType;

    public ConvertExpression(Expression expression, ConvertType convertType) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.convertType = Objects.requireNonNull(convertType, "convertType");
    }

    public Expression getExpression() {
        return expression;
    }

    public ConvertType getConvertType() {
        return convertType;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.CONVERT;
    }

    @Override
    public String toString() {
        return "CONVERT(" + expression + ", " + convertType + ")";
    }
}
