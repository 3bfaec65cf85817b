package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * NotExpression - NOT运算表达式
 *
 * 只对应前缀关键字 NOT,包括 NOT EXISTS (...)。! 是一元运算符,
 * NOT IN、NOT LIKE 的取反记录在比较操作符中。
 */
public class NotExpression implements Expression {

    /** 操作数 */
    private final Expression operand;

    public NotExpression(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.NOT;
    }

    @Override
    public String toString() {
        return "(NOT " + operand + ")";
    }
}
