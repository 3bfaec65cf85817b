package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * ParenExpression - 括号表达式 (expr)
 *
 * 括号保留在AST中: 模式 a = (1) 与查询 a = 1 结构不同。
 */
public class ParenExpression implements Expression {

    private final Expression inner;

    public ParenExpression(Expression inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public Expression getInner() {
        return inner;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.PAREN;
    }

    @Override
    public String toString() {
        return "(" + inner + ")";
    }
}
