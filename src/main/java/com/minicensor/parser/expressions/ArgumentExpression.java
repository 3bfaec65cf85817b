package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * ArgumentExpression - 绑定参数 ? 或 :name
 */
public class ArgumentExpression implements Expression {

    /** 参数文本,"?" 或 ":name" */
    private final String name;

    public ArgumentExpression(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    /**
     * 是否为位置参数 ?
     */
    public boolean isPositional() {
        return "?".equals(name);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.ARGUMENT;
    }

    @Override
    public String toString() {
        return name;
    }
}
