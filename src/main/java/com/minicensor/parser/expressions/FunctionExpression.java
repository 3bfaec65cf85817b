package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.SelectItem;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FunctionExpression - 函数调用
 *
 * 语法示例:
 * <pre>
 * COUNT(*)
 * COUNT(DISTINCT user_id)
 * mydb.my_func(a, b)
 * </pre>
 *
 * 参数列表与投影列表同构(允许 *),因此用SelectItem表示。
 */
public class FunctionExpression implements Expression {

    /** 库名前缀(没有时为null) */
    private final Identifier qualifier;

    /** 函数名 */
    private final Identifier name;

    private final boolean distinct;

    private final List<SelectItem> arguments;

    public FunctionExpression(Identifier qualifier, Identifier name, boolean distinct, List<SelectItem> arguments) {
        this.qualifier = qualifier;
        this.name = Objects.requireNonNull(name, "name");
        this.distinct = distinct;
        this.arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public Optional<Identifier> getQualifier() {
        return Optional.ofNullable(qualifier);
    }

    public Identifier getName() {
        return name;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<SelectItem> getArguments() {
        return arguments;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.FUNCTION;
    }

    @Override
    public String toString() {
        String prefix = qualifier != null ? qualifier + "." : "";
        return prefix + name + "(" + (distinct ? "DISTINCT " : "") + arguments + ")";
    }
}
