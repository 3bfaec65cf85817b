package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.Wildcard;

import java.util.Objects;

/**
 * ExpressionWildcard - 表达式位置上的通配符哨兵
 *
 * %%VALUE%%、%%LIST_OF_VALUES%% 以及 %%WHERE%% 哨兵子句内部的表达式。
 * 只由解析器从保留记号生成,真实查询中不会出现。
 */
public class ExpressionWildcard implements Expression {

    private final Wildcard kind;

    public ExpressionWildcard(Wildcard kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Wildcard getKind() {
        return kind;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.WILDCARD;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExpressionWildcard && ((ExpressionWildcard) o).kind == kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    @Override
    public String toString() {
        return kind.getToken();
    }
}
