package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.clauses.OrderByItem;
import com.minicensor.parser.clauses.SelectItem;

import java.util.List;

/**
 * GroupConcatExpression - GROUP_CONCAT([DISTINCT] exprs [ORDER BY ...] [SEPARATOR 'x'])
 */
public class GroupConcatExpression implements Expression {

    private final boolean distinct;

    private final List<SelectItem> expressions;

    private final List<OrderByItem> orderBy;

    /** 分隔符(没有写SEPARATOR时为空串) */
    private final String separator;

    public GroupConcatExpression(boolean distinct,
                                 List<SelectItem> expressions,
                                 List<OrderByItem> orderBy,
                                 String separator) {
        this.distinct = distinct;
        this.expressions = List.copyOf(expressions);
        this.orderBy = orderBy != null ? List.copyOf(orderBy) : List.of();
        this.separator = separator != null ? separator : "";
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<SelectItem> getExpressions() {
        return expressions;
    }

    public List<OrderByItem> getOrderBy() {
        return orderBy;
    }

    public String getSeparator() {
        return separator;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.GROUP_CONCAT;
    }

    @Override
    public String toString() {
        return "GROUP_CONCAT(" + (distinct ? "DISTINCT " : "") + expressions + ")";
    }
}
