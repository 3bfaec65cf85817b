package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.QueryStatement;

import java.util.Objects;

/**
 * SubqueryExpression - 子查询 (SELECT ...)
 *
 * 模式中的 %%SUBQUERY%% 生成一个内部语句为子查询通配符的SubqueryExpression。
 */
public class SubqueryExpression implements Expression {

    private final QueryStatement statement;

    public SubqueryExpression(QueryStatement statement) {
        this.statement = Objects.requireNonNull(statement, "statement");
    }

    public QueryStatement getStatement() {
        return statement;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.SUBQUERY;
    }

    @Override
    public String toString() {
        return "(" + statement + ")";
    }
}
