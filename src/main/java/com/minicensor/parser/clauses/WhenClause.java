package com.minicensor.parser.clauses;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * WhenClause - CASE 表达式中的 WHEN cond THEN result
 */
public final class WhenClause {

    private final Expression condition;

    private final Expression result;

    public WhenClause(Expression condition, Expression result) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.result = Objects.requireNonNull(result, "result");
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getResult() {
        return result;
    }

    @Override
    public String toString() {
        return "WHEN " + condition + " THEN " + result;
    }
}
