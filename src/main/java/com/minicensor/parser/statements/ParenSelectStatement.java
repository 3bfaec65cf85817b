package com.minicensor.parser.statements;

import com.minicensor.parser.QueryStatement;

import java.util.Objects;

/**
 * ParenSelectStatement - 括号包裹的查询 (SELECT ...)
 */
public class ParenSelectStatement implements QueryStatement {

    private final QueryStatement inner;

    public ParenSelectStatement(QueryStatement inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public QueryStatement getInner() {
        return inner;
    }

    @Override
    public StatementType getType() {
        return StatementType.PAREN_SELECT;
    }

    @Override
    public String toString() {
        return "(" + inner + ")";
    }
}
