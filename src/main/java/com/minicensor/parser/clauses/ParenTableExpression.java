package com.minicensor.parser.clauses;

import java.util.List;

/**
 * ParenTableExpression - 括号包裹的表引用列表 (a, b JOIN c)
 */
public final class ParenTableExpression implements TableExpression {

    private final List<TableExpression> tables;

    public ParenTableExpression(List<TableExpression> tables) {
        this.tables = List.copyOf(tables);
    }

    public List<TableExpression> getTables() {
        return tables;
    }

    @Override
    public TableExpressionType getTableExpressionType() {
        return TableExpressionType.PAREN;
    }

    @Override
    public String toString() {
        return "(" + tables + ")";
    }
}
