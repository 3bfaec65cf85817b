package com.minicensor.parser.clauses;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * NextvalSelectItem - NEXT n VALUES(序列取值)
 */
public final class NextvalSelectItem implements SelectItem {

    private final Expression expression;

    public NextvalSelectItem(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public SelectItemType getItemType() {
        return SelectItemType.NEXTVAL;
    }

    @Override
    public String toString() {
        return "NEXT " + expression + " VALUES";
    }
}
