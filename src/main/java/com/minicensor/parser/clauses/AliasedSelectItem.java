package com.minicensor.parser.clauses;

import com.minicensor.parser.Expression;

import java.util.Objects;
import java.util.Optional;

/**
 * AliasedSelectItem - 表达式投影项,如 name, COUNT(*) AS total
 */
public final class AliasedSelectItem implements SelectItem {

    private final Expression expression;

    /** 别名(没有别名时为null) */
    private final Identifier alias;

    public AliasedSelectItem(Expression expression, Identifier alias) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.alias = alias;
    }

    public Expression getExpression() {
        return expression;
    }

    public Optional<Identifier> getAlias() {
        return Optional.ofNullable(alias);
    }

    @Override
    public SelectItemType getItemType() {
        return SelectItemType.ALIASED;
    }

    @Override
    public String toString() {
        return alias != null ? expression + " AS " + alias : expression.toString();
    }
}
