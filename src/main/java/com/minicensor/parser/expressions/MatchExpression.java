package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.clauses.SelectItem;

import java.util.List;
import java.util.Objects;

/**
 * MatchExpression - 全文检索 MATCH (cols) AGAINST (expr [option])
 */
public class MatchExpression implements Expression {

    private final List<SelectItem> columns;

    private final Expression against;

    private final MatchOption option;

    public MatchExpression(List<SelectItem> columns, Expression against, MatchOption option) {
        this.columns = List.copyOf(columns);
        this.against = Objects.requireNonNull(against, "against");
        this.option = option != null ? option : MatchOption.NONE;
    }

    public List<SelectItem> getColumns() {
        return columns;
    }

    public Expression getAgainst() {
        return against;
    }

    public MatchOption getOption() {
        return option;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.MATCH;
    }

    @Override
    public String toString() {
        return "MATCH(" + columns + ") AGAINST (" + against + " " + option + ")";
    }

    /**
     * 全文检索模式
     */
    public enum MatchOption {
        NONE,
        BOOLEAN_MODE,
        NATURAL_LANGUAGE_MODE,
        NATURAL_LANGUAGE_MODE_WITH_QUERY_EXPANSION,
        QUERY_EXPANSION
    }
}
