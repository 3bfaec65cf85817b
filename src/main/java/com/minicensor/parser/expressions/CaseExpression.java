package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.clauses.WhenClause;

import java.util.List;
import java.util.Optional;

/**
 * CaseExpression - CASE [operand] WHEN ... THEN ... [ELSE ...] END
 */
public class CaseExpression implements Expression {

    /** CASE后的操作数(搜索式CASE时为null) */
    private final Expression operand;

    private final List<WhenClause> whens;

    /** ELSE结果(没有时为null) */
    private final Expression elseResult;

    public CaseExpression(Expression operand, List<WhenClause> whens, Expression elseResult) {
        this.operand = operand;
        this.whens = List.copyOf(whens);
        this.elseResult = elseResult;
    }

    public Optional<Expression> getOperand() {
        return Optional.ofNullable(operand);
    }

    public List<WhenClause> getWhens() {
        return whens;
    }

    public Optional<Expression> getElseResult() {
        return Optional.ofNullable(elseResult);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.CASE;
    }

    @Override
    public String toString() {
        return "CASE " + (operand != null ? operand + " " : "") + whens
                + (elseResult != null ? " ELSE " + elseResult : "") + " END";
    }
}
