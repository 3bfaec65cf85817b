package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * IsExpression - IS [NOT] NULL / TRUE / FALSE
 */
public class IsExpression implements Expression {

    private final Expression operand;

    private final IsOperator operator;

    public IsExpression(Expression operand, IsOperator operator) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public Expression getOperand() {
        return operand;
    }

    public IsOperator getOperator() {
        return operator;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.IS;
    }

    @Override
    public String toString() {
        return "(" + operand + " " + operator + ")";
    }

    /**
     * IS运算符
     */
    public enum IsOperator {
        IS_NULL("is null"),
        IS_NOT_NULL("is not null"),
        IS_TRUE("is true"),
        IS_NOT_TRUE("is not true"),
        IS_FALSE("is false"),
        IS_NOT_FALSE("is not false");

        private final String symbol;

        IsOperator(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return symbol;
        }
    }
}
