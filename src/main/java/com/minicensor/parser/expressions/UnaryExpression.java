package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * UnaryExpression - 一元运算 -a, ~a, !a, BINARY a
 *
 * 负数字面量(-1, -2.5)在解析时折叠为字面量,不产生UnaryExpression。
 */
public class UnaryExpression implements Expression {

    private final UnaryOperator operator;

    private final Expression operand;

    public UnaryExpression(UnaryOperator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.UNARY;
    }

    @Override
    public String toString() {
        return operator + " " + operand;
    }

    /**
     * 一元运算符
     */
    public enum UnaryOperator {
        MINUS("-"),
        PLUS("+"),
        BIT_NOT("~"),
        BANG("!"),
        BINARY("binary");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public static UnaryOperator fromSymbol(String symbol) {
            for (UnaryOperator op : values()) {
                if (op.symbol.equalsIgnoreCase(symbol)) {
                    return op;
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return symbol;
        }
    }
}
