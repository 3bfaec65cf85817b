package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * BinaryExpression - 二元运算表达式
 *
 * 表示需要两个操作数的算术/位运算,包括:
 * - 算术运算: age + 1, price * quantity, a DIV 2
 * - 位运算: flags & 4, a << 1
 * - 逻辑异或: a XOR b
 *
 * AND/OR 和比较运算有各自的表达式类型。
 */
public class BinaryExpression implements Expression {

    /** 左操作数 */
    private final Expression left;

    /** 运算符 */
    private final Operator operator;

    /** 右操作数 */
    private final Expression right;

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.BINARY;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
