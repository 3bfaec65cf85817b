package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * LiteralExpression - 字面量表达式
 *
 * 表示SQL中的字面量值,包括:
 * - 字符串: 'hello', 'it''s'
 * - 整数: 42, -100
 * - 浮点数: 3.14, -0.5, 1e10
 * - 十六进制: X'4A', 0x4A
 * - 位串: b'0101'
 *
 * 设计原则:
 * - 不可变对象
 * - 值以源文本保存(字符串已去引号并处理转义),按字节精确比较: 42 与 042 不相等
 * - NULL、TRUE/FALSE 和绑定参数有各自的表达式类型
 */
public class LiteralExpression implements Expression {

    /** 字面量类型 */
    private final LiteralType literalType;

    /** 字面量文本 */
    private final String value;

    public LiteralExpression(LiteralType literalType, String value) {
        this.literalType = Objects.requireNonNull(literalType, "literalType");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static LiteralExpression string(String value) {
        return new LiteralExpression(LiteralType.STRING, value);
    }

    public static LiteralExpression integer(long value) {
        return new LiteralExpression(LiteralType.INTEGER, Long.toString(value));
    }

    public LiteralType getLiteralType() {
        return literalType;
    }

    public String getValue() {
        return value;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.LITERAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LiteralExpression)) {
            return false;
        }
        LiteralExpression that = (LiteralExpression) o;
        return literalType == that.literalType && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(literalType, value);
    }

    @Override
    public String toString() {
        if (literalType == LiteralType.STRING) {
            return "'" + value + "'";
        }
        return value;
    }

    /**
     * 字面量类型
     */
    public enum LiteralType {
        STRING,
        INTEGER,
        FLOAT,
        HEX_STRING,
        HEX_NUMBER,
        BIT_STRING
    }
}
