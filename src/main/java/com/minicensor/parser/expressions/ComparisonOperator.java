package com.minicensor.parser.expressions;

/**
 * ComparisonOperator - 比较运算符
 *
 * 包括 IN / LIKE / REGEXP 及其否定形式。&lt;&gt; 规范化为 !=。
 */
public enum ComparisonOperator {

    EQUAL("="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    NOT_EQUAL("!="),
    NULL_SAFE_EQUAL("<=>"),
    IN("in"),
    NOT_IN("not in"),
    LIKE("like"),
    NOT_LIKE("not like"),
    REGEXP("regexp"),
    NOT_REGEXP("not regexp");

    /** 运算符字符串表示 */
    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 根据符号获取比较运算符
     *
     * @param symbol 运算符符号
     * @return 运算符枚举,如果未知返回null
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        if ("<>".equals(symbol)) {
            return NOT_EQUAL;
        }
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
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
