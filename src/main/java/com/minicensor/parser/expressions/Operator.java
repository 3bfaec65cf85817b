package com.minicensor.parser.expressions;

/**
 * Operator - 二元算术/位运算符
 *
 * 定义SQL中支持的二元运算符。MOD 与 % 是同一个运算符。
 */
public enum Operator {

    /** 加法 */
    ADD("+"),
    /** 减法 */
    SUBTRACT("-"),
    /** 乘法 */
    MULTIPLY("*"),
    /** 除法 */
    DIVIDE("/"),
    /** 整除 */
    INTEGER_DIVIDE("div"),
    /** 取模 */
    MODULO("%"),
    /** 按位与 */
    BIT_AND("&"),
    /** 按位或 */
    BIT_OR("|"),
    /** 按位异或 */
    BIT_XOR("^"),
    /** 左移 */
    SHIFT_LEFT("<<"),
    /** 右移 */
    SHIFT_RIGHT(">>"),
    /** 逻辑异或 */
    XOR("xor");

    /** 运算符字符串表示 */
    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 根据符号获取运算符(大小写不敏感)
     *
     * @param symbol 运算符符号
     * @return 运算符枚举,如果未知返回null
     */
    public static Operator fromSymbol(String symbol) {
        if ("mod".equalsIgnoreCase(symbol)) {
            return MODULO;
        }
        for (Operator op : values()) {
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
