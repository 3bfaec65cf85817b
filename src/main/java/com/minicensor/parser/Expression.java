package com.minicensor.parser;

/**
 * Expression - SQL表达式接口
 *
 * 表示SQL中的各种表达式,包括:
 * - 逻辑运算: a AND b, NOT a, (a)
 * - 比较运算: age > 18, id IN (1, 2), age BETWEEN 1 AND 9, name IS NULL, EXISTS (...)
 * - 值: 42, 'hello', NULL, TRUE, (1, 2), ?
 * - 列引用与子查询: users.id, (SELECT ...)
 * - 算术与函数: a + 1, -a, INTERVAL 1 DAY, CONCAT(a, b), CASE ... END
 *
 * 设计原则:
 * - "Good taste": 所有表达式都是Expression,匹配器按getType()分发
 * - 类型安全: 每种表达式有专门的子类
 * - 可组合: 复杂表达式由简单表达式组合而成
 */
public interface Expression {

    /**
     * 获取表达式类型
     *
     * @return 表达式类型枚举
     */
    ExpressionType getType();

    /**
     * SQL表达式类型枚举
     */
    enum ExpressionType {
        AND,
        OR,
        NOT,
        PAREN,
        COMPARISON,
        RANGE,
        IS,
        EXISTS,
        LITERAL,
        NULL,
        BOOL,
        TUPLE,
        ARGUMENT,
        COLUMN,
        SUBQUERY,
        BINARY,
        UNARY,
        INTERVAL,
        COLLATE,
        FUNCTION,
        CASE,
        VALUES_FUNCTION,
        CONVERT,
        CONVERT_USING,
        SUBSTRING,
        MATCH,
        GROUP_CONCAT,
        DEFAULT,
        /** 值/列表/WHERE通配符(只出现在模式中) */
        WILDCARD
    }
}
