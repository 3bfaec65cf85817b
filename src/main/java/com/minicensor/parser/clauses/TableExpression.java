package com.minicensor.parser.clauses;

/**
 * TableExpression - FROM / UPDATE / DELETE 中的表引用
 */
public interface TableExpression {

    TableExpressionType getTableExpressionType();

    /**
     * 表引用类型
     */
    enum TableExpressionType {
        /** 表名或派生表,可带别名 */
        ALIASED,
        /** a JOIN b ON ... */
        JOIN,
        /** (a, b) */
        PAREN
    }
}
