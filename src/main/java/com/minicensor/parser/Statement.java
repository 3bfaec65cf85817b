package com.minicensor.parser;

/**
 * Statement - SQL语句接口
 *
 * 所有SQL语句的基类,代表一条完整的SQL命令(查询或模式)。
 *
 * 设计原则:
 * - "Good taste": 所有语句都是Statement,匹配器按getType()分发,消除instanceof链
 * - 不可变: 解析器生成一次,匹配过程只读
 * - 封闭集合: 新增语句类型必须同时补充StatementType,匹配器对未知类型返回不匹配
 *
 * 使用示例:
 * <pre>
 * Statement stmt = parser.parse("SELECT name FROM users WHERE id = 1");
 * if (stmt.getType() == Statement.StatementType.SELECT) {
 *     SelectStatement select = (SelectStatement) stmt;
 *     ...
 * }
 * </pre>
 */
public interface Statement {

    /**
     * 获取语句类型
     *
     * @return 语句类型枚举
     */
    StatementType getType();

    /**
     * SQL语句类型枚举
     */
    enum StatementType {
        /** SELECT - 查询 */
        SELECT,
        /** UNION - 联合查询 */
        UNION,
        /** (SELECT ...) - 括号包裹的查询 */
        PAREN_SELECT,
        /** INSERT / REPLACE - 插入 */
        INSERT,
        /** UPDATE - 更新 */
        UPDATE,
        /** DELETE - 删除 */
        DELETE,
        /** SET - 设置变量 */
        SET,
        /** BEGIN / START TRANSACTION */
        BEGIN,
        /** COMMIT */
        COMMIT,
        /** ROLLBACK */
        ROLLBACK,
        /** SHOW ... */
        SHOW,
        /** USE db */
        USE,
        /** 表级DDL: CREATE/ALTER/DROP/RENAME/TRUNCATE TABLE */
        DDL,
        /** 库级DDL: CREATE/DROP DATABASE */
        DBDDL,
        /** STREAM */
        STREAM,
        /** DESCRIBE / EXPLAIN 等只读管理语句 */
        OTHER_READ,
        /** REPAIR / OPTIMIZE 等管理语句 */
        OTHER_ADMIN,
        /** 整条语句通配符(只出现在模式中) */
        WILDCARD
    }
}
