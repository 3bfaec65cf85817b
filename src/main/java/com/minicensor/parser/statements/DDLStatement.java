package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.TableName;

import java.util.Objects;
import java.util.Optional;

/**
 * DDLStatement - 表级DDL
 *
 * 语法示例:
 * <pre>
 * CREATE TABLE IF NOT EXISTS users (id INT);
 * ALTER TABLE users ADD COLUMN age INT;
 * DROP TABLE IF EXISTS users;
 * RENAME TABLE users TO customers;
 * TRUNCATE TABLE users;
 * </pre>
 *
 * 设计原则:
 * - 只保留动作、表名和IF [NOT] EXISTS,列定义等细节不参与匹配
 */
public class DDLStatement implements Statement {

    private final Action action;

    private final TableName table;

    /** RENAME的目标表名(其他动作为null) */
    private final TableName newName;

    /** 是否写了 IF EXISTS / IF NOT EXISTS */
    private final boolean ifExists;

    public DDLStatement(Action action, TableName table, TableName newName, boolean ifExists) {
        this.action = Objects.requireNonNull(action, "action");
        this.table = Objects.requireNonNull(table, "table");
        this.newName = newName;
        this.ifExists = ifExists;
    }

    public Action getAction() {
        return action;
    }

    public TableName getTable() {
        return table;
    }

    public Optional<TableName> getNewName() {
        return Optional.ofNullable(newName);
    }

    public boolean isIfExists() {
        return ifExists;
    }

    @Override
    public StatementType getType() {
        return StatementType.DDL;
    }

    @Override
    public String toString() {
        return "DDLStatement{" + action + " " + table + (newName != null ? " TO " + newName : "") + '}';
    }

    public enum Action {
        CREATE,
        ALTER,
        DROP,
        RENAME,
        TRUNCATE
    }
}
