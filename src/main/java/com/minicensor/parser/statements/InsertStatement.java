package com.minicensor.parser.statements;

import com.minicensor.parser.QueryStatement;
import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.Assignment;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.TableName;
import com.minicensor.parser.expressions.ValueTupleExpression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * InsertStatement - INSERT / REPLACE 语句
 *
 * 语法示例:
 * <pre>
 * INSERT INTO users (id, name) VALUES (1, 'Alice'), (2, 'Bob');
 * INSERT IGNORE INTO users SET id = 1, name = 'Alice';
 * REPLACE INTO archive (id) SELECT id FROM users;
 * INSERT INTO t (a) VALUES (1) ON DUPLICATE KEY UPDATE a = VALUES(a);
 * </pre>
 *
 * 设计原则:
 * - 数据来源二选一: VALUES行列表,或者一个查询(source)
 * - INSERT ... SET 在解析时改写为列列表加单行VALUES,两种写法结构相同
 */
public class InsertStatement implements Statement {

    private final Action action;

    /** INSERT后的块注释 */
    private final List<String> comments;

    private final boolean ignore;

    private final TableName table;

    private final List<Identifier> partitions;

    /** 列列表(未指定时为空) */
    private final List<Identifier> columns;

    /** VALUES行(数据来源为查询时为空) */
    private final List<ValueTupleExpression> rows;

    /** INSERT ... SELECT 的查询(数据来源为VALUES时为null) */
    private final QueryStatement source;

    private final List<Assignment> onDuplicate;

    public InsertStatement(Action action,
                           List<String> comments,
                           boolean ignore,
                           TableName table,
                           List<Identifier> partitions,
                           List<Identifier> columns,
                           List<ValueTupleExpression> rows,
                           QueryStatement source,
                           List<Assignment> onDuplicate) {
        this.action = Objects.requireNonNull(action, "action");
        this.comments = comments != null ? List.copyOf(comments) : List.of();
        this.ignore = ignore;
        this.table = Objects.requireNonNull(table, "table");
        this.partitions = partitions != null ? List.copyOf(partitions) : List.of();
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        this.rows = rows != null ? List.copyOf(rows) : List.of();
        this.source = source;
        this.onDuplicate = onDuplicate != null ? List.copyOf(onDuplicate) : List.of();
    }

    public Action getAction() {
        return action;
    }

    public List<String> getComments() {
        return comments;
    }

    public boolean isIgnore() {
        return ignore;
    }

    public TableName getTable() {
        return table;
    }

    public List<Identifier> getPartitions() {
        return partitions;
    }

    public List<Identifier> getColumns() {
        return columns;
    }

    public List<ValueTupleExpression> getRows() {
        return rows;
    }

    public Optional<QueryStatement> getSource() {
        return Optional.ofNullable(source);
    }

    public List<Assignment> getOnDuplicate() {
        return onDuplicate;
    }

    @Override
    public StatementType getType() {
        return StatementType.INSERT;
    }

    @Override
    public String toString() {
        return "InsertStatement{" +
                "action=" + action +
                ", table=" + table +
                ", columns=" + columns +
                ", rows=" + (source != null ? source : rows) +
                '}';
    }

    public enum Action {
        INSERT,
        REPLACE
    }
}
