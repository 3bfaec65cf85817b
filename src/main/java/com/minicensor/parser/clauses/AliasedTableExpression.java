package com.minicensor.parser.clauses;

import com.minicensor.parser.expressions.SubqueryExpression;

import java.util.List;
import java.util.Optional;

/**
 * AliasedTableExpression - 单个表引用
 *
 * 语法示例:
 * <pre>
 * users
 * users AS u
 * orders PARTITION (p0, p1) o USE INDEX (idx_user)
 * (SELECT id FROM users) AS t
 * </pre>
 *
 * 表名与派生表(子查询)二选一。
 */
public final class AliasedTableExpression implements TableExpression {

    /** 表名(派生表时为null) */
    private final TableName tableName;

    /** 派生表子查询(普通表时为null) */
    private final SubqueryExpression subquery;

    /** 分区列表 */
    private final List<Identifier> partitions;

    /** 别名(没有时为null) */
    private final Identifier alias;

    /** 索引提示(没有时为null) */
    private final IndexHints indexHints;

    private AliasedTableExpression(TableName tableName,
                                   SubqueryExpression subquery,
                                   List<Identifier> partitions,
                                   Identifier alias,
                                   IndexHints indexHints) {
        this.tableName = tableName;
        this.subquery = subquery;
        this.partitions = partitions != null ? List.copyOf(partitions) : List.of();
        this.alias = alias;
        this.indexHints = indexHints;
    }

    public static AliasedTableExpression ofTable(TableName tableName,
                                                 List<Identifier> partitions,
                                                 Identifier alias,
                                                 IndexHints indexHints) {
        if (tableName == null) {
            throw new IllegalArgumentException("Table name cannot be null");
        }
        return new AliasedTableExpression(tableName, null, partitions, alias, indexHints);
    }

    public static AliasedTableExpression ofSubquery(SubqueryExpression subquery, Identifier alias) {
        if (subquery == null) {
            throw new IllegalArgumentException("Subquery cannot be null");
        }
        return new AliasedTableExpression(null, subquery, List.of(), alias, null);
    }

    public Optional<TableName> getTableName() {
        return Optional.ofNullable(tableName);
    }

    public Optional<SubqueryExpression> getSubquery() {
        return Optional.ofNullable(subquery);
    }

    public List<Identifier> getPartitions() {
        return partitions;
    }

    public Optional<Identifier> getAlias() {
        return Optional.ofNullable(alias);
    }

    public Optional<IndexHints> getIndexHints() {
        return Optional.ofNullable(indexHints);
    }

    @Override
    public TableExpressionType getTableExpressionType() {
        return TableExpressionType.ALIASED;
    }

    @Override
    public String toString() {
        String source = tableName != null ? tableName.toString() : subquery.toString();
        return alias != null ? source + " AS " + alias : source;
    }
}
