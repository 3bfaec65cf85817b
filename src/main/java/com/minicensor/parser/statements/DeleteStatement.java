package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.Limit;
import com.minicensor.parser.clauses.OrderByItem;
import com.minicensor.parser.clauses.TableExpression;
import com.minicensor.parser.clauses.TableName;
import com.minicensor.parser.clauses.WhereClause;

import java.util.List;
import java.util.Optional;

/**
 * DeleteStatement - DELETE删除语句
 *
 * 语法示例:
 * <pre>
 * DELETE FROM users WHERE id = 1;
 * DELETE u, o FROM users u JOIN orders o ON u.id = o.user_id WHERE u.id = 1;
 * DELETE FROM u USING users u WHERE u.id = 1;
 * </pre>
 *
 * 单表删除时targets为空,表只出现在tables中。
 */
public class DeleteStatement implements Statement {

    private final List<String> comments;

    /** 多表删除的目标表 */
    private final List<TableName> targets;

    private final List<TableExpression> tables;

    private final List<Identifier> partitions;

    private final WhereClause where;

    private final List<OrderByItem> orderBy;

    private final Limit limit;

    public DeleteStatement(List<String> comments,
                           List<TableName> targets,
                           List<TableExpression> tables,
                           List<Identifier> partitions,
                           WhereClause where,
                           List<OrderByItem> orderBy,
                           Limit limit) {
        this.comments = comments != null ? List.copyOf(comments) : List.of();
        this.targets = targets != null ? List.copyOf(targets) : List.of();
        this.tables = List.copyOf(tables);
        this.partitions = partitions != null ? List.copyOf(partitions) : List.of();
        this.where = where;
        this.orderBy = orderBy != null ? List.copyOf(orderBy) : List.of();
        this.limit = limit;
    }

    public List<String> getComments() {
        return comments;
    }

    public List<TableName> getTargets() {
        return targets;
    }

    public List<TableExpression> getTables() {
        return tables;
    }

    public List<Identifier> getPartitions() {
        return partitions;
    }

    public Optional<WhereClause> getWhere() {
        return Optional.ofNullable(where);
    }

    public List<OrderByItem> getOrderBy() {
        return orderBy;
    }

    public Optional<Limit> getLimit() {
        return Optional.ofNullable(limit);
    }

    @Override
    public StatementType getType() {
        return StatementType.DELETE;
    }

    @Override
    public String toString() {
        return "DeleteStatement{" +
                "tables=" + tables +
                ", where=" + where +
                '}';
    }
}
