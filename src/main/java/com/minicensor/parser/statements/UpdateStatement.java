package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.Assignment;
import com.minicensor.parser.clauses.Limit;
import com.minicensor.parser.clauses.OrderByItem;
import com.minicensor.parser.clauses.TableExpression;
import com.minicensor.parser.clauses.WhereClause;

import java.util.List;
import java.util.Optional;

/**
 * UpdateStatement - UPDATE更新语句
 *
 * 语法示例:
 * <pre>
 * UPDATE users SET age = 26 WHERE id = 1;
 * UPDATE users u JOIN orders o ON u.id = o.user_id SET u.total = o.amount;
 * </pre>
 */
public class UpdateStatement implements Statement {

    private final List<String> comments;

    private final List<TableExpression> tables;

    private final List<Assignment> assignments;

    private final WhereClause where;

    private final List<OrderByItem> orderBy;

    private final Limit limit;

    public UpdateStatement(List<String> comments,
                           List<TableExpression> tables,
                           List<Assignment> assignments,
                           WhereClause where,
                           List<OrderByItem> orderBy,
                           Limit limit) {
        this.comments = comments != null ? List.copyOf(comments) : List.of();
        this.tables = List.copyOf(tables);
        this.assignments = List.copyOf(assignments);
        this.where = where;
        this.orderBy = orderBy != null ? List.copyOf(orderBy) : List.of();
        this.limit = limit;
    }

    public List<String> getComments() {
        return comments;
    }

    public List<TableExpression> getTables() {
        return tables;
    }

    public List<Assignment> getAssignments() {
        return assignments;
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
        return StatementType.UPDATE;
    }

    @Override
    public String toString() {
        return "UpdateStatement{" +
                "tables=" + tables +
                ", assignments=" + assignments +
                ", where=" + where +
                '}';
    }
}
