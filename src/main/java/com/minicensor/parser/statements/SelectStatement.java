package com.minicensor.parser.statements;

import com.minicensor.parser.Expression;
import com.minicensor.parser.QueryStatement;
import com.minicensor.parser.clauses.Limit;
import com.minicensor.parser.clauses.LockMode;
import com.minicensor.parser.clauses.OrderByItem;
import com.minicensor.parser.clauses.SelectItem;
import com.minicensor.parser.clauses.TableExpression;
import com.minicensor.parser.clauses.WhereClause;

import java.util.List;
import java.util.Optional;

/**
 * SelectStatement - SELECT查询语句
 *
 * 语法示例:
 * <pre>
 * SELECT * FROM users;
 * SELECT DISTINCT u.id, COUNT(*) AS n
 *   FROM users u JOIN orders o ON u.id = o.user_id
 *   WHERE u.age > 18 GROUP BY u.id HAVING n > 1
 *   ORDER BY n DESC LIMIT 10 FOR UPDATE;
 * </pre>
 *
 * 设计原则:
 * - 可选子句用Optional暴露,列表子句为空列表而不是null
 * - 注释只保留紧跟在SELECT之后的块注释,按出现顺序
 */
public class SelectStatement implements QueryStatement {

    /** SELECT后的块注释 */
    private final List<String> comments;

    /** SQL_CACHE / SQL_NO_CACHE(没有时为null) */
    private final String cache;

    private final boolean distinct;

    /** STRAIGHT_JOIN 提示(没有时为null) */
    private final String hints;

    private final List<SelectItem> selectItems;

    /** FROM子句中的表引用 */
    private final List<TableExpression> from;

    private final WhereClause where;

    private final List<Expression> groupBy;

    private final WhereClause having;

    private final List<OrderByItem> orderBy;

    private final Limit limit;

    private final LockMode lock;

    public SelectStatement(List<String> comments,
                           String cache,
                           boolean distinct,
                           String hints,
                           List<SelectItem> selectItems,
                           List<TableExpression> from,
                           WhereClause where,
                           List<Expression> groupBy,
                           WhereClause having,
                           List<OrderByItem> orderBy,
                           Limit limit,
                           LockMode lock) {
        this.comments = comments != null ? List.copyOf(comments) : List.of();
        this.cache = cache;
        this.distinct = distinct;
        this.hints = hints;
        this.selectItems = List.copyOf(selectItems);
        this.from = from != null ? List.copyOf(from) : List.of();
        this.where = where;
        this.groupBy = groupBy != null ? List.copyOf(groupBy) : List.of();
        this.having = having;
        this.orderBy = orderBy != null ? List.copyOf(orderBy) : List.of();
        this.limit = limit;
        this.lock = lock != null ? lock : LockMode.NONE;
    }

    public List<String> getComments() {
        return comments;
    }

    public Optional<String> getCache() {
        return Optional.ofNullable(cache);
    }

    public boolean isDistinct() {
        return distinct;
    }

    public Optional<String> getHints() {
        return Optional.ofNullable(hints);
    }

    public List<SelectItem> getSelectItems() {
        return selectItems;
    }

    public List<TableExpression> getFrom() {
        return from;
    }

    public Optional<WhereClause> getWhere() {
        return Optional.ofNullable(where);
    }

    public List<Expression> getGroupBy() {
        return groupBy;
    }

    public Optional<WhereClause> getHaving() {
        return Optional.ofNullable(having);
    }

    public List<OrderByItem> getOrderBy() {
        return orderBy;
    }

    public Optional<Limit> getLimit() {
        return Optional.ofNullable(limit);
    }

    public LockMode getLock() {
        return lock;
    }

    @Override
    public StatementType getType() {
        return StatementType.SELECT;
    }

    @Override
    public String toString() {
        return "SelectStatement{" +
                "selectItems=" + selectItems +
                ", from=" + from +
                ", where=" + where +
                '}';
    }
}
