package com.minicensor.parser.statements;

import com.minicensor.parser.QueryStatement;
import com.minicensor.parser.clauses.Limit;
import com.minicensor.parser.clauses.LockMode;
import com.minicensor.parser.clauses.OrderByItem;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * UnionStatement - UNION查询
 *
 * 多个UNION按左结合组织成二叉树:
 * a UNION b UNION ALL c 表示为 Union(Union(a, b), c)。
 * ORDER BY / LIMIT / 锁定子句属于最外层的UNION。
 */
public class UnionStatement implements QueryStatement {

    private final UnionType unionType;

    private final QueryStatement left;

    private final QueryStatement right;

    private final List<OrderByItem> orderBy;

    private final Limit limit;

    private final LockMode lock;

    public UnionStatement(UnionType unionType,
                          QueryStatement left,
                          QueryStatement right,
                          List<OrderByItem> orderBy,
                          Limit limit,
                          LockMode lock) {
        this.unionType = Objects.requireNonNull(unionType, "unionType");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.orderBy = orderBy != null ? List.copyOf(orderBy) : List.of();
        this.limit = limit;
        this.lock = lock != null ? lock : LockMode.NONE;
    }

    public UnionType getUnionType() {
        return unionType;
    }

    public QueryStatement getLeft() {
        return left;
    }

    public QueryStatement getRight() {
        return right;
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
        return StatementType.UNION;
    }

    @Override
    public String toString() {
        return "UnionStatement{" + left + " " + unionType + " " + right + '}';
    }

    /**
     * UNION种类
     */
    public enum UnionType {
        UNION,
        UNION_ALL,
        UNION_DISTINCT
    }
}
