package com.minicensor.parser.clauses;

import java.util.Objects;

/**
 * JoinTableExpression - 连接表达式 left JOIN right ON ...
 *
 * INNER JOIN 与 CROSS JOIN 规范化为 JOIN。
 */
public final class JoinTableExpression implements TableExpression {

    private final TableExpression left;

    private final JoinType joinType;

    private final TableExpression right;

    /** 连接条件(没有ON/USING时为空条件) */
    private final JoinCondition condition;

    public JoinTableExpression(TableExpression left,
                               JoinType joinType,
                               TableExpression right,
                               JoinCondition condition) {
        this.left = Objects.requireNonNull(left, "left");
        this.joinType = Objects.requireNonNull(joinType, "joinType");
        this.right = Objects.requireNonNull(right, "right");
        this.condition = condition != null ? condition : JoinCondition.NONE;
    }

    public TableExpression getLeft() {
        return left;
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public TableExpression getRight() {
        return right;
    }

    public JoinCondition getCondition() {
        return condition;
    }

    @Override
    public TableExpressionType getTableExpressionType() {
        return TableExpressionType.JOIN;
    }

    @Override
    public String toString() {
        return "(" + left + " " + joinType + " " + right + condition + ")";
    }

    /**
     * 连接类型
     */
    public enum JoinType {
        JOIN,
        STRAIGHT_JOIN,
        LEFT_JOIN,
        RIGHT_JOIN,
        NATURAL_JOIN,
        NATURAL_LEFT_JOIN,
        NATURAL_RIGHT_JOIN
    }
}
