package com.minicensor.parser.clauses;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * OrderByItem - ORDER BY 中的一项
 *
 * 没有写方向时按ASC处理,因此 ORDER BY a 与 ORDER BY a ASC 结构相同。
 */
public final class OrderByItem {

    private final Expression expression;

    private final Direction direction;

    public OrderByItem(Expression expression, Direction direction) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.direction = direction != null ? direction : Direction.ASC;
    }

    public Expression getExpression() {
        return expression;
    }

    public Direction getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return expression + " " + direction;
    }

    /**
     * 排序方向
     */
    public enum Direction {
        ASC,
        DESC
    }
}
