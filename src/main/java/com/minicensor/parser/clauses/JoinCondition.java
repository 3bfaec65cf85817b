package com.minicensor.parser.clauses;

import com.minicensor.parser.Expression;

import java.util.List;
import java.util.Optional;

/**
 * JoinCondition - ON 表达式或 USING 列列表
 */
public final class JoinCondition {

    /** 没有连接条件 */
    public static final JoinCondition NONE = new JoinCondition(null, List.of());

    private final Expression on;

    private final List<Identifier> using;

    public JoinCondition(Expression on, List<Identifier> using) {
        this.on = on;
        this.using = using != null ? List.copyOf(using) : List.of();
    }

    public static JoinCondition on(Expression on) {
        return new JoinCondition(on, List.of());
    }

    public static JoinCondition using(List<Identifier> columns) {
        return new JoinCondition(null, columns);
    }

    public Optional<Expression> getOn() {
        return Optional.ofNullable(on);
    }

    public List<Identifier> getUsing() {
        return using;
    }

    @Override
    public String toString() {
        if (on != null) {
            return " ON " + on;
        }
        return using.isEmpty() ? "" : " USING " + using;
    }
}
