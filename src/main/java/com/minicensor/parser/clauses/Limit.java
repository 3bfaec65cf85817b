package com.minicensor.parser.clauses;

import com.minicensor.parser.Expression;

import java.util.Objects;
import java.util.Optional;

/**
 * Limit - LIMIT子句
 *
 * LIMIT 10 / LIMIT 5, 10 / LIMIT 10 OFFSET 5
 */
public final class Limit {

    /** 偏移量(没有时为null) */
    private final Expression offset;

    /** 行数 */
    private final Expression rowCount;

    public Limit(Expression offset, Expression rowCount) {
        this.offset = offset;
        this.rowCount = Objects.requireNonNull(rowCount, "rowCount");
    }

    public Optional<Expression> getOffset() {
        return Optional.ofNullable(offset);
    }

    public Expression getRowCount() {
        return rowCount;
    }

    @Override
    public String toString() {
        return "LIMIT " + (offset != null ? offset + ", " : "") + rowCount;
    }
}
