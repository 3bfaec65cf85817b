package com.minicensor.parser.statements;

import com.minicensor.parser.QueryStatement;
import com.minicensor.parser.Wildcard;

import java.util.Objects;

/**
 * StatementWildcard - 语句位置上的通配符哨兵
 *
 * 整条语句通配符(%%SELECT%%, %%UNION%%, %%INSERT%%, %%UPDATE%%, %%DELETE%%)
 * 以及子查询通配符 %%SUBQUERY%%。
 *
 * 作为QueryStatement,可以出现在子查询、派生表、UNION两侧。
 */
public class StatementWildcard implements QueryStatement {

    private final Wildcard kind;

    public StatementWildcard(Wildcard kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Wildcard getKind() {
        return kind;
    }

    @Override
    public StatementType getType() {
        return StatementType.WILDCARD;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StatementWildcard && ((StatementWildcard) o).kind == kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    @Override
    public String toString() {
        return kind.getToken();
    }
}
