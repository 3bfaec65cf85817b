package com.minicensor.parser.clauses;

import com.minicensor.parser.Expression;

import java.util.Objects;

/**
 * WhereClause - WHERE 或 HAVING 条件子句
 *
 * 条件子句整体可以被模式通配符 %%WHERE%% 替换,此时注册表中的哨兵子句
 * 的表达式是一个WHERE通配符表达式。
 */
public final class WhereClause {

    /** 子句类型 */
    private final ClauseType clauseType;

    /** 条件表达式 */
    private final Expression expression;

    public WhereClause(ClauseType clauseType, Expression expression) {
        this.clauseType = Objects.requireNonNull(clauseType, "clauseType");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public ClauseType getClauseType() {
        return clauseType;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WhereClause)) {
            return false;
        }
        WhereClause that = (WhereClause) o;
        return clauseType == that.clauseType && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauseType, expression);
    }

    @Override
    public String toString() {
        return clauseType + " " + expression;
    }

    /**
     * 条件子句类型
     */
    public enum ClauseType {
        WHERE,
        HAVING
    }
}
