package com.minicensor.censor;

import com.minicensor.parser.Expression;
import com.minicensor.parser.QueryStatement;
import com.minicensor.parser.Statement;
import com.minicensor.parser.Wildcard;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.SelectItem;
import com.minicensor.parser.clauses.StarSelectItem;
import com.minicensor.parser.clauses.WhereClause;
import com.minicensor.parser.expressions.ExpressionWildcard;
import com.minicensor.parser.expressions.SubqueryExpression;
import com.minicensor.parser.statements.StatementWildcard;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * WildcardRegistry - 通配符哨兵注册表
 *
 * 保存每种通配符对应的哨兵值,并提供判断模式节点是否为通配符的谓词。
 * 解析器从这里取哨兵构造模式AST,匹配器用同一个注册表识别它们,两边始终一致。
 *
 * 设计原则:
 * - 不可变: 构造完成后只读,可以在任意线程间共享
 * - 显式传递: 没有全局常量,解析器和匹配器都在构造时接收注册表
 * - 按值识别: 所有谓词都用equals与哨兵比较
 *
 * 使用示例:
 * <pre>
 * WildcardRegistry wildcards = WildcardRegistry.standard();
 * SQLParser parser = new SQLParser(wildcards);
 * StructuralMatcher matcher = new StructuralMatcher(wildcards);
 *
 * // 自定义哨兵: 用保留字符串字面量代表 %%VALUE%%
 * WildcardRegistry custom = WildcardRegistry.builder()
 *         .valueSentinel(LiteralExpression.string("__ANY_VALUE__"))
 *         .build();
 * </pre>
 */
public final class WildcardRegistry {

    private static final WildcardRegistry STANDARD = builder().build();

    /** 整条语句通配符: SELECT / UNION / INSERT / UPDATE / DELETE */
    private final Map<Wildcard, Statement> statementSentinels;

    private final WhereClause whereSentinel;

    private final WhereClause havingSentinel;

    private final Expression valueSentinel;

    private final Expression listOfValuesSentinel;

    private final Identifier columnSentinel;

    private final QueryStatement subquerySentinel;

    private WildcardRegistry(Builder builder) {
        this.statementSentinels = new EnumMap<>(builder.statementSentinels);
        this.whereSentinel = new WhereClause(WhereClause.ClauseType.WHERE, builder.whereSentinel);
        this.havingSentinel = new WhereClause(WhereClause.ClauseType.HAVING, builder.whereSentinel);
        this.valueSentinel = builder.valueSentinel;
        this.listOfValuesSentinel = builder.listOfValuesSentinel;
        this.columnSentinel = builder.columnSentinel;
        this.subquerySentinel = builder.subquerySentinel;
    }

    /**
     * 默认注册表,哨兵为解析器生成的通配符节点
     */
    public static WildcardRegistry standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== 哨兵 ====================

    /**
     * 整条语句通配符的哨兵
     *
     * @param kind SELECT/UNION/INSERT/UPDATE/DELETE
     * @throws IllegalArgumentException 如果kind不是整条语句通配符
     */
    public Statement statementSentinel(Wildcard kind) {
        Statement sentinel = kind != null ? statementSentinels.get(kind) : null;
        if (sentinel == null) {
            throw new IllegalArgumentException("Not a whole-statement wildcard: " + kind);
        }
        return sentinel;
    }

    public WhereClause whereSentinel() {
        return whereSentinel;
    }

    public WhereClause havingSentinel() {
        return havingSentinel;
    }

    public Expression valueSentinel() {
        return valueSentinel;
    }

    public Expression listOfValuesSentinel() {
        return listOfValuesSentinel;
    }

    public Identifier columnSentinel() {
        return columnSentinel;
    }

    public QueryStatement subquerySentinel() {
        return subquerySentinel;
    }

    // ==================== 谓词 ====================

    /**
     * 模式是否为指定种类的整条语句通配符
     */
    public boolean isWholeStatementWildcard(Statement pattern, Wildcard kind) {
        if (pattern == null || kind == null) {
            return false;
        }
        Statement sentinel = statementSentinels.get(kind);
        return sentinel != null && sentinel.equals(pattern);
    }

    /**
     * WHERE/HAVING子句是否为 %%WHERE%% 哨兵(类型和表达式都必须一致)
     */
    public boolean isWhereWildcard(WhereClause where) {
        if (where == null) {
            return false;
        }
        return whereSentinel.equals(where) || havingSentinel.equals(where);
    }

    public boolean isValueWildcard(Expression expression) {
        return expression != null && valueSentinel.equals(expression);
    }

    public boolean isListOfValuesWildcard(Expression expression) {
        return expression != null && listOfValuesSentinel.equals(expression);
    }

    /**
     * 标识符是否为 %%COLUMN%% 哨兵(按规范形式比较,大小写不敏感)
     */
    public boolean isColumnWildcard(Identifier identifier) {
        return identifier != null && columnSentinel.equals(identifier);
    }

    /**
     * 子查询的内部语句是否为 %%SUBQUERY%% 哨兵
     */
    public boolean isSubqueryWildcard(SubqueryExpression subquery) {
        return subquery != null && isSubqueryWildcard(subquery.getStatement());
    }

    /**
     * 查询语句本身是否为 %%SUBQUERY%% 哨兵(派生表、UNION两侧等位置)
     */
    public boolean isSubqueryWildcard(Statement statement) {
        return statement != null && subquerySentinel.equals(statement);
    }

    /**
     * 投影列表是否恰好是一个不带表名的 *
     */
    public boolean isSelectAllWildcard(List<SelectItem> selectItems) {
        if (selectItems == null || selectItems.size() != 1) {
            return false;
        }
        SelectItem item = selectItems.get(0);
        return item.getItemType() == SelectItem.SelectItemType.STAR
                && ((StarSelectItem) item).isUnqualified();
    }

    /**
     * 自定义注册表构造器,未设置的哨兵取默认值
     */
    public static final class Builder {

        private final Map<Wildcard, Statement> statementSentinels = new EnumMap<>(Wildcard.class);

        private Expression whereSentinel = new ExpressionWildcard(Wildcard.WHERE);

        private Expression valueSentinel = new ExpressionWildcard(Wildcard.VALUE);

        private Expression listOfValuesSentinel = new ExpressionWildcard(Wildcard.LIST_OF_VALUES);

        private Identifier columnSentinel = Identifier.reserved(Wildcard.COLUMN.getToken());

        private QueryStatement subquerySentinel = new StatementWildcard(Wildcard.SUBQUERY);

        private Builder() {
            for (Wildcard kind : Wildcard.values()) {
                if (kind.isStatementLevel()) {
                    statementSentinels.put(kind, new StatementWildcard(kind));
                }
            }
        }

        public Builder statementSentinel(Wildcard kind, Statement sentinel) {
            if (kind == null || !kind.isStatementLevel()) {
                throw new IllegalArgumentException("Not a whole-statement wildcard: " + kind);
            }
            statementSentinels.put(kind, Objects.requireNonNull(sentinel, "sentinel"));
            return this;
        }

        /**
         * WHERE哨兵内部的表达式,WHERE和HAVING两种子句共用
         */
        public Builder whereSentinel(Expression sentinel) {
            this.whereSentinel = Objects.requireNonNull(sentinel, "sentinel");
            return this;
        }

        public Builder valueSentinel(Expression sentinel) {
            this.valueSentinel = Objects.requireNonNull(sentinel, "sentinel");
            return this;
        }

        public Builder listOfValuesSentinel(Expression sentinel) {
            this.listOfValuesSentinel = Objects.requireNonNull(sentinel, "sentinel");
            return this;
        }

        public Builder columnSentinel(Identifier sentinel) {
            this.columnSentinel = Objects.requireNonNull(sentinel, "sentinel");
            return this;
        }

        public Builder subquerySentinel(QueryStatement sentinel) {
            this.subquerySentinel = Objects.requireNonNull(sentinel, "sentinel");
            return this;
        }

        public WildcardRegistry build() {
            return new WildcardRegistry(this);
        }
    }
}
