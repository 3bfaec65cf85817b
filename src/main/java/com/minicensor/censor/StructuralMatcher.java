package com.minicensor.censor;

import com.minicensor.parser.QueryStatement;
import com.minicensor.parser.Statement;
import com.minicensor.parser.Wildcard;
import com.minicensor.parser.clauses.AliasedTableExpression;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.IndexHints;
import com.minicensor.parser.clauses.JoinCondition;
import com.minicensor.parser.clauses.JoinTableExpression;
import com.minicensor.parser.clauses.Limit;
import com.minicensor.parser.clauses.ParenTableExpression;
import com.minicensor.parser.clauses.TableExpression;
import com.minicensor.parser.clauses.WhereClause;
import com.minicensor.parser.statements.*;

import java.util.List;
import java.util.Optional;

/**
 * StructuralMatcher - 语句级别的结构匹配
 *
 * 判断一条已解析的查询是否被一条已解析的模式覆盖。模式与查询使用同一套AST,
 * 只是在特定位置上可以出现通配符哨兵。
 *
 * 匹配流程:
 * 1. 模式是与查询同类的整条语句通配符(%%SELECT%% 等) → 匹配
 * 2. 语句类型不同 → 不匹配
 * 3. 按模式的语句类型分发,逐字段比较,任意字段不同立即返回false
 * 4. 表达式、投影、排序、赋值交给ExpressionMatcher
 *
 * 设计原则:
 * - 不抛异常: 结构不一致只是false,永远不是错误
 * - 封闭集合: 每个switch都有显式的default分支返回false
 * - 无状态: 匹配器只持有不可变的注册表,可以被多个线程共享
 *
 * 使用示例:
 * <pre>
 * SQLParser parser = new SQLParser();
 * StructuralMatcher matcher = new StructuralMatcher(parser.getWildcards());
 *
 * Statement pattern = parser.parse("SELECT %%COLUMN%% FROM users WHERE id = %%VALUE%%");
 * matcher.matches(parser.parse("SELECT name FROM users WHERE id = 42"), pattern);     // true
 * matcher.matches(parser.parse("SELECT name FROM accounts WHERE id = 42"), pattern);  // false
 * </pre>
 */
public class StructuralMatcher {

    private final WildcardRegistry wildcards;

    private final ExpressionMatcher expressions;

    public StructuralMatcher(WildcardRegistry wildcards) {
        if (wildcards == null) {
            throw new IllegalArgumentException("Wildcard registry cannot be null");
        }
        this.wildcards = wildcards;
        this.expressions = new ExpressionMatcher(wildcards, this);
    }

    public WildcardRegistry getWildcards() {
        return wildcards;
    }

    public ExpressionMatcher getExpressionMatcher() {
        return expressions;
    }

    /**
     * 匹配一条查询与一条模式
     *
     * @param query 已解析的查询
     * @param pattern 已解析的模式
     * @return 查询是否被模式覆盖
     * @throws IllegalArgumentException 如果任一参数为null
     */
    public boolean matches(Statement query, Statement pattern) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        return matchStatement(query, pattern);
    }

    /**
     * 匹配查询语句(子查询、UNION两侧、INSERT ... SELECT、括号内语句)
     *
     * 这些位置上模式可以是 %%SUBQUERY%%。
     */
    boolean matchesQuery(QueryStatement query, QueryStatement pattern) {
        if (wildcards.isSubqueryWildcard(pattern)) {
            return true;
        }
        return matchStatement(query, pattern);
    }

    private boolean matchStatement(Statement query, Statement pattern) {
        if (wildcards.isWholeStatementWildcard(pattern, Wildcard.forStatement(query.getType()))) {
            return true;
        }

        if (query.getType() != pattern.getType()) {
            return false;
        }

        switch (pattern.getType()) {
            case SELECT:
                return matchSelect((SelectStatement) query, (SelectStatement) pattern);

            case UNION:
                return matchUnion((UnionStatement) query, (UnionStatement) pattern);

            case PAREN_SELECT:
                return matchesQuery(((ParenSelectStatement) query).getInner(),
                        ((ParenSelectStatement) pattern).getInner());

            case INSERT:
                return matchInsert((InsertStatement) query, (InsertStatement) pattern);

            case UPDATE:
                return matchUpdate((UpdateStatement) query, (UpdateStatement) pattern);

            case DELETE:
                return matchDelete((DeleteStatement) query, (DeleteStatement) pattern);

            case SET:
                return matchSet((SetStatement) query, (SetStatement) pattern);

            case SHOW:
                return matchShow((ShowStatement) query, (ShowStatement) pattern);

            case USE:
                return ((UseStatement) query).getDatabase().equals(((UseStatement) pattern).getDatabase());

            case DDL:
                return matchDDL((DDLStatement) query, (DDLStatement) pattern);

            case DBDDL:
                return matchDBDDL((DBDDLStatement) query, (DBDDLStatement) pattern);

            case STREAM:
                return matchStream((StreamStatement) query, (StreamStatement) pattern);

            case BEGIN:
            case COMMIT:
            case ROLLBACK:
            case OTHER_READ:
            case OTHER_ADMIN:
                // 没有可比较的字段
                return true;

            default:
                // 语句通配符出现在不对应的位置上
                return false;
        }
    }

    // ==================== 查询语句 ====================

    private boolean matchSelect(SelectStatement query, SelectStatement pattern) {
        if (!query.getComments().equals(pattern.getComments())) {
            return false;
        }
        if (!ExpressionMatcher.equalsIgnoreCase(query.getCache(), pattern.getCache())) {
            return false;
        }
        if (query.isDistinct() != pattern.isDistinct()) {
            return false;
        }
        if (!ExpressionMatcher.equalsIgnoreCase(query.getHints(), pattern.getHints())) {
            return false;
        }
        if (!expressions.matchesSelectItems(query.getSelectItems(), pattern.getSelectItems())) {
            return false;
        }
        if (!matchTables(query.getFrom(), pattern.getFrom())) {
            return false;
        }
        if (!matchWhere(query.getWhere(), pattern.getWhere())) {
            return false;
        }
        if (!expressions.matchesAll(query.getGroupBy(), pattern.getGroupBy())) {
            return false;
        }
        if (!matchWhere(query.getHaving(), pattern.getHaving())) {
            return false;
        }
        if (!expressions.matchesOrderBy(query.getOrderBy(), pattern.getOrderBy())) {
            return false;
        }
        if (!matchLimit(query.getLimit(), pattern.getLimit())) {
            return false;
        }
        return query.getLock() == pattern.getLock();
    }

    private boolean matchUnion(UnionStatement query, UnionStatement pattern) {
        if (query.getUnionType() != pattern.getUnionType()) {
            return false;
        }
        if (!matchesQuery(query.getLeft(), pattern.getLeft())) {
            return false;
        }
        if (!matchesQuery(query.getRight(), pattern.getRight())) {
            return false;
        }
        if (!expressions.matchesOrderBy(query.getOrderBy(), pattern.getOrderBy())) {
            return false;
        }
        if (!matchLimit(query.getLimit(), pattern.getLimit())) {
            return false;
        }
        return query.getLock() == pattern.getLock();
    }

    // ==================== 数据修改语句 ====================

    private boolean matchInsert(InsertStatement query, InsertStatement pattern) {
        if (query.getAction() != pattern.getAction()) {
            return false;
        }
        if (!query.getComments().equals(pattern.getComments())) {
            return false;
        }
        if (query.isIgnore() != pattern.isIgnore()) {
            return false;
        }
        if (!query.getTable().equals(pattern.getTable())) {
            return false;
        }
        if (!expressions.matchesIdentifiers(query.getPartitions(), pattern.getPartitions())) {
            return false;
        }
        if (!matchInsertColumns(query.getColumns(), pattern.getColumns())) {
            return false;
        }
        if (!matchRows(query, pattern)) {
            return false;
        }
        return expressions.matchesAssignments(query.getOnDuplicate(), pattern.getOnDuplicate());
    }

    /**
     * 匹配INSERT列列表
     *
     * 模式最后一列是 %%COLUMN%% 时,它吸收查询末尾至少一列;前面的列逐个比较。
     */
    private boolean matchInsertColumns(List<Identifier> query, List<Identifier> pattern) {
        int last = pattern.size() - 1;
        if (last >= 0 && wildcards.isColumnWildcard(pattern.get(last))) {
            if (query.size() < pattern.size()) {
                return false;
            }
            for (int i = 0; i < last; i++) {
                if (!expressions.matchesIdentifier(query.get(i), pattern.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return expressions.matchesIdentifiers(query, pattern);
    }

    private boolean matchRows(InsertStatement query, InsertStatement pattern) {
        Optional<QueryStatement> querySource = query.getSource();
        Optional<QueryStatement> patternSource = pattern.getSource();
        if (querySource.isPresent() != patternSource.isPresent()) {
            return false;
        }
        if (patternSource.isPresent()) {
            return matchesQuery(querySource.get(), patternSource.get());
        }

        if (query.getRows().size() != pattern.getRows().size()) {
            return false;
        }
        for (int i = 0; i < pattern.getRows().size(); i++) {
            if (!expressions.matchesTuple(query.getRows().get(i), pattern.getRows().get(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean matchUpdate(UpdateStatement query, UpdateStatement pattern) {
        if (!query.getComments().equals(pattern.getComments())) {
            return false;
        }
        if (!matchTables(query.getTables(), pattern.getTables())) {
            return false;
        }
        if (!expressions.matchesAssignments(query.getAssignments(), pattern.getAssignments())) {
            return false;
        }
        if (!matchWhere(query.getWhere(), pattern.getWhere())) {
            return false;
        }
        if (!expressions.matchesOrderBy(query.getOrderBy(), pattern.getOrderBy())) {
            return false;
        }
        return matchLimit(query.getLimit(), pattern.getLimit());
    }

    private boolean matchDelete(DeleteStatement query, DeleteStatement pattern) {
        if (!query.getComments().equals(pattern.getComments())) {
            return false;
        }
        if (!query.getTargets().equals(pattern.getTargets())) {
            return false;
        }
        if (!matchTables(query.getTables(), pattern.getTables())) {
            return false;
        }
        if (!expressions.matchesIdentifiers(query.getPartitions(), pattern.getPartitions())) {
            return false;
        }
        if (!matchWhere(query.getWhere(), pattern.getWhere())) {
            return false;
        }
        if (!expressions.matchesOrderBy(query.getOrderBy(), pattern.getOrderBy())) {
            return false;
        }
        return matchLimit(query.getLimit(), pattern.getLimit());
    }

    // ==================== 其他语句 ====================

    private boolean matchSet(SetStatement query, SetStatement pattern) {
        return query.getComments().equals(pattern.getComments())
                && ExpressionMatcher.equalsIgnoreCase(query.getScope(), pattern.getScope())
                && expressions.matchesAssignments(query.getAssignments(), pattern.getAssignments());
    }

    private boolean matchShow(ShowStatement query, ShowStatement pattern) {
        return query.getShowType().equalsIgnoreCase(pattern.getShowType())
                && query.getDatabase().equals(pattern.getDatabase())
                && query.getLikePattern().equals(pattern.getLikePattern())
                && matchWhere(query.getWhere(), pattern.getWhere());
    }

    private boolean matchDDL(DDLStatement query, DDLStatement pattern) {
        return query.getAction() == pattern.getAction()
                && query.isIfExists() == pattern.isIfExists()
                && query.getTable().equals(pattern.getTable())
                && query.getNewName().equals(pattern.getNewName());
    }

    private boolean matchDBDDL(DBDDLStatement query, DBDDLStatement pattern) {
        return query.getAction() == pattern.getAction()
                && query.isIfExists() == pattern.isIfExists()
                && query.getDatabase().equals(pattern.getDatabase());
    }

    private boolean matchStream(StreamStatement query, StreamStatement pattern) {
        return query.getComments().equals(pattern.getComments())
                && query.getTable().equals(pattern.getTable())
                && expressions.matchesSelectItem(query.getSelectItem(), pattern.getSelectItem());
    }

    // ==================== 子句 ====================

    /**
     * 匹配WHERE/HAVING子句
     *
     * %%WHERE%% 匹配任意条件,也匹配查询没有WHERE的情况。
     */
    private boolean matchWhere(Optional<WhereClause> query, Optional<WhereClause> pattern) {
        if (pattern.isPresent() && wildcards.isWhereWildcard(pattern.get())) {
            return true;
        }
        if (query.isEmpty() && pattern.isEmpty()) {
            return true;
        }
        if (query.isEmpty() || pattern.isEmpty()) {
            return false;
        }
        WhereClause queryWhere = query.get();
        WhereClause patternWhere = pattern.get();
        return queryWhere.getClauseType() == patternWhere.getClauseType()
                && expressions.matches(queryWhere.getExpression(), patternWhere.getExpression());
    }

    private boolean matchLimit(Optional<Limit> query, Optional<Limit> pattern) {
        if (query.isEmpty() && pattern.isEmpty()) {
            return true;
        }
        if (query.isEmpty() || pattern.isEmpty()) {
            return false;
        }
        return expressions.matchesOptional(query.get().getOffset(), pattern.get().getOffset())
                && expressions.matches(query.get().getRowCount(), pattern.get().getRowCount());
    }

    private boolean matchTables(List<TableExpression> query, List<TableExpression> pattern) {
        if (query.size() != pattern.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            if (!matchTable(query.get(i), pattern.get(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean matchTable(TableExpression query, TableExpression pattern) {
        if (query.getTableExpressionType() != pattern.getTableExpressionType()) {
            return false;
        }

        switch (pattern.getTableExpressionType()) {
            case ALIASED:
                return matchAliasedTable((AliasedTableExpression) query, (AliasedTableExpression) pattern);

            case JOIN:
                return matchJoin((JoinTableExpression) query, (JoinTableExpression) pattern);

            case PAREN:
                return matchTables(((ParenTableExpression) query).getTables(),
                        ((ParenTableExpression) pattern).getTables());

            default:
                return false;
        }
    }

    private boolean matchAliasedTable(AliasedTableExpression query, AliasedTableExpression pattern) {
        if (pattern.getSubquery().isPresent()) {
            if (query.getSubquery().isEmpty()
                    || !expressions.matchesSubquery(query.getSubquery().get(), pattern.getSubquery().get())) {
                return false;
            }
        } else if (!query.getTableName().equals(pattern.getTableName())) {
            return false;
        }
        if (!expressions.matchesIdentifiers(query.getPartitions(), pattern.getPartitions())) {
            return false;
        }
        if (!query.getAlias().equals(pattern.getAlias())) {
            return false;
        }
        return matchIndexHints(query.getIndexHints(), pattern.getIndexHints());
    }

    private boolean matchIndexHints(Optional<IndexHints> query, Optional<IndexHints> pattern) {
        if (query.isEmpty() && pattern.isEmpty()) {
            return true;
        }
        if (query.isEmpty() || pattern.isEmpty()) {
            return false;
        }
        return query.get().getHintType() == pattern.get().getHintType()
                && query.get().getIndexes().equals(pattern.get().getIndexes());
    }

    private boolean matchJoin(JoinTableExpression query, JoinTableExpression pattern) {
        if (query.getJoinType() != pattern.getJoinType()) {
            return false;
        }
        if (!matchJoinCondition(query.getCondition(), pattern.getCondition())) {
            return false;
        }
        return matchTable(query.getLeft(), pattern.getLeft())
                && matchTable(query.getRight(), pattern.getRight());
    }

    private boolean matchJoinCondition(JoinCondition query, JoinCondition pattern) {
        return expressions.matchesOptional(query.getOn(), pattern.getOn())
                && expressions.matchesIdentifiers(query.getUsing(), pattern.getUsing());
    }
}
