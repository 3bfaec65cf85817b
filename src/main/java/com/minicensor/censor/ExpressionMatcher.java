package com.minicensor.censor;

import com.minicensor.parser.Expression;
import com.minicensor.parser.clauses.AliasedSelectItem;
import com.minicensor.parser.clauses.Assignment;
import com.minicensor.parser.clauses.ConvertType;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.NextvalSelectItem;
import com.minicensor.parser.clauses.OrderByItem;
import com.minicensor.parser.clauses.SelectItem;
import com.minicensor.parser.clauses.StarSelectItem;
import com.minicensor.parser.clauses.WhenClause;
import com.minicensor.parser.expressions.*;

import java.util.List;
import java.util.Optional;

/**
 * ExpressionMatcher - 表达式级别的结构匹配
 *
 * 判断查询中的一个表达式是否被模式中对应位置的表达式"覆盖"。
 *
 * 匹配规则:
 * - 先看模式节点是否为通配符: %%VALUE%% / %%LIST_OF_VALUES%% 只接受字面量、布尔、NULL和绑定参数,
 *   不带表名的 %%COLUMN%% 接受任意列以及字面量、子查询、函数、CASE和括号表达式
 * - 否则两边必须是同一种表达式,再逐个字段比较,任意字段不同立即返回false
 * - 运算符、单位、字符集等关键字大小写不敏感;字面量按原文精确比较
 *
 * 设计原则:
 * - "Good taste": 按模式的getType()分发,每种表达式一个比较方法
 * - 封闭集合: 没有比较规则的表达式类型一律不匹配(default分支)
 * - 只读: 不修改任何节点,没有调用间状态,可以被多个线程同时使用
 *
 * null表示"该可选字段不存在": 两边都不存在视为匹配,只有一边存在视为不匹配。
 */
public class ExpressionMatcher {

    private final WildcardRegistry wildcards;

    /** 子查询回到语句级匹配 */
    private final StructuralMatcher statements;

    ExpressionMatcher(WildcardRegistry wildcards, StructuralMatcher statements) {
        this.wildcards = wildcards;
        this.statements = statements;
    }

    /**
     * 匹配两个表达式
     *
     * @param query 查询中的表达式(可以为null)
     * @param pattern 模式中的表达式(可以为null)
     * @return 查询表达式是否被模式覆盖
     */
    public boolean matches(Expression query, Expression pattern) {
        if (query == null && pattern == null) {
            return true;
        }
        if (query == null || pattern == null) {
            return false;
        }

        // %%VALUE%% / 非末尾位置的 %%LIST_OF_VALUES%%
        if (wildcards.isValueWildcard(pattern) || wildcards.isListOfValuesWildcard(pattern)) {
            return isValuePayload(query);
        }

        // 不带表名的 %%COLUMN%% 可以覆盖非列表达式
        if (pattern.getType() == Expression.ExpressionType.COLUMN && isAnyColumn((ColumnExpression) pattern)) {
            return isColumnLike(query);
        }

        if (query.getType() != pattern.getType()) {
            return false;
        }

        switch (pattern.getType()) {
            case AND:
                return matchAnd((AndExpression) query, (AndExpression) pattern);

            case OR:
                return matchOr((OrExpression) query, (OrExpression) pattern);

            case NOT:
                return matches(((NotExpression) query).getOperand(), ((NotExpression) pattern).getOperand());

            case PAREN:
                return matches(((ParenExpression) query).getInner(), ((ParenExpression) pattern).getInner());

            case COMPARISON:
                return matchComparison((ComparisonExpression) query, (ComparisonExpression) pattern);

            case RANGE:
                return matchRange((RangeExpression) query, (RangeExpression) pattern);

            case IS:
                return matchIs((IsExpression) query, (IsExpression) pattern);

            case EXISTS:
                return matchesSubquery(((ExistsExpression) query).getSubquery(), ((ExistsExpression) pattern).getSubquery());

            case LITERAL:
                return pattern.equals(query);

            case NULL:
                return true;

            case BOOL:
                return ((BoolExpression) query).getValue() == ((BoolExpression) pattern).getValue();

            case TUPLE:
                return matchesTuple((ValueTupleExpression) query, (ValueTupleExpression) pattern);

            case ARGUMENT:
                return ((ArgumentExpression) query).getName().equals(((ArgumentExpression) pattern).getName());

            case COLUMN:
                return matchesColumn((ColumnExpression) query, (ColumnExpression) pattern);

            case SUBQUERY:
                return matchesSubquery((SubqueryExpression) query, (SubqueryExpression) pattern);

            case BINARY:
                return matchBinary((BinaryExpression) query, (BinaryExpression) pattern);

            case UNARY:
                return matchUnary((UnaryExpression) query, (UnaryExpression) pattern);

            case INTERVAL:
                return matchInterval((IntervalExpression) query, (IntervalExpression) pattern);

            case COLLATE:
                return matchCollate((CollateExpression) query, (CollateExpression) pattern);

            case FUNCTION:
                return matchFunction((FunctionExpression) query, (FunctionExpression) pattern);

            case CASE:
                return matchCase((CaseExpression) query, (CaseExpression) pattern);

            case VALUES_FUNCTION:
                return matchesColumn(((ValuesFunctionExpression) query).getColumn(),
                        ((ValuesFunctionExpression) pattern).getColumn());

            case CONVERT:
                return matchConvert((ConvertExpression) query, (ConvertExpression) pattern);

            case CONVERT_USING:
                return matchConvertUsing((ConvertUsingExpression) query, (ConvertUsingExpression) pattern);

            case SUBSTRING:
                return matchSubstring((SubstringExpression) query, (SubstringExpression) pattern);

            case MATCH:
                return matchMatch((MatchExpression) query, (MatchExpression) pattern);

            case GROUP_CONCAT:
                return matchGroupConcat((GroupConcatExpression) query, (GroupConcatExpression) pattern);

            case DEFAULT:
                return ((DefaultExpression) query).getColumn().equals(((DefaultExpression) pattern).getColumn());

            default:
                // 未注册的通配符以及没有比较规则的类型
                return false;
        }
    }

    // ==================== 逻辑与比较 ====================

    private boolean matchAnd(AndExpression query, AndExpression pattern) {
        return matches(query.getLeft(), pattern.getLeft())
                && matches(query.getRight(), pattern.getRight());
    }

    private boolean matchOr(OrExpression query, OrExpression pattern) {
        return matches(query.getLeft(), pattern.getLeft())
                && matches(query.getRight(), pattern.getRight());
    }

    private boolean matchComparison(ComparisonExpression query, ComparisonExpression pattern) {
        if (query.getOperator() != pattern.getOperator()) {
            return false;
        }
        if (!matchesOptional(query.getEscape(), pattern.getEscape())) {
            return false;
        }
        return matches(query.getLeft(), pattern.getLeft())
                && matches(query.getRight(), pattern.getRight());
    }

    private boolean matchRange(RangeExpression query, RangeExpression pattern) {
        if (query.isNegated() != pattern.isNegated()) {
            return false;
        }
        return matches(query.getLeft(), pattern.getLeft())
                && matches(query.getFrom(), pattern.getFrom())
                && matches(query.getTo(), pattern.getTo());
    }

    private boolean matchIs(IsExpression query, IsExpression pattern) {
        return query.getOperator() == pattern.getOperator()
                && matches(query.getOperand(), pattern.getOperand());
    }

    // ==================== 值 ====================

    /**
     * 匹配值元组
     *
     * 模式最后一个元素是 %%LIST_OF_VALUES%% 时,它吸收查询元组末尾任意长度(包括0个)的值;
     * 前面的元素逐个比较。其他情况下两边长度必须相等。
     */
    public boolean matchesTuple(ValueTupleExpression query, ValueTupleExpression pattern) {
        List<Expression> queryValues = query.getValues();
        List<Expression> patternValues = pattern.getValues();
        int last = patternValues.size() - 1;

        if (last >= 0 && wildcards.isListOfValuesWildcard(patternValues.get(last))) {
            if (queryValues.size() < last) {
                return false;
            }
            for (int i = 0; i < last; i++) {
                if (!matches(queryValues.get(i), patternValues.get(i))) {
                    return false;
                }
            }
            for (int i = last; i < queryValues.size(); i++) {
                if (!isValuePayload(queryValues.get(i))) {
                    return false;
                }
            }
            return true;
        }

        return matchesAll(queryValues, patternValues);
    }

    /**
     * 值通配符能覆盖的表达式: 字面量、布尔、NULL、绑定参数
     */
    private boolean isValuePayload(Expression query) {
        switch (query.getType()) {
            case LITERAL:
            case BOOL:
            case NULL:
            case ARGUMENT:
                return true;
            default:
                return false;
        }
    }

    // ==================== 列与标识符 ====================

    /**
     * 匹配列引用
     *
     * 不带表名的 %%COLUMN%% 匹配任意列;t.%%COLUMN%% 要求表名相同。
     * 列名和表名大小写不敏感。
     */
    public boolean matchesColumn(ColumnExpression query, ColumnExpression pattern) {
        if (isAnyColumn(pattern)) {
            return true;
        }
        if (!matchesIdentifier(query.getName(), pattern.getName())) {
            return false;
        }
        return query.getQualifier().equals(pattern.getQualifier());
    }

    private boolean isAnyColumn(ColumnExpression pattern) {
        return wildcards.isColumnWildcard(pattern.getName()) && pattern.getQualifier().isEmpty();
    }

    /**
     * 列通配符在表达式位置上能覆盖的查询表达式
     */
    private boolean isColumnLike(Expression query) {
        switch (query.getType()) {
            case COLUMN:
            case LITERAL:
            case ARGUMENT:
            case SUBQUERY:
            case FUNCTION:
            case CASE:
            case PAREN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 匹配列标识符: 模式为 %%COLUMN%% 时总是匹配,否则大小写不敏感比较
     */
    public boolean matchesIdentifier(Identifier query, Identifier pattern) {
        return wildcards.isColumnWildcard(pattern) || pattern.equals(query);
    }

    public boolean matchesIdentifiers(List<Identifier> query, List<Identifier> pattern) {
        if (query.size() != pattern.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            if (!matchesIdentifier(query.get(i), pattern.get(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesOptionalIdentifier(Optional<Identifier> query, Optional<Identifier> pattern) {
        if (query.isEmpty() && pattern.isEmpty()) {
            return true;
        }
        if (query.isEmpty() || pattern.isEmpty()) {
            return false;
        }
        return matchesIdentifier(query.get(), pattern.get());
    }

    // ==================== 子查询 ====================

    public boolean matchesSubquery(SubqueryExpression query, SubqueryExpression pattern) {
        if (wildcards.isSubqueryWildcard(pattern)) {
            return true;
        }
        return statements.matchesQuery(query.getStatement(), pattern.getStatement());
    }

    // ==================== 算术 ====================

    private boolean matchBinary(BinaryExpression query, BinaryExpression pattern) {
        return query.getOperator() == pattern.getOperator()
                && matches(query.getLeft(), pattern.getLeft())
                && matches(query.getRight(), pattern.getRight());
    }

    private boolean matchUnary(UnaryExpression query, UnaryExpression pattern) {
        return query.getOperator() == pattern.getOperator()
                && matches(query.getOperand(), pattern.getOperand());
    }

    private boolean matchInterval(IntervalExpression query, IntervalExpression pattern) {
        return query.getUnit().equalsIgnoreCase(pattern.getUnit())
                && matches(query.getExpression(), pattern.getExpression());
    }

    private boolean matchCollate(CollateExpression query, CollateExpression pattern) {
        return query.getCharset().equalsIgnoreCase(pattern.getCharset())
                && matches(query.getExpression(), pattern.getExpression());
    }

    // ==================== 函数 ====================

    private boolean matchFunction(FunctionExpression query, FunctionExpression pattern) {
        if (query.isDistinct() != pattern.isDistinct()) {
            return false;
        }
        if (!query.getName().equals(pattern.getName())) {
            return false;
        }
        if (!query.getQualifier().equals(pattern.getQualifier())) {
            return false;
        }
        return matchesItemList(query.getArguments(), pattern.getArguments());
    }

    private boolean matchCase(CaseExpression query, CaseExpression pattern) {
        if (!matchesOptional(query.getOperand(), pattern.getOperand())) {
            return false;
        }
        if (!matchesOptional(query.getElseResult(), pattern.getElseResult())) {
            return false;
        }
        List<WhenClause> queryWhens = query.getWhens();
        List<WhenClause> patternWhens = pattern.getWhens();
        if (queryWhens.size() != patternWhens.size()) {
            return false;
        }
        for (int i = 0; i < patternWhens.size(); i++) {
            WhenClause queryWhen = queryWhens.get(i);
            WhenClause patternWhen = patternWhens.get(i);
            if (!matches(queryWhen.getCondition(), patternWhen.getCondition())
                    || !matches(queryWhen.getResult(), patternWhen.getResult())) {
                return false;
            }
        }
        return true;
    }

    private boolean matchConvert(ConvertExpression query, ConvertExpression pattern) {
        return matches(query.getExpression(), pattern.getExpression())
                && matchConvertType(query.getConvertType(), pattern.getConvertType());
    }

    private boolean matchConvertType(ConvertType query, ConvertType pattern) {
        if (!query.getTypeName().equalsIgnoreCase(pattern.getTypeName())) {
            return false;
        }
        if (!equalsIgnoreCase(query.getCharset(), pattern.getCharset())) {
            return false;
        }
        return query.getLength().equals(pattern.getLength())
                && query.getScale().equals(pattern.getScale());
    }

    private boolean matchConvertUsing(ConvertUsingExpression query, ConvertUsingExpression pattern) {
        return query.getCharset().equalsIgnoreCase(pattern.getCharset())
                && matches(query.getExpression(), pattern.getExpression());
    }

    private boolean matchSubstring(SubstringExpression query, SubstringExpression pattern) {
        return matchesOptional(query.getTo(), pattern.getTo())
                && matches(query.getFrom(), pattern.getFrom())
                && matchesColumn(query.getColumn(), pattern.getColumn());
    }

    private boolean matchMatch(MatchExpression query, MatchExpression pattern) {
        return query.getOption() == pattern.getOption()
                && matches(query.getAgainst(), pattern.getAgainst())
                && matchesItemList(query.getColumns(), pattern.getColumns());
    }

    private boolean matchGroupConcat(GroupConcatExpression query, GroupConcatExpression pattern) {
        return query.isDistinct() == pattern.isDistinct()
                && query.getSeparator().equals(pattern.getSeparator())
                && matchesItemList(query.getExpressions(), pattern.getExpressions())
                && matchesOrderBy(query.getOrderBy(), pattern.getOrderBy());
    }

    // ==================== 子句 ====================

    /**
     * 匹配投影列表
     *
     * 模式恰好是一个不带表名的 * 时匹配任意列表。只有SELECT的投影列表有这条规则,
     * 函数参数中的 * 按字面比较,COUNT(*) 不匹配 COUNT(password)。
     */
    public boolean matchesSelectItems(List<SelectItem> query, List<SelectItem> pattern) {
        if (wildcards.isSelectAllWildcard(pattern)) {
            return true;
        }
        return matchesItemList(query, pattern);
    }

    /**
     * 逐项匹配函数参数、MATCH列列表等
     */
    private boolean matchesItemList(List<SelectItem> query, List<SelectItem> pattern) {
        if (query.size() != pattern.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            if (!matchesSelectItem(query.get(i), pattern.get(i))) {
                return false;
            }
        }
        return true;
    }

    public boolean matchesSelectItem(SelectItem query, SelectItem pattern) {
        switch (pattern.getItemType()) {
            case STAR:
                return query.getItemType() == SelectItem.SelectItemType.STAR
                        && ((StarSelectItem) query).getTableName().equals(((StarSelectItem) pattern).getTableName());

            case ALIASED: {
                AliasedSelectItem aliasedPattern = (AliasedSelectItem) pattern;
                // %%COLUMN%% 投影项也覆盖查询中的 *
                if (query.getItemType() == SelectItem.SelectItemType.STAR) {
                    Expression expression = aliasedPattern.getExpression();
                    return expression.getType() == Expression.ExpressionType.COLUMN
                            && wildcards.isColumnWildcard(((ColumnExpression) expression).getName());
                }
                if (query.getItemType() != SelectItem.SelectItemType.ALIASED) {
                    return false;
                }
                AliasedSelectItem aliasedQuery = (AliasedSelectItem) query;
                return matchesOptionalIdentifier(aliasedQuery.getAlias(), aliasedPattern.getAlias())
                        && matches(aliasedQuery.getExpression(), aliasedPattern.getExpression());
            }

            case NEXTVAL:
                return query.getItemType() == SelectItem.SelectItemType.NEXTVAL
                        && matches(((NextvalSelectItem) query).getExpression(), ((NextvalSelectItem) pattern).getExpression());

            default:
                return false;
        }
    }

    public boolean matchesOrderBy(List<OrderByItem> query, List<OrderByItem> pattern) {
        if (query.size() != pattern.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            OrderByItem queryItem = query.get(i);
            OrderByItem patternItem = pattern.get(i);
            if (queryItem.getDirection() != patternItem.getDirection()
                    || !matches(queryItem.getExpression(), patternItem.getExpression())) {
                return false;
            }
        }
        return true;
    }

    public boolean matchesAssignments(List<Assignment> query, List<Assignment> pattern) {
        if (query.size() != pattern.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            Assignment queryAssignment = query.get(i);
            Assignment patternAssignment = pattern.get(i);
            if (!matches(queryAssignment.getValue(), patternAssignment.getValue())
                    || !matchesColumn(queryAssignment.getColumn(), patternAssignment.getColumn())) {
                return false;
            }
        }
        return true;
    }

    // ==================== 辅助方法 ====================

    /**
     * 逐个比较两个等长的表达式列表
     */
    public boolean matchesAll(List<Expression> query, List<Expression> pattern) {
        if (query.size() != pattern.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            if (!matches(query.get(i), pattern.get(i))) {
                return false;
            }
        }
        return true;
    }

    public boolean matchesOptional(Optional<Expression> query, Optional<Expression> pattern) {
        return matches(query.orElse(null), pattern.orElse(null));
    }

    static boolean equalsIgnoreCase(Optional<String> query, Optional<String> pattern) {
        if (query.isEmpty() && pattern.isEmpty()) {
            return true;
        }
        return query.isPresent() && pattern.isPresent() && query.get().equalsIgnoreCase(pattern.get());
    }
}
