package com.minicensor.censor;

import com.minicensor.parser.SQLParser;
import com.minicensor.parser.Statement;
import com.minicensor.parser.Wildcard;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.SelectItem;
import com.minicensor.parser.clauses.StarSelectItem;
import com.minicensor.parser.clauses.TableName;
import com.minicensor.parser.clauses.WhereClause;
import com.minicensor.parser.expressions.ExpressionWildcard;
import com.minicensor.parser.expressions.LiteralExpression;
import com.minicensor.parser.expressions.NullExpression;
import com.minicensor.parser.expressions.SubqueryExpression;
import com.minicensor.parser.statements.StatementWildcard;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WildcardRegistryTest - 通配符注册表测试
 */
@DisplayName("通配符注册表测试")
class WildcardRegistryTest {

    private final WildcardRegistry wildcards = WildcardRegistry.standard();

    @Test
    @DisplayName("整条语句通配符只匹配对应种类")
    void testWholeStatementWildcard() {
        Statement select = wildcards.statementSentinel(Wildcard.SELECT);

        assertTrue(wildcards.isWholeStatementWildcard(select, Wildcard.SELECT));
        assertFalse(wildcards.isWholeStatementWildcard(select, Wildcard.DELETE));
        assertFalse(wildcards.isWholeStatementWildcard(null, Wildcard.SELECT));
        assertFalse(wildcards.isWholeStatementWildcard(select, null));
    }

    @Test
    @DisplayName("非语句级通配符没有语句哨兵")
    void testStatementSentinelRejectsExpressionKinds() {
        assertThrows(IllegalArgumentException.class, () -> wildcards.statementSentinel(Wildcard.VALUE));
        assertThrows(IllegalArgumentException.class, () -> wildcards.statementSentinel(null));
        assertThrows(IllegalArgumentException.class,
                () -> WildcardRegistry.builder().statementSentinel(Wildcard.WHERE, new StatementWildcard(Wildcard.WHERE)));
    }

    @Test
    @DisplayName("WHERE哨兵同时识别WHERE和HAVING")
    void testWhereWildcard() {
        assertTrue(wildcards.isWhereWildcard(wildcards.whereSentinel()));
        assertTrue(wildcards.isWhereWildcard(wildcards.havingSentinel()));
        assertFalse(wildcards.isWhereWildcard(null));
        assertFalse(wildcards.isWhereWildcard(
                new WhereClause(WhereClause.ClauseType.WHERE, new ExpressionWildcard(Wildcard.VALUE))));
    }

    @Test
    @DisplayName("值哨兵与同名字符串字面量不相等")
    void testValueWildcardIsTagged() {
        assertTrue(wildcards.isValueWildcard(new ExpressionWildcard(Wildcard.VALUE)));
        assertFalse(wildcards.isValueWildcard(LiteralExpression.string("%%VALUE%%")));
        assertFalse(wildcards.isValueWildcard(new ExpressionWildcard(Wildcard.LIST_OF_VALUES)));
        assertTrue(wildcards.isListOfValuesWildcard(new ExpressionWildcard(Wildcard.LIST_OF_VALUES)));
        assertFalse(wildcards.isValueWildcard(null));
    }

    @Test
    @DisplayName("列哨兵大小写不敏感,但普通标识符永远不是哨兵")
    void testColumnWildcard() {
        assertTrue(wildcards.isColumnWildcard(Identifier.reserved("%%column%%")));
        assertFalse(wildcards.isColumnWildcard(Identifier.of("%%COLUMN%%")));
        assertFalse(wildcards.isColumnWildcard(null));
    }

    @Test
    @DisplayName("子查询哨兵")
    void testSubqueryWildcard() {
        assertTrue(wildcards.isSubqueryWildcard(new SubqueryExpression(wildcards.subquerySentinel())));
        assertTrue(wildcards.isSubqueryWildcard(wildcards.subquerySentinel()));
        assertFalse(wildcards.isSubqueryWildcard(wildcards.statementSentinel(Wildcard.SELECT)));
        assertFalse(wildcards.isSubqueryWildcard((SubqueryExpression) null));
    }

    @Test
    @DisplayName("只有单个不带表名的 * 才是投影通配")
    void testSelectAllWildcard() {
        SelectItem star = new StarSelectItem(null);
        SelectItem tableStar = new StarSelectItem(TableName.of("t"));

        assertTrue(wildcards.isSelectAllWildcard(List.of(star)));
        assertFalse(wildcards.isSelectAllWildcard(List.of(tableStar)));
        assertFalse(wildcards.isSelectAllWildcard(List.of(star, star)));
        assertFalse(wildcards.isSelectAllWildcard(List.of()));
    }

    @Test
    @DisplayName("自定义哨兵在解析和匹配两侧保持一致")
    void testCustomRegistry() {
        WildcardRegistry custom = WildcardRegistry.builder()
                .valueSentinel(new NullExpression())
                .build();
        SQLParser parser = new SQLParser(custom);
        StructuralMatcher matcher = new StructuralMatcher(custom);

        Statement pattern = parser.parse("SELECT a FROM t WHERE id = %%VALUE%%");

        assertTrue(custom.isValueWildcard(new NullExpression()));
        assertTrue(matcher.matches(parser.parse("SELECT a FROM t WHERE id = 7"), pattern));
        assertFalse(wildcards.isValueWildcard(new NullExpression()));
    }
}
