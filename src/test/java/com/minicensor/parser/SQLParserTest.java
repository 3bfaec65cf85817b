package com.minicensor.parser;

import com.minicensor.censor.WildcardRegistry;
import com.minicensor.parser.clauses.*;
import com.minicensor.parser.expressions.*;
import com.minicensor.parser.statements.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SQLParserTest - SQL解析器单元测试
 *
 * 测试查询文本和模式文本的解析结果。
 *
 * 设计原则:
 * - 每个测试用例只测试一种语句或一个通配符记号
 * - 通配符必须解析为注册表中的哨兵,而不是普通节点
 */
@DisplayName("SQL 解析器测试")
class SQLParserTest {

    private final SQLParser parser = new SQLParser();

    private final WildcardRegistry wildcards = WildcardRegistry.standard();

    private SelectStatement select(String sql) {
        Statement stmt = parser.parse(sql);
        assertInstanceOf(SelectStatement.class, stmt);
        return (SelectStatement) stmt;
    }

    private Expression where(String sql) {
        return select(sql).getWhere().orElseThrow().getExpression();
    }

    // ==================== 查询语句 ====================

    @Test
    @DisplayName("解析 SELECT * 语句")
    void testSelectAll() {
        SelectStatement select = select("SELECT * FROM users;");

        assertEquals(1, select.getSelectItems().size());
        assertTrue(wildcards.isSelectAllWildcard(select.getSelectItems()));
        assertEquals(1, select.getFrom().size());

        AliasedTableExpression table = (AliasedTableExpression) select.getFrom().get(0);
        assertEquals(TableName.of("users"), table.getTableName().orElseThrow());
        assertFalse(select.getWhere().isPresent());
    }

    @Test
    @DisplayName("解析 SELECT 完整子句")
    void testSelectClauses() {
        SelectStatement select = select(
                "SELECT DISTINCT u.name AS n, COUNT(*) FROM users u WHERE age > 18 "
                        + "GROUP BY u.name HAVING COUNT(*) > 1 ORDER BY n DESC LIMIT 10, 20 FOR UPDATE");

        assertTrue(select.isDistinct());
        assertEquals(2, select.getSelectItems().size());

        AliasedSelectItem first = (AliasedSelectItem) select.getSelectItems().get(0);
        assertEquals(Identifier.of("n"), first.getAlias().orElseThrow());
        ColumnExpression column = (ColumnExpression) first.getExpression();
        assertEquals(TableName.of("u"), column.getQualifier().orElseThrow());

        AliasedTableExpression table = (AliasedTableExpression) select.getFrom().get(0);
        assertEquals(Identifier.of("u"), table.getAlias().orElseThrow());

        assertEquals(1, select.getGroupBy().size());
        assertEquals(WhereClause.ClauseType.HAVING, select.getHaving().orElseThrow().getClauseType());
        assertEquals(OrderByItem.Direction.DESC, select.getOrderBy().get(0).getDirection());

        Limit limit = select.getLimit().orElseThrow();
        assertEquals(LiteralExpression.integer(10), limit.getOffset().orElseThrow());
        assertEquals(LiteralExpression.integer(20), limit.getRowCount());
        assertEquals(LockMode.FOR_UPDATE, select.getLock());
    }

    @Test
    @DisplayName("解析 UNION 语句 - 左结合")
    void testUnion() {
        Statement stmt = parser.parse("SELECT a FROM t1 UNION ALL SELECT b FROM t2 UNION SELECT c FROM t3 ORDER BY a LIMIT 5");

        assertInstanceOf(UnionStatement.class, stmt);
        UnionStatement outer = (UnionStatement) stmt;
        assertEquals(UnionStatement.UnionType.UNION, outer.getUnionType());
        assertEquals(1, outer.getOrderBy().size());
        assertTrue(outer.getLimit().isPresent());

        assertInstanceOf(UnionStatement.class, outer.getLeft());
        UnionStatement inner = (UnionStatement) outer.getLeft();
        assertEquals(UnionStatement.UnionType.UNION_ALL, inner.getUnionType());
        assertTrue(inner.getOrderBy().isEmpty());
    }

    @Test
    @DisplayName("UNION 两侧可以是 %%SUBQUERY%% 或 %%SELECT%%")
    void testUnionWildcardOperands() {
        UnionStatement bare = (UnionStatement) parser.parse("SELECT a FROM t UNION %%SUBQUERY%%");
        assertTrue(wildcards.isSubqueryWildcard(bare.getRight()));

        UnionStatement paren = (UnionStatement) parser.parse("SELECT a FROM t UNION ALL (%%SUBQUERY%%)");
        assertTrue(wildcards.isSubqueryWildcard(paren.getRight()));

        UnionStatement selects = (UnionStatement) parser.parse("%%SELECT%% UNION %%SELECT%%");
        assertTrue(wildcards.isWholeStatementWildcard(selects.getLeft(), Wildcard.SELECT));
        assertTrue(wildcards.isWholeStatementWildcard(selects.getRight(), Wildcard.SELECT));
    }

    @Test
    @DisplayName("解析括号包裹的 SELECT")
    void testParenSelect() {
        Statement stmt = parser.parse("(SELECT a FROM t)");

        assertInstanceOf(ParenSelectStatement.class, stmt);
        assertInstanceOf(SelectStatement.class, ((ParenSelectStatement) stmt).getInner());
    }

    @Test
    @DisplayName("解析 JOIN")
    void testJoin() {
        SelectStatement select = select("SELECT * FROM a LEFT JOIN b ON a.id = b.aid JOIN c USING (id)");

        JoinTableExpression outer = (JoinTableExpression) select.getFrom().get(0);
        assertEquals(JoinTableExpression.JoinType.JOIN, outer.getJoinType());
        assertEquals(List.of(Identifier.of("id")), outer.getCondition().getUsing());

        JoinTableExpression inner = (JoinTableExpression) outer.getLeft();
        assertEquals(JoinTableExpression.JoinType.LEFT_JOIN, inner.getJoinType());
        assertTrue(inner.getCondition().getOn().isPresent());
    }

    // ==================== 数据修改语句 ====================

    @Test
    @DisplayName("解析 INSERT 语句 - 多行")
    void testInsertMultipleRows() {
        Statement stmt = parser.parse("INSERT INTO users (id, name) VALUES (1, 'Alice'), (2, 'Bob')");

        assertInstanceOf(InsertStatement.class, stmt);
        InsertStatement insert = (InsertStatement) stmt;
        assertEquals(InsertStatement.Action.INSERT, insert.getAction());
        assertEquals(TableName.of("users"), insert.getTable());
        assertEquals(List.of(Identifier.of("id"), Identifier.of("name")), insert.getColumns());
        assertEquals(2, insert.getRows().size());
        assertEquals(LiteralExpression.string("Bob"), insert.getRows().get(1).getValues().get(1));
        assertFalse(insert.getSource().isPresent());
    }

    @Test
    @DisplayName("解析 INSERT ... SET 改写为列列表加单行")
    void testInsertSet() {
        InsertStatement insert = (InsertStatement) parser.parse("REPLACE INTO t SET a = 1, b = 'x'");

        assertEquals(InsertStatement.Action.REPLACE, insert.getAction());
        assertEquals(List.of(Identifier.of("a"), Identifier.of("b")), insert.getColumns());
        assertEquals(1, insert.getRows().size());
        assertEquals(2, insert.getRows().get(0).size());
    }

    @Test
    @DisplayName("解析 INSERT ... SELECT")
    void testInsertSelect() {
        InsertStatement insert = (InsertStatement) parser.parse("INSERT INTO archive SELECT * FROM logs");

        assertTrue(insert.getSource().isPresent());
        assertTrue(insert.getRows().isEmpty());
    }

    @Test
    @DisplayName("解析 UPDATE 语句")
    void testUpdate() {
        Statement stmt = parser.parse("UPDATE users SET age = 26, name = 'Bob' WHERE id = 1 LIMIT 1");

        assertInstanceOf(UpdateStatement.class, stmt);
        UpdateStatement update = (UpdateStatement) stmt;
        assertEquals(2, update.getAssignments().size());
        assertEquals(Identifier.of("age"), update.getAssignments().get(0).getColumn().getName());
        assertTrue(update.getWhere().isPresent());
        assertTrue(update.getLimit().isPresent());
    }

    @Test
    @DisplayName("解析 DELETE 语句")
    void testDelete() {
        Statement stmt = parser.parse("DELETE FROM users WHERE id = 1");

        assertInstanceOf(DeleteStatement.class, stmt);
        DeleteStatement delete = (DeleteStatement) stmt;
        assertTrue(delete.getTargets().isEmpty());
        assertEquals(1, delete.getTables().size());
        assertTrue(delete.getWhere().isPresent());
    }

    @Test
    @DisplayName("解析多表 DELETE 语句")
    void testMultiTableDelete() {
        DeleteStatement delete = (DeleteStatement) parser.parse("DELETE a FROM a JOIN b ON a.id = b.id");

        assertEquals(List.of(TableName.of("a")), delete.getTargets());
        assertInstanceOf(JoinTableExpression.class, delete.getTables().get(0));
    }

    // ==================== 其他语句 ====================

    @Test
    @DisplayName("解析事务与管理语句")
    void testOtherStatements() {
        assertEquals(Statement.StatementType.BEGIN, parser.parse("BEGIN").getType());
        assertEquals(Statement.StatementType.BEGIN, parser.parse("START TRANSACTION").getType());
        assertEquals(Statement.StatementType.COMMIT, parser.parse("COMMIT").getType());
        assertEquals(Statement.StatementType.ROLLBACK, parser.parse("ROLLBACK").getType());
        assertEquals(Statement.StatementType.OTHER_READ, parser.parse("DESCRIBE users").getType());
        assertEquals(Statement.StatementType.OTHER_ADMIN, parser.parse("OPTIMIZE TABLE users").getType());
    }

    @Test
    @DisplayName("解析 SET / SHOW / USE 语句")
    void testSessionStatements() {
        SetStatement set = (SetStatement) parser.parse("SET SESSION autocommit = 1");
        assertEquals("session", set.getScope().orElseThrow());
        assertEquals(1, set.getAssignments().size());

        ShowStatement show = (ShowStatement) parser.parse("SHOW TABLES FROM shop LIKE 'user%'");
        assertEquals("tables", show.getShowType().toLowerCase());
        assertEquals(Identifier.of("shop"), show.getDatabase().orElseThrow());
        assertEquals("user%", show.getLikePattern().orElseThrow());

        UseStatement use = (UseStatement) parser.parse("USE shop");
        assertEquals(Identifier.of("SHOP"), use.getDatabase());
    }

    @Test
    @DisplayName("解析 DDL 语句")
    void testDDL() {
        DDLStatement create = (DDLStatement) parser.parse("CREATE TABLE IF NOT EXISTS users (id INT, name VARCHAR(100))");
        assertEquals(DDLStatement.Action.CREATE, create.getAction());
        assertTrue(create.isIfExists());
        assertEquals(TableName.of("users"), create.getTable());

        DDLStatement rename = (DDLStatement) parser.parse("RENAME TABLE a TO b");
        assertEquals(TableName.of("b"), rename.getNewName().orElseThrow());

        DBDDLStatement drop = (DBDDLStatement) parser.parse("DROP DATABASE shop");
        assertEquals(DBDDLStatement.Action.DROP, drop.getAction());
        assertEquals(Identifier.of("shop"), drop.getDatabase());
    }

    // ==================== 表达式 ====================

    @Test
    @DisplayName("负数字面量折叠为字面量")
    void testNegativeLiteral() {
        ComparisonExpression comparison = (ComparisonExpression) where("SELECT a FROM t WHERE x = -5");

        assertEquals(new LiteralExpression(LiteralExpression.LiteralType.INTEGER, "-5"), comparison.getRight());
    }

    @Test
    @DisplayName("字符串转义与十六进制字面量")
    void testLiterals() {
        ComparisonExpression escaped = (ComparisonExpression) where("SELECT a FROM t WHERE x = 'it''s'");
        assertEquals(LiteralExpression.string("it's"), escaped.getRight());

        ComparisonExpression hex = (ComparisonExpression) where("SELECT a FROM t WHERE x = X'1F'");
        assertEquals(new LiteralExpression(LiteralExpression.LiteralType.HEX_STRING, "1F"), hex.getRight());
    }

    @Test
    @DisplayName("解析 IN / BETWEEN / IS NULL / LIKE")
    void testPredicates() {
        ComparisonExpression in = (ComparisonExpression) where("SELECT a FROM t WHERE id IN (1, 2, 3)");
        assertEquals(ComparisonOperator.IN, in.getOperator());
        assertEquals(3, ((ValueTupleExpression) in.getRight()).size());

        RangeExpression between = (RangeExpression) where("SELECT a FROM t WHERE age NOT BETWEEN 1 AND 10");
        assertTrue(between.isNegated());

        IsExpression is = (IsExpression) where("SELECT a FROM t WHERE name IS NOT NULL");
        assertEquals(IsExpression.IsOperator.IS_NOT_NULL, is.getOperator());

        ComparisonExpression like = (ComparisonExpression) where("SELECT a FROM t WHERE name LIKE 'a%'");
        assertEquals(ComparisonOperator.LIKE, like.getOperator());
    }

    @Test
    @DisplayName("解析函数、CASE 和绑定参数")
    void testFunctionsAndArguments() {
        SelectStatement select = select(
                "SELECT COUNT(DISTINCT id), CASE WHEN a > 1 THEN 'x' ELSE 'y' END FROM t WHERE id = ? AND name = :name");

        FunctionExpression count = (FunctionExpression) ((AliasedSelectItem) select.getSelectItems().get(0)).getExpression();
        assertEquals(Identifier.of("count"), count.getName());
        assertTrue(count.isDistinct());

        CaseExpression caseExpr = (CaseExpression) ((AliasedSelectItem) select.getSelectItems().get(1)).getExpression();
        assertEquals(1, caseExpr.getWhens().size());
        assertTrue(caseExpr.getElseResult().isPresent());

        AndExpression and = (AndExpression) select.getWhere().orElseThrow().getExpression();
        ComparisonExpression positional = (ComparisonExpression) and.getLeft();
        assertTrue(((ArgumentExpression) positional.getRight()).isPositional());
        ComparisonExpression named = (ComparisonExpression) and.getRight();
        assertEquals(":name", ((ArgumentExpression) named.getRight()).getName());
    }

    @Test
    @DisplayName("收集紧跟关键字的块注释")
    void testComments() {
        SelectStatement select = select("SELECT /* report */ name FROM users -- trailing");

        assertEquals(List.of("/* report */"), select.getComments());
    }

    @Test
    @DisplayName("关键字大小写不敏感")
    void testCaseInsensitiveKeywords() {
        SelectStatement select = select("select name from Users where ID = 1");

        AliasedTableExpression table = (AliasedTableExpression) select.getFrom().get(0);
        assertEquals(TableName.of("users"), table.getTableName().orElseThrow());
    }

    // ==================== 通配符 ====================

    @Test
    @DisplayName("整条语句通配符")
    void testStatementWildcards() {
        for (Wildcard kind : new Wildcard[]{Wildcard.SELECT, Wildcard.UNION, Wildcard.INSERT, Wildcard.UPDATE, Wildcard.DELETE}) {
            Statement stmt = parser.parse(kind.getToken());
            assertTrue(wildcards.isWholeStatementWildcard(stmt, kind), kind.getToken());
        }
        assertTrue(wildcards.isWholeStatementWildcard(parser.parse("%%delete%%;"), Wildcard.DELETE));
    }

    @Test
    @DisplayName("%%WHERE%% 解析为WHERE哨兵")
    void testWhereWildcard() {
        SelectStatement select = select("SELECT a FROM t %%WHERE%%");
        assertTrue(wildcards.isWhereWildcard(select.getWhere().orElseThrow()));

        UpdateStatement update = (UpdateStatement) parser.parse("UPDATE t SET a = 1 %%WHERE%%");
        assertTrue(wildcards.isWhereWildcard(update.getWhere().orElseThrow()));
    }

    @Test
    @DisplayName("%%VALUE%% 和 %%LIST_OF_VALUES%% 解析为值哨兵")
    void testValueWildcards() {
        ComparisonExpression value = (ComparisonExpression) where("SELECT a FROM t WHERE id = %%VALUE%%");
        assertTrue(wildcards.isValueWildcard(value.getRight()));

        ComparisonExpression in = (ComparisonExpression) where("SELECT a FROM t WHERE id IN (1, %%LIST_OF_VALUES%%)");
        ValueTupleExpression tuple = (ValueTupleExpression) in.getRight();
        assertTrue(wildcards.isListOfValuesWildcard(tuple.getValues().get(1)));
    }

    @Test
    @DisplayName("%%COLUMN%% 解析为保留标识符")
    void testColumnWildcard() {
        SelectStatement select = select("SELECT %%COLUMN%%, t.%%column%% FROM t");

        ColumnExpression bare = (ColumnExpression) ((AliasedSelectItem) select.getSelectItems().get(0)).getExpression();
        assertTrue(wildcards.isColumnWildcard(bare.getName()));

        ColumnExpression qualified = (ColumnExpression) ((AliasedSelectItem) select.getSelectItems().get(1)).getExpression();
        assertTrue(wildcards.isColumnWildcard(qualified.getName()));
        assertEquals(TableName.of("t"), qualified.getQualifier().orElseThrow());
    }

    @Test
    @DisplayName("%%SUBQUERY%% 裸写和括号写法结构相同")
    void testSubqueryWildcard() {
        ComparisonExpression bare = (ComparisonExpression) where("SELECT a FROM t WHERE id IN %%SUBQUERY%%");
        ComparisonExpression paren = (ComparisonExpression) where("SELECT a FROM t WHERE id IN (%%SUBQUERY%%)");

        assertTrue(wildcards.isSubqueryWildcard((SubqueryExpression) bare.getRight()));
        assertTrue(wildcards.isSubqueryWildcard((SubqueryExpression) paren.getRight()));

        SelectStatement derived = select("SELECT * FROM (%%SUBQUERY%%) AS x");
        AliasedTableExpression table = (AliasedTableExpression) derived.getFrom().get(0);
        assertTrue(wildcards.isSubqueryWildcard(table.getSubquery().orElseThrow()));
    }

    @Test
    @DisplayName("真实输入中的同名字符串和标识符不是通配符")
    void testQuotedWildcardTokensAreNotWildcards() {
        ComparisonExpression literal = (ComparisonExpression) where("SELECT a FROM t WHERE id = '%%VALUE%%'");
        assertFalse(wildcards.isValueWildcard(literal.getRight()));

        SelectStatement select = select("SELECT `%%COLUMN%%` FROM t");
        ColumnExpression column = (ColumnExpression) ((AliasedSelectItem) select.getSelectItems().get(0)).getExpression();
        assertFalse(wildcards.isColumnWildcard(column.getName()));
    }

    // ==================== 错误处理 ====================

    @Test
    @DisplayName("语法错误抛出ParseException")
    void testSyntaxError() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("SELEC name FROM users"));
        assertTrue(e.getMessage().contains("Syntax error"));
        assertFalse(e.getSyntaxErrors().isEmpty());
        assertTrue(e.getSyntaxErrors().get(0).startsWith("Syntax error at line 1:"));

        assertThrows(ParseException.class, () -> parser.parse("SELECT FROM"));
    }

    @Test
    @DisplayName("括号嵌套超过上限抛出ParseException")
    void testNestingDepthLimit() {
        SQLParser shallow = new SQLParser(wildcards, 3);

        assertNotNull(shallow.parse("SELECT a FROM t WHERE id = (((1)))"));
        ParseException e = assertThrows(ParseException.class,
                () -> shallow.parse("SELECT a FROM t WHERE id = ((((1))))"));
        assertTrue(e.getMessage().contains("Nesting depth exceeds 3"));

        // 字符串中的括号不计入
        assertNotNull(shallow.parse("SELECT a FROM t WHERE name = '(((((('"));

        assertThrows(ParseException.class,
                () -> parser.parse("SELECT a FROM t WHERE id = " + "(".repeat(20000) + "1" + ")".repeat(20000)));
        assertThrows(IllegalArgumentException.class, () -> new SQLParser(wildcards, 0));
    }

    @Test
    @DisplayName("不带括号的深层嵌套抛出ParseException")
    void testDeepNotChain() {
        assertThrows(ParseException.class,
                () -> parser.parse("SELECT a FROM t WHERE " + "NOT ".repeat(100000) + "a"));
    }

    @Test
    @DisplayName("空输入抛出ParseException")
    void testEmptyInput() {
        assertThrows(ParseException.class, () -> parser.parse(null));
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("   "));
        assertTrue(e.getSyntaxErrors().isEmpty());
    }
}
