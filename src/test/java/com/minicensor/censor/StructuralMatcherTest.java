package com.minicensor.censor;

import com.minicensor.parser.SQLParser;
import com.minicensor.parser.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StructuralMatcherTest - 语句级结构匹配测试
 *
 * 每个测试用例覆盖一种语句或一个通配符的匹配规则。
 */
@DisplayName("结构匹配测试")
class StructuralMatcherTest {

    private final SQLParser parser = new SQLParser();

    private final StructuralMatcher matcher = new StructuralMatcher(WildcardRegistry.standard());

    private boolean matches(String query, String pattern) {
        return matcher.matches(parser.parse(query), parser.parse(pattern));
    }

    // ==================== 整条语句通配符 ====================

    @Test
    @DisplayName("整条语句通配符匹配同类语句")
    void testWholeStatementWildcards() {
        assertTrue(matches("SELECT a FROM t WHERE id = 1", "%%SELECT%%"));
        assertTrue(matches("SELECT a FROM t UNION SELECT b FROM u", "%%UNION%%"));
        assertTrue(matches("INSERT INTO t VALUES (1)", "%%INSERT%%"));
        assertTrue(matches("UPDATE t SET a = 1", "%%UPDATE%%"));
        assertTrue(matches("DELETE FROM t", "%%DELETE%%"));
    }

    @Test
    @DisplayName("整条语句通配符不跨种类")
    void testWholeStatementWildcardKindMismatch() {
        assertFalse(matches("SELECT a FROM t", "%%DELETE%%"));
        assertFalse(matches("SELECT a FROM t UNION SELECT b FROM u", "%%SELECT%%"));
        assertFalse(matches("DELETE FROM t", "%%UPDATE%%"));
        assertFalse(matches("SHOW TABLES", "%%SELECT%%"));
    }

    @Test
    @DisplayName("语句种类不同永远不匹配")
    void testVariantMismatch() {
        assertFalse(matches("SELECT a FROM t", "UPDATE t SET a = 1"));
        assertFalse(matches("DELETE FROM t", "SELECT * FROM t"));
        assertFalse(matches("(SELECT a FROM t)", "SELECT a FROM t"));
        assertFalse(matches("COMMIT", "ROLLBACK"));
    }

    // ==================== SELECT ====================

    @Test
    @DisplayName("SELECT * 匹配任意投影列表")
    void testStarProjection() {
        assertTrue(matches("SELECT a, b, c FROM t", "SELECT * FROM t"));
        assertTrue(matches("SELECT * FROM t", "SELECT * FROM t"));
        assertFalse(matches("SELECT a FROM u", "SELECT * FROM t"));
        assertFalse(matches("SELECT a FROM t", "SELECT t.* FROM t"));
        assertTrue(matches("SELECT t.* FROM t", "SELECT T.* FROM t"));
    }

    @Test
    @DisplayName("%%COLUMN%% 投影项也覆盖查询中的 *")
    void testColumnWildcardCoversStar() {
        assertTrue(matches("SELECT * FROM t", "SELECT %%COLUMN%% FROM t"));
        assertFalse(matches("SELECT a, b FROM t", "SELECT %%COLUMN%% FROM t"));
        assertTrue(matches("SELECT a, b FROM t", "SELECT %%COLUMN%%, %%COLUMN%% FROM t"));
    }

    @Test
    @DisplayName("列通配符大小写不敏感")
    void testColumnWildcardCaseInsensitivity() {
        String pattern = "SELECT %%COLUMN%% FROM t";
        assertEquals(matches("SELECT NAME FROM t", pattern), matches("SELECT name FROM t", pattern));
        assertTrue(matches("SELECT NAME FROM t", pattern));
        assertTrue(matches("SELECT name FROM t", "select %%column%% from T"));
    }

    @Test
    @DisplayName("别名必须相同")
    void testAliases() {
        assertTrue(matches("SELECT a AS x FROM t", "SELECT %%COLUMN%% AS X FROM t"));
        assertFalse(matches("SELECT a AS y FROM t", "SELECT %%COLUMN%% AS x FROM t"));
        assertFalse(matches("SELECT a FROM t", "SELECT %%COLUMN%% AS x FROM t"));
        assertFalse(matches("SELECT a FROM t AS x", "SELECT a FROM t"));
    }

    @Test
    @DisplayName("%%WHERE%% 匹配任意条件和没有WHERE")
    void testWhereWildcard() {
        String pattern = "SELECT a FROM t %%WHERE%%";
        assertTrue(matches("SELECT a FROM t WHERE id = 1 AND name = 'x'", pattern));
        assertTrue(matches("SELECT a FROM t", pattern));
        assertFalse(matches("SELECT a FROM u WHERE id = 1", pattern));
    }

    @Test
    @DisplayName("%%WHERE%% 之后的子句仍然比较")
    void testClausesAfterWhereWildcard() {
        String pattern = "SELECT a FROM t %%WHERE%% ORDER BY a LIMIT 10";
        assertTrue(matches("SELECT a FROM t WHERE id > 1 ORDER BY a LIMIT 10", pattern));
        assertFalse(matches("SELECT a FROM t WHERE id > 1 ORDER BY a DESC LIMIT 10", pattern));
        assertFalse(matches("SELECT a FROM t WHERE id > 1 ORDER BY a", pattern));
    }

    @Test
    @DisplayName("没有WHERE的模式不匹配带WHERE的查询")
    void testMissingWhere() {
        assertFalse(matches("SELECT a FROM t WHERE id = 1", "SELECT a FROM t"));
        assertFalse(matches("SELECT a FROM t", "SELECT a FROM t WHERE id = %%VALUE%%"));
    }

    @Test
    @DisplayName("HAVING 使用 %%WHERE%%")
    void testHavingWildcard() {
        String pattern = "SELECT a, COUNT(*) FROM t GROUP BY a HAVING %%WHERE%%";
        assertTrue(matches("SELECT a, COUNT(*) FROM t GROUP BY a HAVING COUNT(*) > 5", pattern));
        assertTrue(matches("SELECT a, COUNT(*) FROM t GROUP BY a", pattern));
        assertFalse(matches("SELECT a, COUNT(*) FROM t GROUP BY b", pattern));
    }

    @Test
    @DisplayName("DISTINCT / SQL_CACHE / 锁模式 / LIMIT")
    void testSelectOptions() {
        assertFalse(matches("SELECT DISTINCT a FROM t", "SELECT a FROM t"));
        assertTrue(matches("SELECT SQL_NO_CACHE a FROM t", "select sql_no_cache a FROM t"));
        assertFalse(matches("SELECT SQL_CACHE a FROM t", "SELECT a FROM t"));
        assertFalse(matches("SELECT a FROM t FOR UPDATE", "SELECT a FROM t"));
        assertFalse(matches("SELECT a FROM t LOCK IN SHARE MODE", "SELECT a FROM t FOR UPDATE"));
        assertTrue(matches("SELECT a FROM t LIMIT 5, 10", "SELECT a FROM t LIMIT %%VALUE%% OFFSET %%VALUE%%"));
        assertFalse(matches("SELECT a FROM t LIMIT 10", "SELECT a FROM t LIMIT 5, %%VALUE%%"));
    }

    @Test
    @DisplayName("注释按原文比较")
    void testComments() {
        assertTrue(matches("SELECT /* report */ a FROM t", "SELECT /* report */ a FROM t"));
        assertFalse(matches("SELECT /* other */ a FROM t", "SELECT /* report */ a FROM t"));
        assertFalse(matches("SELECT a FROM t", "SELECT /* report */ a FROM t"));
    }

    // ==================== 表引用 ====================

    @Test
    @DisplayName("表名大小写不敏感,库名必须相同")
    void testTableNames() {
        assertTrue(matches("SELECT a FROM Users", "SELECT a FROM users"));
        assertTrue(matches("SELECT a FROM shop.users", "SELECT a FROM SHOP.users"));
        assertFalse(matches("SELECT a FROM users", "SELECT a FROM shop.users"));
    }

    @Test
    @DisplayName("JOIN 类型和条件")
    void testJoins() {
        String pattern = "SELECT * FROM a JOIN b ON a.id = b.aid WHERE a.x = %%VALUE%%";
        assertTrue(matches("SELECT * FROM a INNER JOIN b ON a.id = b.aid WHERE a.x = 3", pattern));
        assertFalse(matches("SELECT * FROM a LEFT JOIN b ON a.id = b.aid WHERE a.x = 3", pattern));
        assertFalse(matches("SELECT * FROM a JOIN b ON a.id = b.bid WHERE a.x = 3", pattern));
        assertTrue(matches("SELECT * FROM a JOIN b USING (id)", "SELECT * FROM a JOIN b USING (%%COLUMN%%)"));
    }

    @Test
    @DisplayName("派生表子查询")
    void testDerivedTables() {
        assertTrue(matches("SELECT x.a FROM (SELECT a FROM t) AS x", "SELECT x.a FROM (%%SUBQUERY%%) AS x"));
        assertTrue(matches("SELECT x.a FROM (SELECT a FROM t) AS x", "SELECT x.a FROM %%SUBQUERY%% AS x"));
        assertFalse(matches("SELECT x.a FROM t AS x", "SELECT x.a FROM (%%SUBQUERY%%) AS x"));
        assertFalse(matches("SELECT x.a FROM (SELECT a FROM t) AS y", "SELECT x.a FROM (%%SUBQUERY%%) AS x"));
    }

    @Test
    @DisplayName("索引提示")
    void testIndexHints() {
        assertTrue(matches("SELECT a FROM t USE INDEX (idx_a)", "SELECT a FROM t USE INDEX (IDX_A)"));
        assertFalse(matches("SELECT a FROM t FORCE INDEX (idx_a)", "SELECT a FROM t USE INDEX (idx_a)"));
        assertFalse(matches("SELECT a FROM t", "SELECT a FROM t USE INDEX (idx_a)"));
    }

    // ==================== UNION ====================

    @Test
    @DisplayName("UNION 两侧分别匹配")
    void testUnion() {
        String pattern = "SELECT %%COLUMN%% FROM a UNION ALL SELECT %%COLUMN%% FROM b";
        assertTrue(matches("SELECT x FROM a UNION ALL SELECT y FROM b", pattern));
        assertFalse(matches("SELECT x FROM a UNION SELECT y FROM b", pattern));
        assertFalse(matches("SELECT x FROM a UNION ALL SELECT y FROM c", pattern));
        assertTrue(matches("(SELECT x FROM a) UNION (SELECT y FROM b)", "(SELECT x FROM a) UNION (SELECT * FROM b)"));
    }

    @Test
    @DisplayName("函数参数中的 * 不是投影通配符")
    void testStarInsideFunctionIsLiteral() {
        String pattern = "SELECT COUNT(*) FROM users";
        assertTrue(matches("SELECT COUNT(*) FROM users", pattern));
        assertFalse(matches("SELECT COUNT(password) FROM users", pattern));
        assertFalse(matches("SELECT GROUP_CONCAT(password) FROM users", "SELECT GROUP_CONCAT(*) FROM users"));
        assertTrue(matches("SELECT COUNT(password) FROM users", "SELECT * FROM users"));
    }

    @Test
    @DisplayName("UNION 一侧为子查询或SELECT通配符")
    void testUnionWildcardOperands() {
        String pattern = "SELECT id FROM users UNION (%%SUBQUERY%%)";
        assertTrue(matches("SELECT id FROM users UNION SELECT id FROM admins", pattern));
        assertTrue(matches("SELECT id FROM users UNION (SELECT uid FROM logs WHERE day = 1)", pattern));
        assertFalse(matches("SELECT name FROM users UNION SELECT id FROM admins", pattern));
        assertFalse(matches("SELECT id FROM users UNION ALL SELECT id FROM admins", pattern));

        assertTrue(matches("SELECT a FROM t UNION SELECT b FROM u", "%%SELECT%% UNION %%SELECT%%"));
        assertFalse(matches("SELECT a FROM t UNION (SELECT b FROM u)", "%%SELECT%% UNION %%SELECT%%"));
    }

    // ==================== INSERT ====================

    @Test
    @DisplayName("所有字段都匹配的INSERT返回true")
    void testInsertMatchesWhenAllFieldsMatch() {
        assertTrue(matches("INSERT INTO t (a, b) VALUES (1, 'x')", "INSERT INTO t (a, b) VALUES (%%VALUE%%, %%VALUE%%)"));
        assertTrue(matches("INSERT INTO t (a, b) VALUES (1, 'x')", "INSERT INTO t (a, b) VALUES (1, 'x')"));
    }

    @Test
    @DisplayName("INSERT 字段不一致")
    void testInsertMismatches() {
        String pattern = "INSERT INTO t (a, b) VALUES (%%VALUE%%, %%VALUE%%)";
        assertFalse(matches("INSERT INTO u (a, b) VALUES (1, 2)", pattern));
        assertFalse(matches("INSERT INTO t (a, c) VALUES (1, 2)", pattern));
        assertFalse(matches("INSERT INTO t (a, b) VALUES (1, 2), (3, 4)", pattern));
        assertFalse(matches("REPLACE INTO t (a, b) VALUES (1, 2)", pattern));
        assertFalse(matches("INSERT IGNORE INTO t (a, b) VALUES (1, 2)", pattern));
    }

    @Test
    @DisplayName("末尾 %%COLUMN%% 吸收至少一列")
    void testInsertColumnAbsorption() {
        String pattern = "INSERT INTO t (id, %%COLUMN%%) VALUES (%%VALUE%%, %%LIST_OF_VALUES%%)";
        assertTrue(matches("INSERT INTO t (id, a) VALUES (1, 2)", pattern));
        assertTrue(matches("INSERT INTO t (id, a, b, c) VALUES (1, 2, 3, 4)", pattern));
        assertFalse(matches("INSERT INTO t (id) VALUES (1)", pattern));
        assertFalse(matches("INSERT INTO t (uid, a) VALUES (1, 2)", pattern));
    }

    @Test
    @DisplayName("INSERT ... SELECT 和 ON DUPLICATE KEY UPDATE")
    void testInsertSourceAndOnDuplicate() {
        assertTrue(matches("INSERT INTO archive SELECT * FROM logs WHERE day < 5",
                "INSERT INTO archive SELECT * FROM logs %%WHERE%%"));
        assertFalse(matches("INSERT INTO archive VALUES (1)", "INSERT INTO archive SELECT * FROM logs"));

        String pattern = "INSERT INTO t (a) VALUES (%%VALUE%%) ON DUPLICATE KEY UPDATE a = VALUES(a)";
        assertTrue(matches("INSERT INTO t (a) VALUES (1) ON DUPLICATE KEY UPDATE a = VALUES(a)", pattern));
        assertFalse(matches("INSERT INTO t (a) VALUES (1)", pattern));
    }

    // ==================== UPDATE / DELETE ====================

    @Test
    @DisplayName("UPDATE 赋值和条件")
    void testUpdate() {
        String pattern = "UPDATE users SET name = %%VALUE%% WHERE id = %%VALUE%%";
        assertTrue(matches("UPDATE users SET name = 'Bob' WHERE id = 7", pattern));
        assertFalse(matches("UPDATE users SET email = 'Bob' WHERE id = 7", pattern));
        assertFalse(matches("UPDATE users SET name = 'Bob', age = 3 WHERE id = 7", pattern));
        assertFalse(matches("UPDATE users SET name = 'Bob'", pattern));
        assertTrue(matches("UPDATE users SET name = 'Bob'", "UPDATE users SET %%COLUMN%% = %%VALUE%% %%WHERE%%"));
    }

    @Test
    @DisplayName("DELETE 表、条件、排序和LIMIT")
    void testDelete() {
        String pattern = "DELETE FROM logs WHERE created < %%VALUE%% ORDER BY created LIMIT %%VALUE%%";
        assertTrue(matches("DELETE FROM logs WHERE created < '2024-01-01' ORDER BY created LIMIT 100", pattern));
        assertFalse(matches("DELETE FROM logs WHERE created < '2024-01-01'", pattern));
        assertFalse(matches("DELETE FROM audit WHERE created < '2024-01-01' ORDER BY created LIMIT 100", pattern));
        assertTrue(matches("DELETE a FROM a JOIN b ON a.id = b.id", "DELETE a FROM a JOIN b ON a.id = b.id"));
        assertFalse(matches("DELETE b FROM a JOIN b ON a.id = b.id", "DELETE a FROM a JOIN b ON a.id = b.id"));
    }

    // ==================== 其他语句 ====================

    @Test
    @DisplayName("SET / SHOW / USE 逐字段比较")
    void testSessionStatements() {
        assertTrue(matches("SET autocommit = 1", "SET autocommit = %%VALUE%%"));
        assertFalse(matches("SET GLOBAL autocommit = 1", "SET autocommit = %%VALUE%%"));
        assertFalse(matches("SET sql_mode = 'x'", "SET autocommit = %%VALUE%%"));

        assertTrue(matches("SHOW tables", "SHOW TABLES"));
        assertFalse(matches("SHOW DATABASES", "SHOW TABLES"));
        assertFalse(matches("SHOW TABLES LIKE 'a%'", "SHOW TABLES LIKE 'b%'"));

        assertTrue(matches("USE Shop", "USE shop"));
        assertFalse(matches("USE billing", "USE shop"));
    }

    @Test
    @DisplayName("DDL 按动作和表名比较")
    void testDDL() {
        assertTrue(matches("DROP TABLE users", "DROP TABLE USERS"));
        assertFalse(matches("DROP TABLE IF EXISTS users", "DROP TABLE users"));
        assertFalse(matches("TRUNCATE TABLE users", "DROP TABLE users"));
        assertTrue(matches("ALTER TABLE users ADD COLUMN age INT", "ALTER TABLE users DROP COLUMN name"));
        assertTrue(matches("RENAME TABLE a TO b", "RENAME TABLE a TO b"));
        assertFalse(matches("RENAME TABLE a TO c", "RENAME TABLE a TO b"));
        assertTrue(matches("CREATE DATABASE shop", "CREATE DATABASE shop"));
        assertFalse(matches("DROP DATABASE shop", "CREATE DATABASE shop"));
    }

    @Test
    @DisplayName("没有字段的语句匹配同类语句")
    void testFieldlessStatements() {
        assertTrue(matches("BEGIN", "START TRANSACTION"));
        assertTrue(matches("COMMIT", "COMMIT"));
        assertTrue(matches("ROLLBACK", "ROLLBACK"));
        assertTrue(matches("EXPLAIN SELECT * FROM t", "DESCRIBE users"));
        assertTrue(matches("REPAIR TABLE t", "ANALYZE TABLE u"));
    }

    // ==================== 通用性质 ====================

    @Test
    @DisplayName("同一输入多次匹配结果相同")
    void testDeterminism() {
        Statement query = parser.parse("SELECT name FROM users WHERE id = 42");
        Statement pattern = parser.parse("SELECT %%COLUMN%% FROM users WHERE id = %%VALUE%%");

        boolean first = matcher.matches(query, pattern);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, matcher.matches(query, pattern));
        }
        assertTrue(first);
    }

    @Test
    @DisplayName("参数为null抛出IllegalArgumentException")
    void testNullArguments() {
        Statement stmt = parser.parse("COMMIT");
        assertThrows(IllegalArgumentException.class, () -> matcher.matches(null, stmt));
        assertThrows(IllegalArgumentException.class, () -> matcher.matches(stmt, null));
        assertThrows(IllegalArgumentException.class, () -> new StructuralMatcher(null));
    }
}
