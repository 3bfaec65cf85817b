package com.minicensor.censor;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.minicensor.parser.SQLParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryCensorTest - 查询防火墙策略测试
 */
@DisplayName("查询防火墙测试")
class QueryCensorTest {

    private final SQLParser parser = new SQLParser();

    private QueryCensor censor(PolicyType policy, String... patterns) {
        return new QueryCensor(policy, PatternSet.compile(List.of(patterns), parser));
    }

    @Test
    @DisplayName("白名单: 命中放行,未命中拒绝")
    void testWhitelist() {
        QueryCensor censor = censor(PolicyType.WHITELIST, "SELECT %%COLUMN%% FROM users WHERE id = %%VALUE%%");

        CensorDecision allowed = censor.check("SELECT name FROM users WHERE id = 42");
        assertTrue(allowed.isAllowed());
        assertFalse(allowed.getReason().isPresent());
        assertEquals("SELECT %%COLUMN%% FROM users WHERE id = %%VALUE%%", allowed.getMatchedPattern().orElseThrow());

        CensorDecision denied = censor.check("SELECT name FROM accounts WHERE id = 42");
        assertEquals(CensorDecision.Verdict.DENY, denied.getVerdict());
        assertEquals(CensorDecision.Reason.QUERY_NOT_IN_WHITELIST, denied.getReason().orElseThrow());
    }

    @Test
    @DisplayName("黑名单: 命中拒绝,未命中放行")
    void testBlacklist() {
        QueryCensor censor = censor(PolicyType.BLACKLIST, "%%DELETE%%", "DROP TABLE users");

        CensorDecision denied = censor.check("DELETE FROM users WHERE id = 1");
        assertFalse(denied.isAllowed());
        assertEquals(CensorDecision.Reason.QUERY_IN_BLACKLIST, denied.getReason().orElseThrow());
        assertEquals("%%DELETE%%", denied.getMatchedPattern().orElseThrow());
        assertEquals("query's structure is forbidden", denied.getReason().get().getMessage());

        assertFalse(censor.isAllowed("drop table USERS"));
        assertTrue(censor.isAllowed("SELECT * FROM users"));
        assertTrue(censor.isAllowed("DROP TABLE orders"));
    }

    @Test
    @DisplayName("无法解析的查询在两种策略下都被拒绝")
    void testSyntaxErrorDenied() {
        QueryCensor whitelist = censor(PolicyType.WHITELIST, "%%SELECT%%");
        QueryCensor blacklist = censor(PolicyType.BLACKLIST, "%%DELETE%%");

        CensorDecision fromWhitelist = whitelist.check("SELECT * FORM t WHERE");
        CensorDecision fromBlacklist = blacklist.check("SELECT * FORM t WHERE");

        assertEquals(CensorDecision.Reason.QUERY_SYNTAX_ERROR, fromWhitelist.getReason().orElseThrow());
        assertEquals(CensorDecision.Reason.QUERY_SYNTAX_ERROR, fromBlacklist.getReason().orElseThrow());
    }

    @Test
    @DisplayName("嵌套过深的查询按语法错误拒绝")
    void testDeeplyNestedQueryDenied() {
        String deep = "SELECT a FROM t WHERE id = " + "(".repeat(20000) + "1" + ")".repeat(20000);
        String deepNot = "SELECT a FROM t WHERE " + "NOT ".repeat(100000) + "a";

        for (PolicyType policy : PolicyType.values()) {
            QueryCensor censor = censor(policy, "%%SELECT%%");

            CensorDecision decision = censor.check(deep);
            assertFalse(decision.isAllowed(), policy.name());
            assertEquals(CensorDecision.Reason.QUERY_SYNTAX_ERROR, decision.getReason().orElseThrow());

            assertEquals(CensorDecision.Reason.QUERY_SYNTAX_ERROR, censor.check(deepNot).getReason().orElseThrow());
        }
    }

    @Test
    @DisplayName("日志不包含查询中的字面量")
    void testLogsOmitQueryLiterals() {
        Logger censorLogger = (Logger) LoggerFactory.getLogger(QueryCensor.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        censorLogger.addAppender(appender);
        try {
            QueryCensor whitelist = censor(PolicyType.WHITELIST, "SELECT id FROM users WHERE password = %%VALUE%%");
            QueryCensor blacklist = censor(PolicyType.BLACKLIST, "UPDATE users SET password = %%VALUE%% %%WHERE%%");

            assertTrue(whitelist.isAllowed("SELECT id FROM users WHERE password = 's3cr3t-token'"));
            assertFalse(whitelist.isAllowed("SELECT name FROM users WHERE password = 's3cr3t-token'"));
            assertFalse(blacklist.isAllowed("UPDATE users SET password = 's3cr3t-token' WHERE id = 1"));
            assertFalse(blacklist.isAllowed("UPDATE users SET password = 's3cr3t-token' WHERE"));

            assertFalse(appender.list.isEmpty());
            for (ILoggingEvent event : appender.list) {
                assertFalse(event.getFormattedMessage().contains("s3cr3t-token"), event.getFormattedMessage());
            }
        } finally {
            censorLogger.detachAppender(appender);
        }
    }

    @Test
    @DisplayName("空白名单拒绝一切,空黑名单放行一切")
    void testEmptyPatternSets() {
        QueryCensor whitelist = new QueryCensor(PolicyType.WHITELIST, PatternSet.empty());
        QueryCensor blacklist = new QueryCensor(PolicyType.BLACKLIST, PatternSet.empty());

        assertFalse(whitelist.isAllowed("SELECT 1"));
        assertTrue(blacklist.isAllowed("SELECT 1"));
    }

    @Test
    @DisplayName("reload 整体替换模式集合")
    void testReload() {
        QueryCensor censor = censor(PolicyType.BLACKLIST, "%%DELETE%%");
        assertTrue(censor.isAllowed("UPDATE t SET a = 1"));

        PatternSet old = censor.reload(List.of("%%DELETE%%", "%%UPDATE%%"));

        assertEquals(1, old.size());
        assertEquals(2, censor.getPatternSet().size());
        assertFalse(censor.isAllowed("UPDATE t SET a = 1"));
    }

    @Test
    @DisplayName("reload 遇到非法模式时保留原集合")
    void testReloadWithInvalidPattern() {
        QueryCensor censor = censor(PolicyType.BLACKLIST, "%%DELETE%%");
        PatternSet before = censor.getPatternSet();

        assertThrows(InvalidPatternException.class, () -> censor.reload(List.of("%%UPDATE%%", "UPDATE SET")));

        assertSame(before, censor.getPatternSet());
        assertFalse(censor.isAllowed("DELETE FROM t"));
    }

    @Test
    @DisplayName("构造参数为null抛出IllegalArgumentException")
    void testNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> new QueryCensor(null, PatternSet.empty()));
        assertThrows(IllegalArgumentException.class, () -> new QueryCensor(PolicyType.WHITELIST, null));

        QueryCensor censor = censor(PolicyType.WHITELIST, "%%SELECT%%");
        assertThrows(IllegalArgumentException.class, () -> censor.check((String) null));
        assertThrows(IllegalArgumentException.class, () -> censor.reload((PatternSet) null));
    }

    @Test
    @DisplayName("并发检查与reload")
    void testConcurrentChecksDuringReload() throws Exception {
        QueryCensor censor = censor(PolicyType.WHITELIST, "SELECT %%COLUMN%% FROM users WHERE id = %%VALUE%%");
        PatternSet withOrders = PatternSet.compile(List.of(
                "SELECT %%COLUMN%% FROM users WHERE id = %%VALUE%%",
                "SELECT %%COLUMN%% FROM orders %%WHERE%%"), parser);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final int n = i;
                tasks.add(() -> {
                    if (n == 100) {
                        censor.reload(withOrders);
                    }
                    // 两个集合都包含users模式,结果不受reload影响
                    return censor.isAllowed("SELECT name FROM users WHERE id = " + n)
                            && !censor.isAllowed("DELETE FROM users WHERE id = " + n);
                });
            }

            for (Future<Boolean> future : pool.invokeAll(tasks)) {
                assertTrue(future.get());
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(2, censor.getPatternSet().size());
        assertTrue(censor.isAllowed("SELECT total FROM orders"));
    }
}
