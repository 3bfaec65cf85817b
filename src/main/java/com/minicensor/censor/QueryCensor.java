package com.minicensor.censor;

import com.minicensor.parser.SQLParser;
import com.minicensor.parser.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * QueryCensor - 基于模式的查询防火墙
 *
 * 把模式集合的命中结果映射为放行或拒绝:
 * - 白名单: 命中任一模式 → 放行,否则拒绝(QUERY_NOT_IN_WHITELIST)
 * - 黑名单: 命中任一模式 → 拒绝(QUERY_IN_BLACKLIST),否则放行
 * - 无法解析的查询在两种策略下都被拒绝(QUERY_SYNTAX_ERROR)
 *
 * 设计原则:
 * - 写时复制: 当前模式集合保存在AtomicReference中,reload整体替换
 * - 快照读取: 每次check只读取一次引用,检查过程中不受并发reload影响
 * - 无锁: check和reload可以在任意线程中同时调用
 *
 * 使用示例:
 * <pre>
 * SQLParser parser = new SQLParser();
 * PatternSet blacklist = PatternSet.compile(List.of("%%DELETE%%"), parser);
 * QueryCensor censor = new QueryCensor(PolicyType.BLACKLIST, blacklist);
 *
 * censor.check("DELETE FROM users WHERE id = 1");   // DENY, QUERY_IN_BLACKLIST
 * censor.isAllowed("SELECT * FROM users");          // true
 *
 * censor.reload(PatternSet.compile(List.of("%%DELETE%%", "%%UPDATE%%"), parser));
 * </pre>
 */
public class QueryCensor {

    private static final Logger logger = LoggerFactory.getLogger(QueryCensor.class);

    private final PolicyType policy;

    private final PatternEvaluator evaluator;

    private final AtomicReference<PatternSet> patterns;

    public QueryCensor(PolicyType policy, PatternSet patterns) {
        this(policy, patterns, WildcardRegistry.standard());
    }

    /**
     * @param policy 白名单或黑名单
     * @param patterns 初始模式集合
     * @param wildcards 编译模式时使用的通配符注册表
     */
    public QueryCensor(PolicyType policy, PatternSet patterns, WildcardRegistry wildcards) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy cannot be null");
        }
        if (patterns == null) {
            throw new IllegalArgumentException("Pattern set cannot be null");
        }
        this.policy = policy;
        this.evaluator = new PatternEvaluator(wildcards);
        this.patterns = new AtomicReference<>(patterns);
        logger.info("初始化 QueryCensor，策略: {}，模式数: {}", policy, patterns.size());
    }

    public PolicyType getPolicy() {
        return policy;
    }

    public PatternSet getPatternSet() {
        return patterns.get();
    }

    /**
     * 替换当前模式集合
     *
     * @param newPatterns 新的模式集合
     * @return 被替换的旧集合
     */
    public PatternSet reload(PatternSet newPatterns) {
        if (newPatterns == null) {
            throw new IllegalArgumentException("Pattern set cannot be null");
        }
        PatternSet old = patterns.getAndSet(newPatterns);
        logger.info("重新加载模式集合，策略: {}，模式数: {} -> {}", policy, old.size(), newPatterns.size());
        return old;
    }

    /**
     * 编译模式文本并替换当前集合,编译失败时保留原集合
     *
     * @throws InvalidPatternException 如果某条模式无法解析
     */
    public PatternSet reload(List<String> patternTexts) {
        return reload(PatternSet.compile(patternTexts, new SQLParser(evaluator.getMatcher().getWildcards())));
    }

    /**
     * 检查一条查询
     *
     * 日志只记录语句类型、原因和命中的模式,不记录查询文本,查询中的字面量可能是密码等敏感值。
     *
     * @param query 查询文本
     * @return 放行或拒绝,以及原因和命中的模式
     */
    public CensorDecision check(String query) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }

        Statement parsed;
        try {
            parsed = evaluator.parseQuery(query);
        } catch (QuerySyntaxException e) {
            // 语法错误信息会引用出错的记号,同样不写入日志
            logger.warn("拒绝无法解析的查询，原因: {}，语法错误数: {}",
                    CensorDecision.Reason.QUERY_SYNTAX_ERROR.getMessage(), e.getSyntaxErrors().size());
            return CensorDecision.deny(CensorDecision.Reason.QUERY_SYNTAX_ERROR, null);
        }

        return decide(parsed);
    }

    /**
     * 检查一条已解析的查询
     */
    public CensorDecision check(Statement query) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        return decide(query);
    }

    public boolean isAllowed(String query) {
        return check(query).isAllowed();
    }

    private CensorDecision decide(Statement query) {
        PatternSet snapshot = patterns.get();
        int index = evaluator.indexOfFirstMatch(query, snapshot.getPatterns());
        String matchedText = index >= 0 ? snapshot.textAt(index) : null;

        switch (policy) {
            case WHITELIST:
                if (index >= 0) {
                    logger.debug("白名单放行 {} 查询，命中模式: {}", query.getType(), matchedText);
                    return CensorDecision.allow(matchedText);
                }
                logger.warn("拒绝 {} 查询，原因: {}",
                        query.getType(), CensorDecision.Reason.QUERY_NOT_IN_WHITELIST.getMessage());
                return CensorDecision.deny(CensorDecision.Reason.QUERY_NOT_IN_WHITELIST, null);

            case BLACKLIST:
                if (index >= 0) {
                    logger.warn("拒绝 {} 查询，原因: {}，命中模式: {}",
                            query.getType(), CensorDecision.Reason.QUERY_IN_BLACKLIST.getMessage(), matchedText);
                    return CensorDecision.deny(CensorDecision.Reason.QUERY_IN_BLACKLIST, matchedText);
                }
                return CensorDecision.allow(null);

            default:
                throw new IllegalStateException("Unsupported policy: " + policy);
        }
    }
}
