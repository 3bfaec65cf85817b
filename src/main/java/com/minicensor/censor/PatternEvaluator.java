package com.minicensor.censor;

import com.minicensor.parser.ParseException;
import com.minicensor.parser.SQLParser;
import com.minicensor.parser.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * PatternEvaluator - 模式集合求值
 *
 * 对一条查询按顺序尝试模式集合中的每一条模式,任意一条匹配即为命中。
 * 空集合永远不命中。
 *
 * 使用示例:
 * <pre>
 * PatternEvaluator evaluator = new PatternEvaluator(WildcardRegistry.standard());
 * List&lt;Statement&gt; patterns = PatternSet.compile(texts, parser).getPatterns();
 *
 * boolean hit = evaluator.matches(parser.parse(sql), patterns);
 * Optional&lt;Statement&gt; first = evaluator.firstMatch(parser.parse(sql), patterns);
 * </pre>
 */
public class PatternEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(PatternEvaluator.class);

    private final StructuralMatcher matcher;

    private final SQLParser parser;

    public PatternEvaluator(WildcardRegistry wildcards) {
        this(new StructuralMatcher(wildcards));
    }

    public PatternEvaluator(StructuralMatcher matcher) {
        if (matcher == null) {
            throw new IllegalArgumentException("Matcher cannot be null");
        }
        this.matcher = matcher;
        this.parser = new SQLParser(matcher.getWildcards());
    }

    public StructuralMatcher getMatcher() {
        return matcher;
    }

    /**
     * 查询是否命中模式集合中的任意一条
     *
     * @param query 已解析的查询
     * @param patterns 已解析的模式,按顺序尝试
     * @return 至少一条模式匹配时返回true
     */
    public boolean matches(Statement query, List<Statement> patterns) {
        return firstMatch(query, patterns).isPresent();
    }

    /**
     * 返回第一条匹配的模式
     *
     * @param query 已解析的查询
     * @param patterns 已解析的模式
     * @return 第一条匹配的模式,没有命中返回Optional.empty()
     */
    public Optional<Statement> firstMatch(Statement query, List<Statement> patterns) {
        int index = indexOfFirstMatch(query, patterns);
        return index >= 0 ? Optional.of(patterns.get(index)) : Optional.empty();
    }

    /**
     * 返回第一条匹配的模式在列表中的下标
     *
     * 同一个通配符(如 %%SELECT%%)在不同模式中解析为同一个哨兵对象,
     * 需要定位模式文本时用下标,不要按对象查找。
     *
     * @return 下标,没有命中返回-1
     */
    public int indexOfFirstMatch(Statement query, List<Statement> patterns) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        if (patterns == null) {
            throw new IllegalArgumentException("Patterns cannot be null");
        }

        for (int i = 0; i < patterns.size(); i++) {
            if (matcher.matches(query, patterns.get(i))) {
                logger.debug("查询命中第 {} 条模式: {}", i, patterns.get(i));
                return i;
            }
        }

        logger.debug("查询未命中任何模式，共 {} 条", patterns.size());
        return -1;
    }

    /**
     * 先解析查询文本再求值
     *
     * @param query 查询文本
     * @param patterns 已解析的模式
     * @return 至少一条模式匹配时返回true
     * @throws QuerySyntaxException 如果查询无法解析
     */
    public boolean matches(String query, List<Statement> patterns) {
        return matches(parseQuery(query), patterns);
    }

    /**
     * 解析查询文本,失败时转换为QuerySyntaxException
     */
    Statement parseQuery(String query) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        try {
            return parser.parse(query);
        } catch (ParseException e) {
            throw new QuerySyntaxException(e.getMessage(), e);
        }
    }
}
