package com.minicensor.censor;

import com.minicensor.parser.ParseException;
import com.minicensor.parser.SQLParser;
import com.minicensor.parser.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * PatternSet - 编译好的模式集合
 *
 * 每条模式文本只解析一次,之后查询检查直接使用解析结果。
 * 集合不可变,重新加载时创建新的PatternSet。
 */
public final class PatternSet {

    private static final Logger logger = LoggerFactory.getLogger(PatternSet.class);

    private static final PatternSet EMPTY = new PatternSet(List.of(), List.of());

    private final List<String> texts;

    private final List<Statement> patterns;

    private PatternSet(List<String> texts, List<Statement> patterns) {
        this.texts = List.copyOf(texts);
        this.patterns = List.copyOf(patterns);
    }

    public static PatternSet empty() {
        return EMPTY;
    }

    /**
     * 解析一组模式文本
     *
     * @param patternTexts 模式文本,保持顺序
     * @param parser 使用与匹配器相同注册表的解析器
     * @return 编译好的模式集合
     * @throws InvalidPatternException 如果某条模式无法解析,异常中包含该模式
     */
    public static PatternSet compile(List<String> patternTexts, SQLParser parser) {
        if (patternTexts == null) {
            throw new IllegalArgumentException("Pattern texts cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("Parser cannot be null");
        }

        List<Statement> patterns = new ArrayList<>(patternTexts.size());
        for (String text : patternTexts) {
            try {
                patterns.add(parser.parse(text));
            } catch (ParseException e) {
                throw new InvalidPatternException(text, e);
            }
        }

        logger.info("编译模式集合完成，共 {} 条模式", patterns.size());
        return new PatternSet(patternTexts, patterns);
    }

    public List<Statement> getPatterns() {
        return patterns;
    }

    /**
     * 原始模式文本,与getPatterns()一一对应
     */
    public List<String> getTexts() {
        return texts;
    }

    /**
     * 第index条模式的原始文本
     */
    public String textAt(int index) {
        return texts.get(index);
    }

    public int size() {
        return patterns.size();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    @Override
    public String toString() {
        return "PatternSet{" + patterns.size() + " patterns}";
    }
}
