package com.minicensor.parser;

import com.minicensor.censor.WildcardRegistry;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * SQLParser - 查询与模式共用的解析入口
 *
 * 把查询文本和模式文本解析为同一套AST。模式文本中的 %%SELECT%%、%%VALUE%% 等记号
 * 被解析为WildcardRegistry中的哨兵节点,普通SQL永远不会产生这些节点。
 *
 * 设计原则:
 * - 一个方法 parse(String sql),语法错误带行号和列号
 * - 无状态: 每次parse都创建新的词法/语法分析器,同一实例可以被多个线程共享
 * - 哨兵由构造时传入的WildcardRegistry决定,解析器和匹配器必须用同一个
 * - 括号嵌套超过上限的输入在语法分析之前被拒绝,递归下降分析不会耗尽线程栈
 *
 * 使用示例:
 * <pre>
 * SQLParser parser = new SQLParser();
 * Statement pattern = parser.parse("SELECT %%COLUMN%% FROM users WHERE id = %%VALUE%%");
 * Statement query = parser.parse("SELECT name FROM users WHERE id = 42");
 * </pre>
 */
public class SQLParser {

    /** 默认的括号嵌套上限 */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    private final WildcardRegistry wildcards;

    private final int maxNestingDepth;

    public SQLParser() {
        this(WildcardRegistry.standard());
    }

    public SQLParser(WildcardRegistry wildcards) {
        this(wildcards, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param wildcards 哨兵注册表
     * @param maxNestingDepth 允许的最大括号嵌套层数
     */
    public SQLParser(WildcardRegistry wildcards, int maxNestingDepth) {
        if (wildcards == null) {
            throw new IllegalArgumentException("Wildcard registry cannot be null");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Max nesting depth must be positive: " + maxNestingDepth);
        }
        this.wildcards = wildcards;
        this.maxNestingDepth = maxNestingDepth;
    }

    public WildcardRegistry getWildcards() {
        return wildcards;
    }

    /**
     * 解析SQL字符串
     *
     * @param sql SQL语句或模式,末尾的分号可选
     * @return 解析后的Statement对象
     * @throws ParseException 如果文本为空、语法错误或嵌套过深
     */
    public Statement parse(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            throw new ParseException("SQL statement cannot be null or empty");
        }

        SyntaxErrorCollector errors = new SyntaxErrorCollector();
        CommonTokenStream tokens = tokenize(sql, errors);
        checkNestingDepth(tokens);

        try {
            MySQLParser parser = new MySQLParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(errors);
            MySQLParser.SqlStatementContext tree = parser.sqlStatement();

            // 出错时语法树不完整,不交给ASTBuilder
            if (!errors.isEmpty()) {
                throw new ParseException(errors.getErrors());
            }

            return (Statement) new ASTBuilder(tokens, wildcards).visit(tree);
        } catch (ParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ParseException("Failed to parse SQL: " + e.getMessage(), e);
        } catch (StackOverflowError e) {
            // 不带括号的深层嵌套(如连续的NOT)
            throw new ParseException("SQL statement is nested too deeply", e);
        }
    }

    /**
     * 统计括号嵌套层数,字符串和注释中的括号属于各自的记号,不计入
     */
    private void checkNestingDepth(CommonTokenStream tokens) {
        tokens.fill();
        int depth = 0;
        for (Token token : tokens.getTokens()) {
            String text = token.getText();
            if ("(".equals(text)) {
                depth++;
                if (depth > maxNestingDepth) {
                    throw new ParseException(String.format("Nesting depth exceeds %d at line %d:%d",
                            maxNestingDepth, token.getLine(), token.getCharPositionInLine()));
                }
            } else if (")".equals(text)) {
                depth--;
            }
        }
    }

    private static CommonTokenStream tokenize(String sql, SyntaxErrorCollector errors) {
        MySQLLexer lexer = new MySQLLexer(CharStreams.fromString(sql));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        return new CommonTokenStream(lexer);
    }

    /**
     * 收集词法和语法错误,替换ANTLR默认的控制台输出
     */
    private static class SyntaxErrorCollector extends BaseErrorListener {
        private final List<String> errors = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer,
                                Object offendingSymbol,
                                int line,
                                int charPositionInLine,
                                String msg,
                                RecognitionException e) {
            errors.add(String.format("Syntax error at line %d:%d - %s", line, charPositionInLine, msg));
        }

        boolean isEmpty() {
            return errors.isEmpty();
        }

        List<String> getErrors() {
            return errors;
        }
    }
}
