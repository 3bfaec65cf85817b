package com.minicensor.parser;

import java.util.List;

/**
 * ParseException - 文本无法解析为Statement
 *
 * 语法错误时 {@link #getSyntaxErrors()} 按出现顺序给出每一处错误,
 * 格式为 "Syntax error at line L:C - 原因"。包装另一个ParseException时沿用它的错误列表,
 * 所以上层异常(查询/模式)仍然能拿到原始位置。
 */
public class ParseException extends RuntimeException {

    private final List<String> syntaxErrors;

    public ParseException(String message) {
        super(message);
        this.syntaxErrors = List.of();
    }

    public ParseException(List<String> syntaxErrors) {
        super(String.join("\n", syntaxErrors));
        this.syntaxErrors = List.copyOf(syntaxErrors);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
        this.syntaxErrors = cause instanceof ParseException
                ? ((ParseException) cause).getSyntaxErrors()
                : List.of();
    }

    /**
     * @return 语法错误列表,非语法原因(空输入、未知运算符等)时为空
     */
    public List<String> getSyntaxErrors() {
        return syntaxErrors;
    }
}
