package com.minicensor.censor;

import com.minicensor.parser.ParseException;

/**
 * InvalidPatternException - 模式文本无法解析
 *
 * 在加载模式集合时抛出,消息中包含出错的模式文本。
 */
public class InvalidPatternException extends ParseException {

    /** 出错的模式文本 */
    private final String pattern;

    public InvalidPatternException(String pattern, Throwable cause) {
        super("Invalid pattern '" + pattern + "': " + cause.getMessage(), cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
