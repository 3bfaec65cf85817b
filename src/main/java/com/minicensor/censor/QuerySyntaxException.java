package com.minicensor.censor;

import com.minicensor.parser.ParseException;

/**
 * QuerySyntaxException - 待检查的查询无法解析
 *
 * 与"没有匹配的模式"区分开: 调用方必须自己决定如何处理解析失败的查询。
 */
public class QuerySyntaxException extends ParseException {

    public QuerySyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
