package com.minicensor.parser;

import java.util.Locale;

/**
 * Wildcard - 模式通配符种类
 *
 * 每种通配符对应模式文本中的一个保留记号,例如 %%SELECT%%。
 * 记号大小写不敏感。
 */
public enum Wildcard {

    /** 任意SELECT语句 */
    SELECT("%%SELECT%%"),
    /** 任意UNION语句 */
    UNION("%%UNION%%"),
    /** 任意INSERT语句 */
    INSERT("%%INSERT%%"),
    /** 任意UPDATE语句 */
    UPDATE("%%UPDATE%%"),
    /** 任意DELETE语句 */
    DELETE("%%DELETE%%"),
    /** 任意WHERE子句,包括没有WHERE */
    WHERE("%%WHERE%%"),
    /** 任意单个值(字面量、布尔、NULL、绑定参数) */
    VALUE("%%VALUE%%"),
    /** 值元组末尾任意长度的一串值 */
    LIST_OF_VALUES("%%LIST_OF_VALUES%%"),
    /** 任意列 */
    COLUMN("%%COLUMN%%"),
    /** 任意子查询 */
    SUBQUERY("%%SUBQUERY%%");

    private final String token;

    Wildcard(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * 是否为整条语句通配符
     */
    public boolean isStatementLevel() {
        return this == SELECT || this == UNION || this == INSERT || this == UPDATE || this == DELETE;
    }

    /**
     * 根据记号文本查找通配符
     *
     * @param text 记号文本,如"%%value%%"
     * @return 通配符,如果不是保留记号返回null
     */
    public static Wildcard fromToken(String text) {
        if (text == null) {
            return null;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        for (Wildcard wildcard : values()) {
            if (wildcard.token.equals(upper)) {
                return wildcard;
            }
        }
        return null;
    }

    /**
     * 语句类型对应的整条语句通配符
     *
     * @param type 语句类型
     * @return 通配符,如果该类型没有整条语句通配符返回null
     */
    public static Wildcard forStatement(Statement.StatementType type) {
        switch (type) {
            case SELECT:
                return SELECT;
            case UNION:
                return UNION;
            case INSERT:
                return INSERT;
            case UPDATE:
                return UPDATE;
            case DELETE:
                return DELETE;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return token;
    }
}
