package com.minicensor.parser.clauses;

/**
 * SelectItem - SELECT投影列表中的一项
 *
 * 也用于函数参数列表(COUNT(*))和 MATCH(...) 的列列表。
 */
public interface SelectItem {

    SelectItemType getItemType();

    /**
     * 投影项类型
     */
    enum SelectItemType {
        /** * 或 t.* */
        STAR,
        /** 表达式,可带别名 */
        ALIASED,
        /** NEXT n VALUES */
        NEXTVAL
    }
}
