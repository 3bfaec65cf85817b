package com.minicensor.parser.clauses;

import java.util.Optional;

/**
 * StarSelectItem - * 或 t.*
 */
public final class StarSelectItem implements SelectItem {

    /** 表名前缀(不带前缀时为null) */
    private final TableName tableName;

    public StarSelectItem(TableName tableName) {
        this.tableName = tableName;
    }

    public Optional<TableName> getTableName() {
        return Optional.ofNullable(tableName);
    }

    /**
     * 是否为不带表名前缀的 *
     */
    public boolean isUnqualified() {
        return tableName == null;
    }

    @Override
    public SelectItemType getItemType() {
        return SelectItemType.STAR;
    }

    @Override
    public String toString() {
        return tableName != null ? tableName + ".*" : "*";
    }
}
