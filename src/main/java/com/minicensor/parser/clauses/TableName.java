package com.minicensor.parser.clauses;

import java.util.Objects;
import java.util.Optional;

/**
 * TableName - 表名,可带库名前缀
 *
 * 语法示例:
 * <pre>
 * users
 * shop.orders
 * </pre>
 */
public final class TableName {

    /** 库名(没有前缀时为null) */
    private final Identifier qualifier;

    /** 表名 */
    private final Identifier name;

    public TableName(Identifier qualifier, Identifier name) {
        this.qualifier = qualifier;
        this.name = Objects.requireNonNull(name, "name");
    }

    public static TableName of(String name) {
        return new TableName(null, Identifier.of(name));
    }

    public Optional<Identifier> getQualifier() {
        return Optional.ofNullable(qualifier);
    }

    public Identifier getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableName)) {
            return false;
        }
        TableName that = (TableName) o;
        return Objects.equals(qualifier, that.qualifier) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier, name);
    }

    @Override
    public String toString() {
        return qualifier != null ? qualifier + "." + name : name.toString();
    }
}
