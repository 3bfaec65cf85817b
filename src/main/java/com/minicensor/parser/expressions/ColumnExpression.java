package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.TableName;

import java.util.Objects;
import java.util.Optional;

/**
 * ColumnExpression - 列引用表达式
 *
 * 表示对表中列的引用,支持带表名前缀:
 * - 简单列引用: id, name, age
 * - 带表名前缀: users.id, shop.orders.customer_id
 * - 模式中的列通配符: %%COLUMN%%
 *
 * 设计原则:
 * - 不可变对象
 * - 表名前缀复用TableName,库名.表名.列名 也是同一结构
 */
public class ColumnExpression implements Expression {

    /** 表名前缀(没有时为null) */
    private final TableName qualifier;

    /** 列名 */
    private final Identifier name;

    public ColumnExpression(TableName qualifier, Identifier name) {
        this.qualifier = qualifier;
        this.name = Objects.requireNonNull(name, "name");
    }

    public ColumnExpression(String columnName) {
        this(null, Identifier.of(columnName));
    }

    /**
     * 获取列名(不含表名前缀)
     */
    public Identifier getName() {
        return name;
    }

    /**
     * 获取表名前缀
     */
    public Optional<TableName> getQualifier() {
        return Optional.ofNullable(qualifier);
    }

    /**
     * 获取完整的列名(包含表名前缀)
     *
     * @return 完整列名,如"users.id"
     */
    public String getFullName() {
        return qualifier != null ? qualifier + "." + name : name.toString();
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.COLUMN;
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
