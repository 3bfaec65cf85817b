package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.WhereClause;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * ShowStatement - SHOW 语句
 *
 * 语法示例:
 * <pre>
 * SHOW TABLES;
 * SHOW FULL COLUMNS FROM users IN mydb;
 * SHOW TABLES LIKE 'user%';
 * SHOW STATUS WHERE Variable_name = 'Uptime';
 * </pre>
 *
 * SHOW后的关键字序列统一为小写,以空格连接("full columns")。
 */
public class ShowStatement implements Statement {

    private final String showType;

    /** FROM/IN 后的库名或表名(没有时为null) */
    private final Identifier database;

    /** LIKE模式(没有时为null) */
    private final String likePattern;

    private final WhereClause where;

    public ShowStatement(String showType, Identifier database, String likePattern, WhereClause where) {
        this.showType = Objects.requireNonNull(showType, "showType").toLowerCase(Locale.ROOT);
        this.database = database;
        this.likePattern = likePattern;
        this.where = where;
    }

    public String getShowType() {
        return showType;
    }

    public Optional<Identifier> getDatabase() {
        return Optional.ofNullable(database);
    }

    public Optional<String> getLikePattern() {
        return Optional.ofNullable(likePattern);
    }

    public Optional<WhereClause> getWhere() {
        return Optional.ofNullable(where);
    }

    @Override
    public StatementType getType() {
        return StatementType.SHOW;
    }

    @Override
    public String toString() {
        return "ShowStatement{" + showType + (database != null ? " from " + database : "") + '}';
    }
}
