package com.minicensor.parser;

/**
 * QueryStatement - 可以作为子查询出现的语句
 *
 * SELECT、UNION、(SELECT ...) 以及模式中的查询通配符。
 * 出现在 UNION 两侧、INSERT ... SELECT、子查询和派生表中。
 */
public interface QueryStatement extends Statement {
}
