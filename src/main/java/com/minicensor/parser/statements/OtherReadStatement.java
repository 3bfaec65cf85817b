package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;

/**
 * OtherReadStatement - DESCRIBE / DESC / EXPLAIN
 *
 * 不保留语句内容,同类语句之间总是相互匹配。
 */
public class OtherReadStatement implements Statement {

    @Override
    public StatementType getType() {
        return StatementType.OTHER_READ;
    }

    @Override
    public String toString() {
        return "OtherReadStatement";
    }
}
