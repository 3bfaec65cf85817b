package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;

/**
 * RollbackStatement - ROLLBACK
 */
public class RollbackStatement implements Statement {

    @Override
    public StatementType getType() {
        return StatementType.ROLLBACK;
    }

    @Override
    public String toString() {
        return "RollbackStatement";
    }
}
