package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;

/**
 * CommitStatement - COMMIT
 */
public class CommitStatement implements Statement {

    @Override
    public StatementType getType() {
        return StatementType.COMMIT;
    }

    @Override
    public String toString() {
        return "CommitStatement";
    }
}
