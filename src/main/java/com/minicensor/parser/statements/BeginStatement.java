package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;

/**
 * BeginStatement - BEGIN / START TRANSACTION
 */
public class BeginStatement implements Statement {

    @Override
    public StatementType getType() {
        return StatementType.BEGIN;
    }

    @Override
    public String toString() {
        return "BeginStatement";
    }
}
