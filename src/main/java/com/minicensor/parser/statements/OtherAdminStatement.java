package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;

/**
 * OtherAdminStatement - REPAIR / OPTIMIZE / ANALYZE
 */
public class OtherAdminStatement implements Statement {

    @Override
    public StatementType getType() {
        return StatementType.OTHER_ADMIN;
    }

    @Override
    public String toString() {
        return "OtherAdminStatement";
    }
}
