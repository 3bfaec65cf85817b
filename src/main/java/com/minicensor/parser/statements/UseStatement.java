package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.Identifier;

import java.util.Objects;

/**
 * UseStatement - USE db
 */
public class UseStatement implements Statement {

    private final Identifier database;

    public UseStatement(Identifier database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    public Identifier getDatabase() {
        return database;
    }

    @Override
    public StatementType getType() {
        return StatementType.USE;
    }

    @Override
    public String toString() {
        return "USE " + database;
    }
}
