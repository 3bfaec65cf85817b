package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.Identifier;

import java.util.Objects;

/**
 * DBDDLStatement - CREATE / DROP DATABASE
 */
public class DBDDLStatement implements Statement {

    private final Action action;

    private final Identifier database;

    private final boolean ifExists;

    public DBDDLStatement(Action action, Identifier database, boolean ifExists) {
        this.action = Objects.requireNonNull(action, "action");
        this.database = Objects.requireNonNull(database, "database");
        this.ifExists = ifExists;
    }

    public Action getAction() {
        return action;
    }

    public Identifier getDatabase() {
        return database;
    }

    public boolean isIfExists() {
        return ifExists;
    }

    @Override
    public StatementType getType() {
        return StatementType.DBDDL;
    }

    @Override
    public String toString() {
        return "DBDDLStatement{" + action + " " + database + '}';
    }

    public enum Action {
        CREATE,
        DROP
    }
}
