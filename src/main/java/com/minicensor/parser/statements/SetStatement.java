package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.Assignment;

import java.util.List;
import java.util.Optional;

/**
 * SetStatement - SET [GLOBAL | SESSION] var = expr, ...
 */
public class SetStatement implements Statement {

    private final List<String> comments;

    /** GLOBAL / SESSION(没有时为null) */
    private final String scope;

    private final List<Assignment> assignments;

    public SetStatement(List<String> comments, String scope, List<Assignment> assignments) {
        this.comments = comments != null ? List.copyOf(comments) : List.of();
        this.scope = scope;
        this.assignments = List.copyOf(assignments);
    }

    public List<String> getComments() {
        return comments;
    }

    public Optional<String> getScope() {
        return Optional.ofNullable(scope);
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    @Override
    public StatementType getType() {
        return StatementType.SET;
    }

    @Override
    public String toString() {
        return "SetStatement{" + assignments + '}';
    }
}
