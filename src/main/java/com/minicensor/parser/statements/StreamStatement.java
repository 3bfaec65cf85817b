package com.minicensor.parser.statements;

import com.minicensor.parser.Statement;
import com.minicensor.parser.clauses.SelectItem;
import com.minicensor.parser.clauses.TableName;

import java.util.List;
import java.util.Objects;

/**
 * StreamStatement - STREAM expr FROM table
 */
public class StreamStatement implements Statement {

    private final List<String> comments;

    private final SelectItem selectItem;

    private final TableName table;

    public StreamStatement(List<String> comments, SelectItem selectItem, TableName table) {
        this.comments = comments != null ? List.copyOf(comments) : List.of();
        this.selectItem = Objects.requireNonNull(selectItem, "selectItem");
        this.table = Objects.requireNonNull(table, "table");
    }

    public List<String> getComments() {
        return comments;
    }

    public SelectItem getSelectItem() {
        return selectItem;
    }

    public TableName getTable() {
        return table;
    }

    @Override
    public StatementType getType() {
        return StatementType.STREAM;
    }

    @Override
    public String toString() {
        return "STREAM " + selectItem + " FROM " + table;
    }
}
