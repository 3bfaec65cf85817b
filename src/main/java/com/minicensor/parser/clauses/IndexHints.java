package com.minicensor.parser.clauses;

import java.util.List;
import java.util.Objects;

/**
 * IndexHints - USE / IGNORE / FORCE INDEX (...)
 */
public final class IndexHints {

    private final HintType hintType;

    private final List<Identifier> indexes;

    public IndexHints(HintType hintType, List<Identifier> indexes) {
        this.hintType = Objects.requireNonNull(hintType, "hintType");
        this.indexes = indexes != null ? List.copyOf(indexes) : List.of();
    }

    public HintType getHintType() {
        return hintType;
    }

    public List<Identifier> getIndexes() {
        return indexes;
    }

    @Override
    public String toString() {
        return hintType + " INDEX " + indexes;
    }

    /**
     * 索引提示类型
     */
    public enum HintType {
        USE,
        IGNORE,
        FORCE
    }
}
