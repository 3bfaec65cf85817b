package com.minicensor.parser.expressions;

import com.minicensor.parser.Expression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ValueTupleExpression - 值元组 (1, 2, 3)
 *
 * 出现在 IN 列表、INSERT VALUES 行和行构造比较 (a, b) = (1, 2) 中。
 */
public class ValueTupleExpression implements Expression {

    private final List<Expression> values;

    public ValueTupleExpression(List<Expression> values) {
        this.values = List.copyOf(values);
    }

    public List<Expression> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.TUPLE;
    }

    @Override
    public String toString() {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
