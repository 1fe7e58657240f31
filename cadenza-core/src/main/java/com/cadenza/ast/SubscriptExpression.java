package com.cadenza.ast;

import java.util.List;

// Example: a[20]
public record SubscriptExpression(Expression array, Expression index) implements Expression {

    @Override
    public String nodeType() {
        return "SubscriptExpression";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("array", array),
            NodeField.of("index", index));
    }
}
