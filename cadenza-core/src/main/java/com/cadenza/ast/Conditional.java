package com.cadenza.ast;

import java.util.List;

public record Conditional(
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {

    @Override
    public String nodeType() {
        return "Conditional";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("test", test),
            NodeField.of("consequent", consequent),
            NodeField.of("alternate", alternate));
    }
}
