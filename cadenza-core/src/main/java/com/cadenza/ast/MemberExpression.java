package com.cadenza.ast;

import java.util.List;

// Example: state.population
public record MemberExpression(Expression object, Token field) implements Expression {

    @Override
    public String nodeType() {
        return "MemberExpression";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("object", object),
            NodeField.of("field", field));
    }
}
