package com.cadenza.ast;

import java.util.List;

public record VariableDeclaration(
    Type type,
    Variable variable,
    Expression initializer
) implements Statement {

    @Override
    public String nodeType() {
        return "VariableDeclaration";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("type", type),
            NodeField.of("variable", variable),
            NodeField.of("initializer", initializer));
    }
}
