package com.cadenza.ast;

import java.util.List;

public record ReturnStatement(
    Expression value  // Can be null for a bare return
) implements Statement {

    @Override
    public String nodeType() {
        return "ReturnStatement";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(NodeField.of("value", value));
    }
}
