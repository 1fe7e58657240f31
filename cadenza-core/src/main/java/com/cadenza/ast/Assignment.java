package com.cadenza.ast;

import java.util.List;

public record Assignment(Expression target, Expression source) implements Statement {

    @Override
    public String nodeType() {
        return "Assignment";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("target", target),
            NodeField.of("source", source));
    }
}
