package com.cadenza.ast;

import java.util.List;

public record ElseIf(Expression condition, List<Statement> block) implements Node {

    @Override
    public String nodeType() {
        return "ElseIf";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("condition", condition),
            NodeField.of("block", block));
    }
}
