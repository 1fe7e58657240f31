package com.cadenza.ast;

import java.util.List;

public record If(
    Expression condition,
    List<Statement> block,
    List<ElseIf> elseifs,
    Else elseStatement  // Can be null
) implements Statement {

    @Override
    public String nodeType() {
        return "If";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("condition", condition),
            NodeField.of("block", block),
            NodeField.of("elseifs", elseifs),
            NodeField.of("elseStatement", elseStatement));
    }
}
