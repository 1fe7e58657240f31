package com.cadenza.ast;

import java.util.List;

public record WhileStatement(Expression test, List<Statement> body) implements Statement {

    @Override
    public String nodeType() {
        return "WhileStatement";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("test", test),
            NodeField.of("body", body));
    }
}
