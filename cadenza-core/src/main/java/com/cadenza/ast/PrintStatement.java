package com.cadenza.ast;

import java.util.List;

public record PrintStatement(Expression argument) implements Statement {

    @Override
    public String nodeType() {
        return "PrintStatement";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(NodeField.of("argument", argument));
    }
}
