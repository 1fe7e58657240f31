package com.cadenza.ast;

import java.util.List;

public record FuncParam(Type type, Token id) implements Node {

    @Override
    public String nodeType() {
        return "FuncParam";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("type", type),
            NodeField.of("id", id));
    }
}
