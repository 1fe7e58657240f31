package com.cadenza.ast;

import java.util.List;

public record Else(List<Statement> block) implements Node {

    @Override
    public String nodeType() {
        return "Else";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(NodeField.of("block", block));
    }
}
