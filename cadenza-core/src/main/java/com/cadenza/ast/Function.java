package com.cadenza.ast;

import java.util.List;

public record Function(String name, int parameterCount, boolean builtin) implements Symbol {

    @Override
    public String nodeType() {
        return "Function";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("name", name),
            NodeField.of("parameterCount", parameterCount),
            NodeField.of("builtin", builtin));
    }
}
