package com.cadenza.ast;

import java.util.List;

public record Variable(String name, boolean mutable) implements Symbol {

    public Variable(String name) {
        this(name, true);
    }

    @Override
    public String nodeType() {
        return "Variable";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("name", name),
            NodeField.of("mutable", mutable));
    }
}
