package com.cadenza.ast;

import java.util.List;

public record BreakStatement() implements Statement {

    @Override
    public String nodeType() {
        return "BreakStatement";
    }

    @Override
    public List<NodeField> fields() {
        return List.of();
    }
}
