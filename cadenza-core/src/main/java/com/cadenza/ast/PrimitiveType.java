package com.cadenza.ast;

import java.util.List;

public enum PrimitiveType implements Type {
    BOOLEAN("boolin"),
    INT("pog"),
    DOUBLE("dublin"),
    STRING("manyCars"),
    VOID("nada");

    private final String typename;

    PrimitiveType(String typename) {
        this.typename = typename;
    }

    @Override
    public String typename() {
        return typename;
    }

    @Override
    public String nodeType() {
        return "PrimitiveType";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(NodeField.of("typename", typename));
    }
}
