package com.cadenza.ast;

import java.util.List;

public record ArrayLiteral(List<Expression> values) implements Expression {

    @Override
    public String nodeType() {
        return "ArrayLiteral";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(NodeField.of("values", values));
    }
}
