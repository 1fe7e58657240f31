package com.cadenza.ast;

import java.util.List;

public record BinaryExpression(
    Token op,
    Expression left,
    Expression right
) implements Expression {

    @Override
    public String nodeType() {
        return "BinaryExpression";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("op", op),
            NodeField.of("left", left),
            NodeField.of("right", right));
    }
}
