package com.cadenza.ast;

import java.util.List;

public record UnaryExpression(Token op, Expression operand) implements Expression {

    @Override
    public String nodeType() {
        return "UnaryExpression";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("op", op),
            NodeField.of("operand", operand));
    }
}
