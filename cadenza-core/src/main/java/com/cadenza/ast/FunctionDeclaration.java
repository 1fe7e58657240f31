package com.cadenza.ast;

import java.util.List;

public record FunctionDeclaration(
    Type type,  // return type
    Token id,
    List<FuncParam> params,
    List<Statement> block
) implements Statement {

    @Override
    public String nodeType() {
        return "FunctionDeclaration";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("type", type),
            NodeField.of("id", id),
            NodeField.of("params", params),
            NodeField.of("block", block));
    }
}
