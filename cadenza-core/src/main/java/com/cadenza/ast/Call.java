package com.cadenza.ast;

import java.util.List;

/**
 * A call is both an expression and, when its value is discarded, a statement.
 */
public record Call(Expression callee, List<Expression> args) implements Statement, Expression {

    @Override
    public String nodeType() {
        return "Call";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("callee", callee),
            NodeField.of("args", args));
    }
}
