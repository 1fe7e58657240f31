package com.cadenza.ast;

import com.cadenza.inspect.GraphPrinter;

import java.util.List;

public record Program(List<Statement> statements) implements Node {

    @Override
    public String nodeType() {
        return "Program";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(NodeField.of("statements", statements));
    }

    /**
     * Renders the whole reachable graph, so a program can be logged directly.
     */
    @Override
    public String toString() {
        return GraphPrinter.print(this);
    }
}
