package com.cadenza.ast;

/**
 * A named field of a node. The value is a node, a token, a list of nodes,
 * a primitive, or null.
 */
public record NodeField(String name, Object value) {

    public static NodeField of(String name, Object value) {
        return new NodeField(name, value);
    }
}
