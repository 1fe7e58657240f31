package com.cadenza.ast;

import com.cadenza.MalformedNodeException;

import java.util.List;

public record ArrayType(Type elementType) implements Type {

    public ArrayType {
        if (elementType == null) {
            throw new MalformedNodeException("ArrayType element must be a Type, got null");
        }
    }

    /**
     * Builds an array type from an untyped value, as a parser working on
     * generic semantic actions would.
     *
     * @throws MalformedNodeException if {@code elementType} is not a {@link Type}
     */
    public static ArrayType of(Object elementType) {
        if (elementType instanceof Type type) {
            return new ArrayType(type);
        }
        throw new MalformedNodeException("ArrayType element must be a Type, got "
            + (elementType == null ? "null" : elementType.getClass().getSimpleName()));
    }

    @Override
    public String typename() {
        return "[" + elementType.typename() + "]";
    }

    @Override
    public String nodeType() {
        return "ArrayType";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("typename", typename()),
            NodeField.of("elementType", elementType));
    }
}
