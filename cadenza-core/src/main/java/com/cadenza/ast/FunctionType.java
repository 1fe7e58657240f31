package com.cadenza.ast;

import com.cadenza.MalformedNodeException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

// Example: (boolin,[manyCars])->dublin
public record FunctionType(List<Type> paramTypes, Type returnType) implements Type {

    public FunctionType {
        if (paramTypes == null || paramTypes.stream().anyMatch(Objects::isNull)) {
            throw new MalformedNodeException("FunctionType parameters must all be Types");
        }
        if (returnType == null) {
            throw new MalformedNodeException("FunctionType return type must be a Type, got null");
        }
        paramTypes = List.copyOf(paramTypes);
    }

    @Override
    public String typename() {
        return paramTypes.stream()
            .map(Type::typename)
            .collect(Collectors.joining(",", "(", ")"))
            + "->" + returnType.typename();
    }

    @Override
    public String nodeType() {
        return "FunctionType";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("typename", typename()),
            NodeField.of("paramTypes", paramTypes),
            NodeField.of("returnType", returnType));
    }
}
