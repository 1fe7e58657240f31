package com.cadenza.ast;

/**
 * Types are nodes too: declarations refer to them and the printer tags them like any other node.
 *
 * <p>Type identity is structural. Two types are the same type exactly when their
 * typenames are equal, whatever instances they are.</p>
 */
public sealed interface Type extends Node permits PrimitiveType, ArrayType, FunctionType {

    /**
     * Display name, e.g. {@code pog}, {@code [pog]} or {@code (pog,manyCars)->boolin}.
     */
    String typename();

    default boolean isEquivalentTo(Type other) {
        return other != null && typename().equals(other.typename());
    }
}
