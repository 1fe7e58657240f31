package com.cadenza.ast;

import java.util.List;

/**
 * Base interface for all AST nodes.
 *
 * <p>Each variant lists its own fields, in construction order, through {@link #fields()}.
 * Printers and exporters walk that list instead of reflecting over the class.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    ElseIf,
    Else,
    FuncParam,
    Type,
    Symbol {

    /**
     * Variant name used when rendering, e.g. {@code "VariableDeclaration"}.
     */
    String nodeType();

    /**
     * Declared fields in construction-parameter order. The shape of each field
     * (single value, optional value, sequence) is fixed per variant.
     */
    List<NodeField> fields();
}
