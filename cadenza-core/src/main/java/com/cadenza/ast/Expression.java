package com.cadenza.ast;

public sealed interface Expression extends Node permits
    Conditional,
    BinaryExpression,
    UnaryExpression,
    SubscriptExpression,
    MemberExpression,
    ArrayLiteral,
    Call,
    Token {
}
