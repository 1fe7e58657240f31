package com.cadenza.ast;

public sealed interface Statement extends Node permits
    VariableDeclaration,
    If,
    FunctionDeclaration,
    Assignment,
    WhileStatement,
    ReturnStatement,
    PrintStatement,
    BreakStatement,
    Call {
}
