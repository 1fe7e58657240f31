package com.cadenza.ast;

/**
 * Entities that identifiers resolve to.
 */
public sealed interface Symbol extends Node permits Variable, Function {

    String name();
}
