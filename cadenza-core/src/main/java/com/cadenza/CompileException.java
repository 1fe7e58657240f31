package com.cadenza;

/**
 * Base of every failure raised while building or analyzing an AST.
 */
public class CompileException extends RuntimeException {

    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
