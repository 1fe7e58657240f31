package com.cadenza;

/**
 * Thrown by a node constructor handed a value of the wrong shape.
 */
public class MalformedNodeException extends CompileException {

    public MalformedNodeException(String message) {
        super(message);
    }
}
