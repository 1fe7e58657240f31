package com.cadenza;

import com.cadenza.ast.SourceLocation;
import com.cadenza.ast.Token;

/**
 * A reportable problem in the program being compiled, optionally tied to the token where it was found.
 */
public class DiagnosticException extends CompileException {

    private final String rawMessage;
    private final Token token;  // Can be null

    public DiagnosticException(String message, Token token) {
        super(locate(token) + message);
        this.rawMessage = message;
        this.token = token;
    }

    /**
     * The message without the location prefix.
     */
    public String rawMessage() {
        return rawMessage;
    }

    public Token token() {
        return token;
    }

    private static String locate(Token token) {
        if (token == null || token.location() == null || token.location().start() == null) {
            return "";
        }
        SourceLocation.Position start = token.location().start();
        return "Line " + start.line() + ", col " + start.column() + ": ";
    }
}
