package com.cadenza;

import com.cadenza.ast.Token;

/**
 * Error signal shared by the parser and analyzers.
 */
public final class Diagnostics {

    private Diagnostics() {
        // Utility class
    }

    /**
     * Always throws. When {@code token} knows where it came from, the message is
     * prefixed with its line and column.
     *
     * @param message what went wrong
     * @param token   the offending token, or null
     * @throws DiagnosticException always
     */
    public static void error(String message, Token token) {
        throw new DiagnosticException(message, token);
    }

    public static void error(String message) {
        error(message, null);
    }
}
