package com.cadenza.ast;

import java.util.List;

/**
 * Leaf of the tree: a lexical category paired with the raw source text.
 *
 * <p>Tokens are never tagged by the printer. Once semantic analysis resolves a token
 * (an identifier to its {@link Variable}, say) it attaches the result with
 * {@link #setValue(Object)}, and the token becomes a transparent placeholder for that value.</p>
 *
 * <p>Identity matters, so this is a class rather than a record.</p>
 */
public final class Token implements Expression {
    private final String category;           // e.g. "number", "identifier", "operator"
    private final String lexeme;
    private final SourceLocation location;   // Can be null
    private Object value;                    // Set by analysis, null until resolved

    public Token(String category, String lexeme) {
        this(category, lexeme, null);
    }

    public Token(String category, String lexeme, SourceLocation location) {
        this.category = category;
        this.lexeme = lexeme;
        this.location = location;
    }

    public String category() {
        return category;
    }

    public String lexeme() {
        return lexeme;
    }

    public SourceLocation location() {
        return location;
    }

    public Object value() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    @Override
    public String nodeType() {
        return "Token";
    }

    @Override
    public List<NodeField> fields() {
        return List.of(
            NodeField.of("category", category),
            NodeField.of("lexeme", lexeme));
    }

    @Override
    public String toString() {
        return "(" + category + ",\"" + lexeme + "\")";
    }
}
