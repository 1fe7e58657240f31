package com.cadenza.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Symbols every program can use without declaring them. Built once, never modified.
 */
public final class StandardLibrary {

    public static final Map<String, Symbol> ENTRIES;

    static {
        Map<String, Symbol> entries = new LinkedHashMap<>();
        entries.put("π", new Variable("π", false));
        entries.put("sqrt", new Function("sqrt", 1, true));
        entries.put("sin", new Function("sin", 1, true));
        entries.put("cos", new Function("cos", 1, true));
        entries.put("exp", new Function("exp", 1, true));
        entries.put("ln", new Function("ln", 1, true));
        entries.put("hypot", new Function("hypot", 2, true));
        ENTRIES = Collections.unmodifiableMap(entries);
    }

    private StandardLibrary() {
        // Utility class
    }

    public static Optional<Symbol> lookup(String name) {
        return Optional.ofNullable(ENTRIES.get(name));
    }

    public static boolean contains(String name) {
        return ENTRIES.containsKey(name);
    }
}
