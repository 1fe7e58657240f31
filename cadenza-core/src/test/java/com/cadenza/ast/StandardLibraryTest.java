package com.cadenza.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StandardLibraryTest {

    @Test
    void testEntries() {
        assertEquals(List.of("π", "sqrt", "sin", "cos", "exp", "ln", "hypot"), List.copyOf(StandardLibrary.ENTRIES.keySet()));
        assertEquals(new Variable("π", false), StandardLibrary.ENTRIES.get("π"));
        assertEquals(new Function("hypot", 2, true), StandardLibrary.ENTRIES.get("hypot"));
        for (String name : List.of("sqrt", "sin", "cos", "exp", "ln")) {
            assertEquals(new Function(name, 1, true), StandardLibrary.ENTRIES.get(name));
        }
    }

    @Test
    void testLookup() {
        assertSame(StandardLibrary.ENTRIES.get("sin"), StandardLibrary.lookup("sin").orElseThrow());
        assertTrue(StandardLibrary.lookup("tan").isEmpty());
        assertTrue(StandardLibrary.contains("ln"));
        assertFalse(StandardLibrary.contains("log"));
    }

    @Test
    void testIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
            () -> StandardLibrary.ENTRIES.put("tan", new Function("tan", 1, true)));
        assertThrows(UnsupportedOperationException.class, () -> StandardLibrary.ENTRIES.remove("π"));
    }
}
