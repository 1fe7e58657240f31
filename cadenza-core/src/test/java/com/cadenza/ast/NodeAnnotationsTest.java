package com.cadenza.ast;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class NodeAnnotationsTest {

    @Test
    void testAnnotationsAreKeyedByIdentity() {
        Variable first = new Variable("x");
        Variable second = new Variable("x");
        assertEquals(first, second);

        NodeAnnotations annotations = new NodeAnnotations().annotate(first, "type", PrimitiveType.INT);

        assertEquals(Map.of("type", PrimitiveType.INT), annotations.annotationsOf(first));
        assertTrue(annotations.annotationsOf(second).isEmpty());
        assertFalse(annotations.isEmpty());
    }

    @Test
    void testInsertionOrderIsKept() {
        BreakStatement stop = new BreakStatement();
        NodeAnnotations annotations = new NodeAnnotations()
            .annotate(stop, "z", 1)
            .annotate(stop, "a", 2)
            .annotate(stop, "m", null);

        assertEquals(List.of("z", "a", "m"), List.copyOf(annotations.annotationsOf(stop).keySet()));
        assertThrows(UnsupportedOperationException.class, () -> annotations.annotationsOf(stop).put("b", 3));
    }

    @Test
    void testNoneIsEmptyAndReadOnly() {
        Program program = new Program(List.of());
        assertTrue(NodeAnnotations.none().isEmpty());
        assertTrue(NodeAnnotations.none().annotationsOf(program).isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> NodeAnnotations.none().annotate(program, "k", 1));
    }

    @Test
    void testRejectsMissingNodeOrKey() {
        NodeAnnotations annotations = new NodeAnnotations();
        assertThrows(IllegalArgumentException.class, () -> annotations.annotate(null, "k", 1));
        assertThrows(IllegalArgumentException.class, () -> annotations.annotate(new BreakStatement(), null, 1));
    }
}
