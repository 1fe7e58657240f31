package com.cadenza.ast;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extra fields that later phases attach to nodes, kept beside the tree instead of in it.
 *
 * <p>Keyed by node identity: two structurally equal nodes carry separate annotations.
 * Entries of a node keep their insertion order, and replacing a value keeps its position.
 * Not thread-safe.</p>
 *
 * <p>Values may be nodes, tokens, lists, maps or scalars. Nodes inside lists and map values are
 * reached by the printer like any other; use an ordered map such as {@code LinkedHashMap} to keep
 * the output stable.</p>
 */
public final class NodeAnnotations {

    private static final NodeAnnotations NONE = new NodeAnnotations(Collections.emptyMap());

    private final Map<Node, Map<String, Object>> entries;

    public NodeAnnotations() {
        this(new IdentityHashMap<>());
    }

    private NodeAnnotations(Map<Node, Map<String, Object>> entries) {
        this.entries = entries;
    }

    /**
     * Shared empty table. Annotating it throws.
     */
    public static NodeAnnotations none() {
        return NONE;
    }

    public NodeAnnotations annotate(Node node, String key, Object value) {
        if (node == null || key == null) {
            throw new IllegalArgumentException("node and key are required");
        }
        entries.computeIfAbsent(node, n -> new LinkedHashMap<>()).put(key, value);
        return this;
    }

    public Map<String, Object> annotationsOf(Node node) {
        Map<String, Object> annotations = entries.get(node);
        return annotations == null ? Map.of() : Collections.unmodifiableMap(annotations);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
