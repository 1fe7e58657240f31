package com.cadenza.inspect;

import com.cadenza.ast.Node;
import com.cadenza.ast.NodeAnnotations;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Result of {@link NodeTagger#tag}: every node reachable from a root, numbered 1..N in discovery order.
 */
public final class TaggedGraph {

    private final Node root;
    private final List<Node> nodes;
    private final Map<Object, Integer> tags;
    private final NodeAnnotations annotations;

    TaggedGraph(Node root, List<Node> nodes, Map<Object, Integer> tags, NodeAnnotations annotations) {
        this.root = root;
        this.nodes = Collections.unmodifiableList(nodes);
        this.tags = tags;
        this.annotations = annotations;
    }

    public Node root() {
        return root;
    }

    /**
     * Tagged nodes; the node at index {@code i} has tag {@code i + 1}.
     */
    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Tag of this exact instance, or empty if it was never reached or is not taggable.
     */
    public OptionalInt tagOf(Object value) {
        Integer tag = value == null ? null : tags.get(value);
        return tag == null ? OptionalInt.empty() : OptionalInt.of(tag);
    }

    public Map<String, Object> annotationsOf(Node node) {
        return annotations.annotationsOf(node);
    }
}
