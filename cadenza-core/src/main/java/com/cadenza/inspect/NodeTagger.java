package com.cadenza.inspect;

import com.cadenza.ast.Node;
import com.cadenza.ast.NodeAnnotations;
import com.cadenza.ast.NodeField;
import com.cadenza.ast.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovery pass: numbers every node reachable from a root in depth-first, declared-field order.
 *
 * <ul>
 *   <li>Tokens are never numbered. A token with an attached value stands in for that value.</li>
 *   <li>A node already numbered is not entered again, which is what stops cycles.</li>
 *   <li>List elements are walked in order, map values in the map's iteration order.
 *       A list, map or token is entered at most once. Any other value is a leaf.</li>
 *   <li>Annotations of a node are walked after its declared fields.</li>
 * </ul>
 *
 * <p>The walk keeps its own stack, so tree depth is not limited by the thread's stack size.</p>
 */
public final class NodeTagger {

    private NodeTagger() {
        // Utility class
    }

    public static TaggedGraph tag(Node root) {
        return tag(root, NodeAnnotations.none());
    }

    public static TaggedGraph tag(Node root, NodeAnnotations annotations) {
        if (annotations == null) {
            annotations = NodeAnnotations.none();
        }
        Map<Object, Integer> tags = new IdentityHashMap<>();
        Set<Object> expanded = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Node> nodes = new ArrayList<>();
        Deque<Object> pending = new ArrayDeque<>();
        push(pending, root);

        while (!pending.isEmpty()) {
            Object value = pending.pop();
            if (value instanceof Token || value instanceof List<?> || value instanceof Map<?, ?>) {
                // Containers are entered once; a list holding itself or a token resolving to itself stops here
                if (!expanded.add(value)) {
                    continue;
                }
                if (value instanceof Token token) {
                    push(pending, token.value());
                } else if (value instanceof List<?> list) {
                    pushAll(pending, list);
                } else {
                    pushAll(pending, new ArrayList<>(((Map<?, ?>) value).values()));
                }
            } else if (value instanceof Node node) {
                if (tags.containsKey(node)) {
                    continue;
                }
                nodes.add(node);
                tags.put(node, nodes.size());
                pushChildren(pending, node, annotations);
            }
        }
        return new TaggedGraph(root, nodes, tags, annotations);
    }

    // Children go on the stack last-first so they come off in declared order
    private static void pushChildren(Deque<Object> pending, Node node, NodeAnnotations annotations) {
        List<Object> children = new ArrayList<>();
        for (NodeField field : node.fields()) {
            children.add(field.value());
        }
        children.addAll(annotations.annotationsOf(node).values());
        pushAll(pending, children);
    }

    private static void pushAll(Deque<Object> pending, List<?> values) {
        for (int i = values.size() - 1; i >= 0; i--) {
            push(pending, values.get(i));
        }
    }

    private static void push(Deque<Object> pending, Object value) {
        if (value != null) {
            pending.push(value);
        }
    }
}
