package com.cadenza.inspect;

import com.cadenza.ast.Node;
import com.cadenza.ast.NodeAnnotations;
import com.cadenza.ast.NodeField;
import com.cadenza.ast.Token;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Compact, deterministic text dump of a node graph, safe with shared nodes and cycles.
 *
 * <p>Each node reachable from the root is printed once, on its own line, in the order it was
 * first reached:</p>
 * <pre>
 *    1 | Program statements=[#2]
 *    2 | VariableDeclaration type=#3 variable=#4 initializer=(number,"5")
 *    3 | PrimitiveType typename='pog'
 *    4 | Variable name='x' mutable=true
 * </pre>
 * <p>Any later mention of a printed node is written as {@code #tag}. A list or map met again
 * inside itself is written as {@code <?cycle>}.</p>
 */
public final class GraphPrinter {

    private GraphPrinter() {
        // Utility class
    }

    public static String print(Node root) {
        return print(root, NodeAnnotations.none());
    }

    public static String print(Node root, NodeAnnotations annotations) {
        return print(NodeTagger.tag(root, annotations));
    }

    public static String print(TaggedGraph graph) {
        StringJoiner lines = new StringJoiner("\n");
        List<Node> nodes = graph.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            lines.add(line(graph, i + 1, nodes.get(i)));
        }
        return lines.toString();
    }

    private static String line(TaggedGraph graph, int tag, Node node) {
        StringBuilder line = new StringBuilder(String.format(Locale.ROOT, "%4d | %s", tag, node.nodeType()));
        for (NodeField field : node.fields()) {
            appendField(line, graph, field.name(), field.value());
        }
        for (Map.Entry<String, Object> annotation : graph.annotationsOf(node).entrySet()) {
            appendField(line, graph, annotation.getKey(), annotation.getValue());
        }
        return line.toString();
    }

    private static void appendField(StringBuilder line, TaggedGraph graph, String name, Object value) {
        line.append(' ').append(name).append('=').append(view(graph, value, newIdentitySet()));
    }

    /**
     * @param open lists and maps whose rendering is in progress; meeting one again means it contains itself
     */
    static String view(TaggedGraph graph, Object value, Set<Object> open) {
        OptionalInt tag = graph.tagOf(value);
        if (tag.isPresent()) {
            return "#" + tag.getAsInt();
        }
        if (value instanceof Token token) {
            return "(" + token.category() + ",\"" + token.lexeme() + "\")";
        }
        if (value instanceof List<?> || value instanceof Map<?, ?>) {
            if (!open.add(value)) {
                return "<?cycle>";
            }
            String rendered = value instanceof List<?> list
                ? viewList(graph, list, open)
                : viewMap(graph, (Map<?, ?>) value, open);
            open.remove(value);
            return rendered;
        }
        return debug(value);
    }

    private static String viewList(TaggedGraph graph, List<?> list, Set<Object> open) {
        StringJoiner elements = new StringJoiner(",", "[", "]");
        for (Object element : list) {
            elements.add(view(graph, element, open));
        }
        return elements.toString();
    }

    private static String viewMap(TaggedGraph graph, Map<?, ?> map, Set<Object> open) {
        StringJoiner entries = new StringJoiner(",", "{", "}");
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            entries.add(entry.getKey() + "=" + view(graph, entry.getValue(), open));
        }
        return entries.toString();
    }

    private static Set<Object> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static String debug(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String || value instanceof Character) {
            return quote(value.toString());
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return "<?shape " + value.getClass().getSimpleName() + ">";
        }
        return String.valueOf(value);
    }

    private static String quote(String text) {
        StringBuilder quoted = new StringBuilder(text.length() + 2).append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> quoted.append("\\\\");
                case '\'' -> quoted.append("\\'");
                case '\n' -> quoted.append("\\n");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('\'').toString();
    }
}
