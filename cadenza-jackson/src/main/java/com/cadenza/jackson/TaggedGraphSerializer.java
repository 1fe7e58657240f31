package com.cadenza.jackson;

import com.cadenza.ast.Node;
import com.cadenza.ast.NodeField;
import com.cadenza.ast.Token;
import com.cadenza.inspect.TaggedGraph;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Writes a tagged graph as a flat node table:
 * <pre>
 * {"root":1,"nodes":[
 *   {"id":1,"type":"Program","fields":{"statements":[{"$ref":2}]}},
 *   {"id":2,"type":"PrintStatement","fields":{"argument":{"token":"number","lexeme":"5"}}}]}
 * </pre>
 * Node ids are the same tags the text printer uses.
 */
public class TaggedGraphSerializer extends StdSerializer<TaggedGraph> {

    public TaggedGraphSerializer() {
        super(TaggedGraph.class);
    }

    @Override
    public void serialize(TaggedGraph graph, JsonGenerator gen, SerializerProvider provider) throws IOException {
        writeGraph(graph, gen);
    }

    static void writeGraph(TaggedGraph graph, JsonGenerator gen) throws IOException {
        Set<Object> open = Collections.newSetFromMap(new IdentityHashMap<>());
        gen.writeStartObject();
        OptionalInt root = graph.tagOf(graph.root());
        gen.writeFieldName("root");
        if (root.isPresent()) {
            gen.writeNumber(root.getAsInt());
        } else {
            // A bare token root is never tagged
            writeValue(graph, graph.root(), gen, open);
        }

        gen.writeArrayFieldStart("nodes");
        List<Node> nodes = graph.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            writeNode(graph, i + 1, nodes.get(i), gen, open);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeNode(TaggedGraph graph, int id, Node node, JsonGenerator gen, Set<Object> open)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("id", id);
        gen.writeStringField("type", node.nodeType());

        gen.writeObjectFieldStart("fields");
        for (NodeField field : node.fields()) {
            gen.writeFieldName(field.name());
            writeValue(graph, field.value(), gen, open);
        }
        gen.writeEndObject();

        Map<String, Object> annotations = graph.annotationsOf(node);
        if (!annotations.isEmpty()) {
            gen.writeObjectFieldStart("annotations");
            for (Map.Entry<String, Object> annotation : annotations.entrySet()) {
                gen.writeFieldName(annotation.getKey());
                writeValue(graph, annotation.getValue(), gen, open);
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }

    /**
     * @param open lists and maps being written; meeting one again inside itself writes "<?cycle>"
     */
    private static void writeValue(TaggedGraph graph, Object value, JsonGenerator gen, Set<Object> open)
            throws IOException {
        OptionalInt tag = graph.tagOf(value);
        if (tag.isPresent()) {
            gen.writeStartObject();
            gen.writeNumberField("$ref", tag.getAsInt());
            gen.writeEndObject();
        } else if (value instanceof Token token) {
            gen.writeStartObject();
            gen.writeStringField("token", token.category());
            gen.writeStringField("lexeme", token.lexeme());
            gen.writeEndObject();
        } else if (value instanceof List<?> || value instanceof Map<?, ?>) {
            if (!open.add(value)) {
                gen.writeString("<?cycle>");
                return;
            }
            if (value instanceof List<?> list) {
                gen.writeStartArray();
                for (Object element : list) {
                    writeValue(graph, element, gen, open);
                }
                gen.writeEndArray();
            } else {
                gen.writeStartObject();
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                    gen.writeFieldName(String.valueOf(entry.getKey()));
                    writeValue(graph, entry.getValue(), gen, open);
                }
                gen.writeEndObject();
            }
            open.remove(value);
        } else {
            ScalarValues.write(value, gen);
        }
    }
}
