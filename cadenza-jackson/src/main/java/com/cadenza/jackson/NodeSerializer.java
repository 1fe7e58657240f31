package com.cadenza.jackson;

import com.cadenza.ast.Node;
import com.cadenza.inspect.NodeTagger;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a node as the whole graph reachable from it.
 */
public class NodeSerializer extends StdSerializer<Node> {

    public NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider) throws IOException {
        TaggedGraphSerializer.writeGraph(NodeTagger.tag(node), gen);
    }
}
