package com.cadenza.jackson;

import com.cadenza.ast.Node;
import com.cadenza.inspect.TaggedGraph;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Jackson module that configures export of node graphs.
 *
 * This module handles:
 * - Flattening a graph into one entry per tagged node (TaggedGraphSerializer)
 * - Tagging on the fly when a bare Node is written (NodeSerializer)
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.cadenza", "cadenza-jackson"));
        addSerializer(TaggedGraph.class, new TaggedGraphSerializer());
        addSerializer(Node.class, new NodeSerializer());
    }
}
