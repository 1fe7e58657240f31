package com.cadenza.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for node graph export.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CadenzaJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * String annotated = mapper.writeValueAsString(NodeTagger.tag(program, annotations));
 * </pre>
 */
public final class CadenzaJackson {

    private CadenzaJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for node graph export.
     *
     * The returned mapper:
     * - Writes any Node as the flat, numbered table of the graph reachable from it
     * - Writes a TaggedGraph the same way, annotations included
     * - Writes back-references as {"$ref": n} so cycles terminate
     * - Writes non-finite numbers as null
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
