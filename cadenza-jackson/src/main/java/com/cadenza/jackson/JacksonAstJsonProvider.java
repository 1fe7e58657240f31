package com.cadenza.jackson;

import com.cadenza.ast.Node;
import com.cadenza.ast.NodeAnnotations;
import com.cadenza.inspect.NodeTagger;
import com.cadenza.json.AstJsonException;
import com.cadenza.json.AstJsonProvider;
import com.cadenza.json.AstJsonSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = CadenzaJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node root) throws AstJsonException {
            return serialize(root, NodeAnnotations.none());
        }

        @Override
        public String serialize(Node root, NodeAnnotations annotations) throws AstJsonException {
            try {
                return mapper.writeValueAsString(NodeTagger.tag(root, annotations));
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize node graph", e);
            }
        }

        @Override
        public String serializePretty(Node root) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(NodeTagger.tag(root));
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize node graph", e);
            }
        }
    }
}
