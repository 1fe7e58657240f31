package com.cadenza.jackson;

import com.cadenza.ast.*;
import com.cadenza.inspect.GraphPrinter;
import com.cadenza.inspect.NodeTagger;
import com.cadenza.inspect.TaggedGraph;
import com.cadenza.json.AstJsonProvider;
import com.cadenza.json.AstJsonSerializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private final ObjectMapper reader = new ObjectMapper();

    private static Program sample() {
        return new Program(List.of(
            new VariableDeclaration(PrimitiveType.INT, new Variable("x"), new Token("number", "5"))));
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertEquals("Jackson", AstJsonProvider.getProvider().getName());
        assertTrue(AstJsonProvider.getProvider("jackson") instanceof JacksonAstJsonProvider);
        assertEquals("Jackson", AstJsonProvider.findProvider("JACKSON").orElseThrow().getName());
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("Gson"));
    }

    @Test
    void testSerializeSimple() throws Exception {
        String json = AstJsonProvider.getProvider().getSerializer().serialize(sample());
        System.out.println("Serialized graph: " + json);

        JsonNode tree = reader.readTree(json);
        assertEquals(1, tree.get("root").asInt());
        JsonNode nodes = tree.get("nodes");
        assertEquals(4, nodes.size());

        assertEquals("Program", nodes.get(0).get("type").asText());
        assertEquals(2, nodes.get(0).get("fields").get("statements").get(0).get("$ref").asInt());

        JsonNode declaration = nodes.get(1).get("fields");
        assertEquals(3, declaration.get("type").get("$ref").asInt());
        assertEquals(4, declaration.get("variable").get("$ref").asInt());
        assertEquals("number", declaration.get("initializer").get("token").asText());
        assertEquals("5", declaration.get("initializer").get("lexeme").asText());

        assertEquals("pog", nodes.get(2).get("fields").get("typename").asText());
        assertEquals("x", nodes.get(3).get("fields").get("name").asText());
        assertTrue(nodes.get(3).get("fields").get("mutable").asBoolean());
        assertFalse(nodes.get(3).has("annotations"));
    }

    @Test
    void testIdsMatchTextPrinter() throws Exception {
        BinaryExpression shared = new BinaryExpression(new Token("operator", "*"), new Token("number", "2"), new Token("number", "3"));
        Program program = new Program(List.of(new PrintStatement(shared), new ReturnStatement(shared), new BreakStatement()));

        JsonNode nodes = reader.readTree(AstJsonProvider.getProvider().getSerializer().serialize(program)).get("nodes");
        String[] lines = GraphPrinter.print(program).split("\n");

        assertEquals(lines.length, nodes.size());
        for (int i = 0; i < lines.length; i++) {
            JsonNode entry = nodes.get(i);
            String prefix = String.format("%4d | %s", entry.get("id").asInt(), entry.get("type").asText());
            assertTrue(lines[i].startsWith(prefix), lines[i]);
        }
        assertEquals(3, nodes.get(3).get("fields").get("value").get("$ref").asInt());
        assertTrue(nodes.get(4).get("fields").isEmpty());
    }

    @Test
    void testCyclicAnnotationsTerminate() throws Exception {
        Variable x = new Variable("x");
        VariableDeclaration declaration = new VariableDeclaration(PrimitiveType.INT, x, null);
        NodeAnnotations annotations = new NodeAnnotations()
            .annotate(x, "declaration", declaration)
            .annotate(x, "weight", Double.NaN)
            .annotate(x, "uses", List.of(new Token("identifier", "x")));

        AstJsonSerializer serializer = AstJsonProvider.getProvider().getSerializer();
        JsonNode variable = reader.readTree(serializer.serialize(new Program(List.of(declaration)), annotations))
            .get("nodes").get(3);

        assertEquals("Variable", variable.get("type").asText());
        JsonNode exported = variable.get("annotations");
        assertEquals(2, exported.get("declaration").get("$ref").asInt());
        assertTrue(exported.get("weight").isNull());
        assertEquals("identifier", exported.get("uses").get(0).get("token").asText());
    }

    @Test
    void testSelfReferencingValuesTerminate() throws Exception {
        BreakStatement stop = new BreakStatement();
        Token self = new Token("identifier", "t");
        self.setValue(self);
        List<Object> uses = new ArrayList<>();
        uses.add(self);
        uses.add(uses);
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("x", new Variable("x"));
        scope.put("self", scope);
        NodeAnnotations annotations = new NodeAnnotations()
            .annotate(stop, "uses", uses)
            .annotate(stop, "scope", scope);

        AstJsonSerializer serializer = AstJsonProvider.getProvider().getSerializer();
        String json = assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> serializer.serialize(new Program(List.of(stop)), annotations));

        JsonNode nodes = reader.readTree(json).get("nodes");
        assertEquals(3, nodes.size());
        JsonNode exported = nodes.get(1).get("annotations");
        assertEquals("t", exported.get("uses").get(0).get("lexeme").asText());
        assertEquals("<?cycle>", exported.get("uses").get(1).asText());
        assertEquals(3, exported.get("scope").get("x").get("$ref").asInt());
        assertEquals("<?cycle>", exported.get("scope").get("self").asText());
    }

    @Test
    void testObjectMapperWritesNodesAndGraphs() throws Exception {
        ObjectMapper mapper = CadenzaJackson.createObjectMapper();
        Program program = sample();

        String fromNode = mapper.writeValueAsString(program);
        TaggedGraph graph = NodeTagger.tag(program);
        String fromGraph = mapper.writeValueAsString(graph);

        assertEquals(fromNode, fromGraph);
        assertEquals(fromNode, mapper.writeValueAsString(program));
    }

    @Test
    void testNestedNodeSerializesItsOwnGraph() throws Exception {
        ObjectMapper mapper = CadenzaJackson.createObjectMapper();
        ArrayType type = new ArrayType(PrimitiveType.STRING);

        JsonNode tree = reader.readTree(mapper.writeValueAsString(type));
        assertEquals(1, tree.get("root").asInt());
        assertEquals("[manyCars]", tree.get("nodes").get(0).get("fields").get("typename").asText());
        assertEquals(2, tree.get("nodes").get(0).get("fields").get("elementType").get("$ref").asInt());
    }

    @Test
    void testTokenRoot() throws Exception {
        JsonNode tree = reader.readTree(AstJsonProvider.getProvider().getSerializer().serialize(new Token("number", "1")));
        assertEquals("number", tree.get("root").get("token").asText());
        assertEquals(0, tree.get("nodes").size());
    }

    @Test
    void testSerializePretty() {
        String json = AstJsonProvider.getProvider().getSerializer().serializePretty(sample());
        System.out.println(json);
        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"$ref\" : 2"));
    }
}
