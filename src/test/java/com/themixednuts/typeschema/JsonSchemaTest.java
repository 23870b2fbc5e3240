package com.themixednuts.typeschema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.themixednuts.typeschema.models.JsonSchemaType;
import com.themixednuts.typeschema.models.SchemaNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonSchemaTest {

    private static JsonSchema document() {
        Map<String, SchemaNode> definitions = new LinkedHashMap<>();
        definitions.put("item", new SchemaNode(JsonSchemaType.OBJECT)
                .property("foo", new SchemaNode(JsonSchemaType.STRING))
                .requiredProperty("foo"));
        SchemaNode root = new SchemaNode(JsonSchemaType.OBJECT)
                .property("item", SchemaNode.reference("item"));
        return new JsonSchema(SchemaGeneratorOptions.DEFAULT_SCHEMA, definitions, root);
    }

    @Test
    void node_flattensRootAfterSchemaAndDefinitions() {
        ObjectNode node = document().getNode();

        assertEquals(SchemaGeneratorOptions.DEFAULT_SCHEMA, node.get("$schema").asText());
        assertEquals("object", node.at("/definitions/item/type").asText());
        assertEquals("#/definitions/item", node.at("/properties/item/$ref").asText());
        assertEquals("$schema", node.fieldNames().next());
    }

    @Test
    void node_isAFreshCopy() {
        JsonSchema schema = document();
        schema.getNode().put("type", "string");
        assertEquals("object", schema.getNode().get("type").asText());
    }

    @Test
    void definitions_areUnmodifiable() {
        assertThrows(UnsupportedOperationException.class,
                () -> document().getDefinitions().put("other", new SchemaNode()));
    }

    @Test
    void emptyDocument_hasOnlySchema() {
        JsonSchema schema = new JsonSchema(SchemaGeneratorOptions.DEFAULT_SCHEMA, Map.of(), null);

        assertEquals(Optional.empty(), schema.getRoot());
        assertEquals(1, schema.getNode().size());
    }

    @Test
    void jsonString_isIndentedByTwoSpaces() throws Exception {
        String json = document().toJsonString().orElseThrow();

        assertTrue(json.startsWith("{\n  \"$schema\": "));
        assertTrue(json.contains("\n    \"item\": {\n      \"type\": \"object\""));
        JsonNode parsed = new ObjectMapper().readTree(json);
        assertEquals(document().getNode(), parsed);
    }

    @Test
    void jsonString_withNullMapper_isEmpty() {
        assertTrue(document().toJsonString(null).isEmpty());
    }

    @Test
    void serializesThroughJsonValue() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode serialized = mapper.readTree(mapper.writeValueAsString(document()));
        assertEquals(document().getNode(), serialized);
    }

    @Test
    void equality_coversAllParts() {
        assertEquals(document(), document());
        assertEquals(document().hashCode(), document().hashCode());
        assertNotEquals(document(), new JsonSchema("other", Map.of(), null));
    }
}
