package com.themixednuts.typeschema.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaNodeTest {

    private static List<String> keys(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Test
    void emptyNode_rendersEmptyObject() {
        assertEquals("{}", new SchemaNode().toString());
    }

    @Test
    void emptyValues_areOmitted() {
        SchemaNode node = new SchemaNode(JsonSchemaType.STRING)
                .description("")
                .pattern("")
                .enumValues(List.of())
                .defaultValue("")
                .constValue("")
                .additionalProperties(false);

        assertEquals(List.of("type"), keys(node.toJsonNode()));
    }

    @Test
    void zeroBounds_areRendered() {
        ObjectNode json = new SchemaNode(JsonSchemaType.INTEGER)
                .minimum(0.0)
                .maxLength(0L)
                .toJsonNode();

        assertEquals(0, json.get("minimum").asInt());
        assertEquals(0, json.get("maxLength").asInt());
    }

    @Test
    void keywords_renderInFixedOrder() {
        SchemaNode node = new SchemaNode(JsonSchemaType.STRING)
                .title("T")
                .pattern("p")
                .description("d")
                .defaultValue("x")
                .minLength(1L)
                .maxLength(2L);

        assertEquals(List.of("type", "description", "default", "maxLength", "minLength", "pattern", "title"),
                keys(node.toJsonNode()));
    }

    @Test
    void wholeNumbers_renderWithoutFraction() {
        ObjectNode json = new SchemaNode(JsonSchemaType.NUMBER)
                .maximum(42.0)
                .minimum(1.5)
                .defaultValue(3.0)
                .toJsonNode();

        assertEquals("42", json.get("maximum").toString());
        assertEquals("1.5", json.get("minimum").toString());
        assertEquals("3", json.get("default").toString());
    }

    @Test
    void extensions_overrideStructuralKeys() {
        Map<String, JsonNode> extensions = Map.of(
                "type", JsonNodeFactory.instance.textNode("custom"),
                "x-flag", JsonNodeFactory.instance.booleanNode(true));

        ObjectNode json = new SchemaNode(JsonSchemaType.STRING).extensions(extensions).toJsonNode();

        assertEquals("custom", json.get("type").asText());
        assertTrue(json.get("x-flag").asBoolean());
    }

    @Test
    void required_keepsFirstOccurrenceOnly() {
        SchemaNode node = new SchemaNode(JsonSchemaType.OBJECT)
                .requiredProperty("a")
                .requiredProperty("b")
                .requiredProperty("a");

        assertEquals(List.of("a", "b"), node.getRequired());
    }

    @Test
    void reference_pointsIntoDefinitions() {
        assertEquals("{\"$ref\":\"#/definitions/item\"}", SchemaNode.reference("item").toString());
    }

    @Test
    void nestedNodes_renderRecursively() {
        SchemaNode node = new SchemaNode(JsonSchemaType.OBJECT)
                .property("tags", new SchemaNode(JsonSchemaType.ARRAY).items(new SchemaNode(JsonSchemaType.STRING)))
                .property("when", new SchemaNode().anyOf(
                        new SchemaNode(JsonSchemaType.STRING, StringFormatType.DATE_TIME),
                        new SchemaNode(JsonSchemaType.NULL)));

        ObjectNode json = node.toJsonNode();
        assertEquals("string", json.at("/properties/tags/items/type").asText());
        assertEquals("date-time", json.at("/properties/when/anyOf/0/format").asText());
        assertEquals("null", json.at("/properties/when/anyOf/1/type").asText());
    }

    @Test
    void serializesThroughJsonValue() throws Exception {
        SchemaNode node = new SchemaNode(JsonSchemaType.BOOLEAN).title("Flag");
        assertEquals("{\"type\":\"boolean\",\"title\":\"Flag\"}", new ObjectMapper().writeValueAsString(node));
    }

    @Test
    void equality_followsRenderedForm() {
        assertEquals(new SchemaNode(JsonSchemaType.STRING).title("a"), new SchemaNode(JsonSchemaType.STRING).title("a"));
        assertNotEquals(new SchemaNode(JsonSchemaType.STRING), new SchemaNode(JsonSchemaType.INTEGER));
        assertEquals(new SchemaNode(JsonSchemaType.STRING).hashCode(), new SchemaNode(JsonSchemaType.STRING).hashCode());
    }
}
