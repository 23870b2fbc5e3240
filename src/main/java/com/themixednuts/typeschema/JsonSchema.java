package com.themixednuts.typeschema;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.themixednuts.typeschema.models.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable generated schema document, produced by
 * {@link SchemaGenerator#generate()}.
 *
 * <p>
 * The rendered form starts with {@code $schema} and {@code definitions},
 * followed by the keywords of the root node at the same level:
 * </p>
 *
 * <pre>{@code
 * {
 *   "$schema": "http://json-schema.org/schema#",
 *   "definitions": { "child": { "type": "object", ... } },
 *   "type": "object",
 *   "properties": { "child": { "$ref": "#/definitions/child" } }
 * }
 * }</pre>
 */
public final class JsonSchema {

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonSchema.class);

	public static final String SCHEMA = "$schema";
	public static final String DEFINITIONS = "definitions";

	private static final String INDENT = "  ";
	private static final String LINE_FEED = "\n";

	private final String schemaUri;
	private final Map<String, SchemaNode> definitions;
	private final SchemaNode root;
	private final ObjectMapper mapper;

	/**
	 * Package-private constructor to be called by {@link SchemaGenerator}.
	 *
	 * @param schemaUri   The dialect URI.
	 * @param definitions Named definitions in generation order.
	 * @param root        The root node, or null when only definitions were
	 *                    generated.
	 * @param mapper      The mapper {@link #toJsonString()} renders with.
	 */
	JsonSchema(String schemaUri, Map<String, SchemaNode> definitions, SchemaNode root, ObjectMapper mapper) {
		this.schemaUri = schemaUri;
		this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
		this.root = root;
		this.mapper = Objects.requireNonNull(mapper, "ObjectMapper cannot be null");
	}

	JsonSchema(String schemaUri, Map<String, SchemaNode> definitions, SchemaNode root) {
		this(schemaUri, definitions, root, SchemaGeneratorOptions.DEFAULT_MAPPER);
	}

	/**
	 * Returns the dialect URI written as {@code $schema}.
	 */
	public String getSchema() {
		return schemaUri;
	}

	/**
	 * Returns the named definitions in the order they were generated.
	 */
	public Map<String, SchemaNode> getDefinitions() {
		return definitions;
	}

	/**
	 * Returns the root node, if a root type was configured.
	 */
	public Optional<SchemaNode> getRoot() {
		return Optional.ofNullable(root);
	}

	/**
	 * Renders the whole document into a fresh Jackson tree. Modifications to
	 * the returned node do not affect this document.
	 *
	 * @return The document node.
	 */
	@JsonValue
	public ObjectNode getNode() {
		ObjectNode node = mapper.createObjectNode();
		if (schemaUri != null && !schemaUri.isEmpty()) {
			node.put(SCHEMA, schemaUri);
		}
		if (!definitions.isEmpty()) {
			ObjectNode definitionsNode = node.putObject(DEFINITIONS);
			definitions.forEach((name, definition) -> definitionsNode.set(name, definition.toJsonNode()));
		}
		if (root != null) {
			node.setAll(root.toJsonNode());
		}
		return node;
	}

	/**
	 * Serializes the document as JSON indented by two spaces, using the
	 * provided {@link ObjectMapper}.
	 *
	 * @param mapper The ObjectMapper to use for serialization. Must not be null.
	 * @return An {@link Optional} containing the JSON string if serialization is
	 *         successful, otherwise {@link Optional#empty()}.
	 */
	public Optional<String> toJsonString(ObjectMapper mapper) {
		if (mapper == null) {
			return Optional.empty();
		}

		try {
			return Optional.of(mapper.writer(prettyPrinter()).writeValueAsString(getNode()));
		} catch (JsonProcessingException e) {
			LOGGER.warn("Failed to serialize schema document", e);
			return Optional.empty();
		}
	}

	/**
	 * Serializes the document using the {@link ObjectMapper} of the options it
	 * was generated with.
	 *
	 * @return An {@link Optional} containing the JSON string if serialization is
	 *         successful, otherwise {@link Optional#empty()}.
	 */
	public Optional<String> toJsonString() {
		return toJsonString(mapper);
	}

	private static DefaultPrettyPrinter prettyPrinter() {
		DefaultIndenter indenter = new DefaultIndenter(INDENT, LINE_FEED);
		DefaultPrettyPrinter printer = new DefaultPrettyPrinter(Separators.createDefaultInstance()
				.withObjectFieldValueSpacing(Separators.Spacing.AFTER));
		printer.indentObjectsWith(indenter);
		printer.indentArraysWith(indenter);
		return printer;
	}

	@Override
	public String toString() {
		return toJsonString().orElse("JsonSchema{ serialization_error }");
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		JsonSchema that = (JsonSchema) o;
		return Objects.equals(schemaUri, that.schemaUri)
				&& definitions.equals(that.definitions)
				&& Objects.equals(root, that.root);
	}

	@Override
	public int hashCode() {
		return Objects.hash(schemaUri, definitions, root);
	}
}
