package com.themixednuts.typeschema.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One unit of a generated schema tree.
 *
 * <p>
 * Child nodes (items, properties, anyOf, oneOf, dependencies) are owned
 * exclusively by their parent. Named definitions are reached only through the
 * string-valued {@code $ref}, never through a shared node instance.
 * </p>
 *
 * <p>
 * Rendering omits every keyword holding an empty value: null, empty strings,
 * empty collections and a {@code false} additionalProperties. Numeric
 * validators are boxed so that a zero bound is still emitted. Extension
 * entries are merged last, at the node's own level, and replace any
 * same-named keyword.
 * </p>
 */
public class SchemaNode {

	public static final String TYPE = "type";
	public static final String FORMAT = "format";
	public static final String ITEMS = "items";
	public static final String PROPERTIES = "properties";
	public static final String REQUIRED = "required";
	public static final String ADDITIONAL_PROPERTIES = "additionalProperties";
	public static final String DESCRIPTION = "description";
	public static final String ANY_OF = "anyOf";
	public static final String ONE_OF = "oneOf";
	public static final String DEPENDENCIES = "dependencies";
	public static final String DEFAULT = "default";
	public static final String MULTIPLE_OF = "multipleOf";
	public static final String MAXIMUM = "maximum";
	public static final String MINIMUM = "minimum";
	public static final String EXCLUSIVE_MAXIMUM = "exclusiveMaximum";
	public static final String EXCLUSIVE_MINIMUM = "exclusiveMinimum";
	public static final String MAX_LENGTH = "maxLength";
	public static final String MIN_LENGTH = "minLength";
	public static final String PATTERN = "pattern";
	public static final String ENUM = "enum";
	public static final String TITLE = "title";
	public static final String CONST = "const";
	public static final String REF = "$ref";

	private static final double WHOLE_NUMBER_LIMIT = 1e15;

	private JsonSchemaType type;
	private StringFormatType format;
	private SchemaNode items;
	private Map<String, SchemaNode> properties;
	private List<String> required;
	private boolean additionalProperties;
	private String description;
	private List<SchemaNode> anyOf;
	private List<SchemaNode> oneOf;
	private Map<String, SchemaNode> dependencies;
	private Object defaultValue;

	private Double multipleOf;
	private Double maximum;
	private Double minimum;
	private Double exclusiveMaximum;
	private Double exclusiveMinimum;

	private Long maxLength;
	private Long minLength;
	private String pattern;
	private List<String> enumValues;
	private String title;
	private Object constValue;
	private String ref;
	private Map<String, JsonNode> extensions;

	public SchemaNode() {
	}

	public SchemaNode(JsonSchemaType type) {
		this.type = type;
	}

	public SchemaNode(JsonSchemaType type, StringFormatType format) {
		this.type = type;
		this.format = format;
	}

	/**
	 * Creates a pure reference node pointing at the named definition.
	 *
	 * @param definitionName The definition name, without the
	 *                       {@code #/definitions/} prefix.
	 * @return A node carrying only {@code $ref}.
	 */
	public static SchemaNode reference(String definitionName) {
		return new SchemaNode().ref("#/definitions/" + Objects.requireNonNull(definitionName, "Definition name cannot be null"));
	}

	// ========== Structure ==========

	public JsonSchemaType getType() {
		return type;
	}

	public SchemaNode type(JsonSchemaType type) {
		this.type = type;
		return this;
	}

	public StringFormatType getFormat() {
		return format;
	}

	public SchemaNode format(StringFormatType format) {
		this.format = format;
		return this;
	}

	public SchemaNode getItems() {
		return items;
	}

	public SchemaNode items(SchemaNode items) {
		this.items = items;
		return this;
	}

	/**
	 * Returns the property map in insertion order, or an empty map when no
	 * properties were added.
	 */
	public Map<String, SchemaNode> getProperties() {
		return properties == null ? Collections.emptyMap() : Collections.unmodifiableMap(properties);
	}

	public SchemaNode property(String name, SchemaNode propertySchema) {
		Objects.requireNonNull(name, "Property name cannot be null");
		Objects.requireNonNull(propertySchema, "Property schema cannot be null");
		if (properties == null) {
			properties = new LinkedHashMap<>();
		}
		properties.put(name, propertySchema);
		return this;
	}

	public List<String> getRequired() {
		return required == null ? Collections.emptyList() : Collections.unmodifiableList(required);
	}

	public SchemaNode requiredProperty(String name) {
		Objects.requireNonNull(name, "Required property name cannot be null");
		if (required == null) {
			required = new ArrayList<>();
		}
		if (!required.contains(name)) {
			required.add(name);
		}
		return this;
	}

	public boolean isAdditionalProperties() {
		return additionalProperties;
	}

	public SchemaNode additionalProperties(boolean allowed) {
		this.additionalProperties = allowed;
		return this;
	}

	public List<SchemaNode> getAnyOf() {
		return anyOf == null ? Collections.emptyList() : Collections.unmodifiableList(anyOf);
	}

	public SchemaNode anyOf(SchemaNode... schemas) {
		this.anyOf = new ArrayList<>(List.of(schemas));
		return this;
	}

	public List<SchemaNode> getOneOf() {
		return oneOf == null ? Collections.emptyList() : Collections.unmodifiableList(oneOf);
	}

	public SchemaNode oneOf(SchemaNode... schemas) {
		this.oneOf = new ArrayList<>(List.of(schemas));
		return this;
	}

	public Map<String, SchemaNode> getDependencies() {
		return dependencies == null ? Collections.emptyMap() : Collections.unmodifiableMap(dependencies);
	}

	public SchemaNode dependency(String name, SchemaNode dependencySchema) {
		Objects.requireNonNull(name, "Dependency name cannot be null");
		Objects.requireNonNull(dependencySchema, "Dependency schema cannot be null");
		if (dependencies == null) {
			dependencies = new LinkedHashMap<>();
		}
		dependencies.put(name, dependencySchema);
		return this;
	}

	public String getRef() {
		return ref;
	}

	public SchemaNode ref(String ref) {
		this.ref = ref;
		return this;
	}

	// ========== Metadata ==========

	public String getTitle() {
		return title;
	}

	public SchemaNode title(String title) {
		this.title = title;
		return this;
	}

	public String getDescription() {
		return description;
	}

	public SchemaNode description(String description) {
		this.description = description;
		return this;
	}

	/** The default literal: a {@link String}, {@link Double} or {@link Boolean}. */
	public Object getDefaultValue() {
		return defaultValue;
	}

	public SchemaNode defaultValue(String value) {
		this.defaultValue = value;
		return this;
	}

	public SchemaNode defaultValue(double value) {
		this.defaultValue = value;
		return this;
	}

	public SchemaNode defaultValue(boolean value) {
		this.defaultValue = value;
		return this;
	}

	public Map<String, JsonNode> getExtensions() {
		return extensions == null ? Collections.emptyMap() : Collections.unmodifiableMap(extensions);
	}

	public SchemaNode extensions(Map<String, JsonNode> extensions) {
		this.extensions = extensions == null ? null : new LinkedHashMap<>(extensions);
		return this;
	}

	// ========== Numeric validators ==========

	public Double getMultipleOf() {
		return multipleOf;
	}

	public SchemaNode multipleOf(Double multipleOf) {
		this.multipleOf = multipleOf;
		return this;
	}

	public Double getMaximum() {
		return maximum;
	}

	public SchemaNode maximum(Double maximum) {
		this.maximum = maximum;
		return this;
	}

	public Double getMinimum() {
		return minimum;
	}

	public SchemaNode minimum(Double minimum) {
		this.minimum = minimum;
		return this;
	}

	public Double getExclusiveMaximum() {
		return exclusiveMaximum;
	}

	public SchemaNode exclusiveMaximum(Double exclusiveMaximum) {
		this.exclusiveMaximum = exclusiveMaximum;
		return this;
	}

	public Double getExclusiveMinimum() {
		return exclusiveMinimum;
	}

	public SchemaNode exclusiveMinimum(Double exclusiveMinimum) {
		this.exclusiveMinimum = exclusiveMinimum;
		return this;
	}

	// ========== String validators ==========

	public Long getMaxLength() {
		return maxLength;
	}

	public SchemaNode maxLength(Long maxLength) {
		this.maxLength = maxLength;
		return this;
	}

	public Long getMinLength() {
		return minLength;
	}

	public SchemaNode minLength(Long minLength) {
		this.minLength = minLength;
		return this;
	}

	public String getPattern() {
		return pattern;
	}

	public SchemaNode pattern(String pattern) {
		this.pattern = pattern;
		return this;
	}

	public List<String> getEnumValues() {
		return enumValues == null ? Collections.emptyList() : Collections.unmodifiableList(enumValues);
	}

	public SchemaNode enumValues(List<String> values) {
		this.enumValues = values == null ? null : new ArrayList<>(values);
		return this;
	}

	/** The const literal: a {@link String}, {@link Double} or {@link Long}. */
	public Object getConstValue() {
		return constValue;
	}

	public SchemaNode constValue(String value) {
		this.constValue = value;
		return this;
	}

	public SchemaNode constValue(double value) {
		this.constValue = value;
		return this;
	}

	public SchemaNode constValue(long value) {
		this.constValue = value;
		return this;
	}

	// ========== Rendering ==========

	/**
	 * Renders this node and its children into a fresh Jackson tree.
	 *
	 * @return A new {@link ObjectNode}; later changes to this node are not
	 *         reflected in it.
	 */
	@JsonValue
	public ObjectNode toJsonNode() {
		JsonNodeFactory factory = JsonNodeFactory.instance;
		ObjectNode node = factory.objectNode();

		if (type != null) {
			node.put(TYPE, type.toString());
		}
		if (format != null) {
			node.put(FORMAT, format.toString());
		}
		if (items != null) {
			node.set(ITEMS, items.toJsonNode());
		}
		putNodeMap(node, PROPERTIES, properties);
		putStrings(node, REQUIRED, required);
		if (additionalProperties) {
			node.put(ADDITIONAL_PROPERTIES, true);
		}
		putText(node, DESCRIPTION, description);
		putNodeList(node, ANY_OF, anyOf);
		putNodeList(node, ONE_OF, oneOf);
		putNodeMap(node, DEPENDENCIES, dependencies);
		putLiteral(node, DEFAULT, defaultValue);

		putNumber(node, MULTIPLE_OF, multipleOf);
		putNumber(node, MAXIMUM, maximum);
		putNumber(node, MINIMUM, minimum);
		putNumber(node, EXCLUSIVE_MAXIMUM, exclusiveMaximum);
		putNumber(node, EXCLUSIVE_MINIMUM, exclusiveMinimum);

		if (maxLength != null) {
			node.put(MAX_LENGTH, maxLength);
		}
		if (minLength != null) {
			node.put(MIN_LENGTH, minLength);
		}
		putText(node, PATTERN, pattern);
		putStrings(node, ENUM, enumValues);
		putText(node, TITLE, title);
		putLiteral(node, CONST, constValue);
		putText(node, REF, ref);

		if (extensions != null) {
			extensions.forEach((key, value) -> node.set(key, value == null ? null : value.deepCopy()));
		}
		return node;
	}

	private static void putText(ObjectNode node, String key, String value) {
		if (value != null && !value.isEmpty()) {
			node.put(key, value);
		}
	}

	private static void putNumber(ObjectNode node, String key, Double value) {
		if (value == null) {
			return;
		}
		// whole numbers print as 42, not 42.0
		if (value == Math.rint(value) && Math.abs(value) < WHOLE_NUMBER_LIMIT) {
			node.put(key, value.longValue());
		} else {
			node.put(key, value);
		}
	}

	private static void putStrings(ObjectNode node, String key, List<String> values) {
		if (values == null || values.isEmpty()) {
			return;
		}
		ArrayNode array = node.putArray(key);
		values.forEach(array::add);
	}

	private static void putNodeList(ObjectNode node, String key, List<SchemaNode> values) {
		if (values == null || values.isEmpty()) {
			return;
		}
		ArrayNode array = node.putArray(key);
		values.forEach(child -> array.add(child.toJsonNode()));
	}

	private static void putNodeMap(ObjectNode node, String key, Map<String, SchemaNode> values) {
		if (values == null || values.isEmpty()) {
			return;
		}
		ObjectNode object = node.putObject(key);
		values.forEach((name, child) -> object.set(name, child.toJsonNode()));
	}

	// Literals are restricted to String, Boolean, Double and Long by the typed mutators.
	private static void putLiteral(ObjectNode node, String key, Object value) {
		if (value instanceof String) {
			putText(node, key, (String) value);
		} else if (value instanceof Boolean) {
			node.put(key, (Boolean) value);
		} else if (value instanceof Long) {
			node.put(key, (Long) value);
		} else if (value instanceof Double) {
			putNumber(node, key, (Double) value);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		SchemaNode that = (SchemaNode) o;
		return toJsonNode().equals(that.toJsonNode());
	}

	@Override
	public int hashCode() {
		return toJsonNode().hashCode();
	}

	@Override
	public String toString() {
		return toJsonNode().toString();
	}
}
