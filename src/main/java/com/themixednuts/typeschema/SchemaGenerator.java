package com.themixednuts.typeschema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.themixednuts.typeschema.exceptions.SchemaGenerationException;
import com.themixednuts.typeschema.generator.AnnotationExtractor;
import com.themixednuts.typeschema.generator.DefinitionRegistry;
import com.themixednuts.typeschema.generator.TypeSchemaWalker;
import com.themixednuts.typeschema.models.SchemaGenerationError;
import com.themixednuts.typeschema.models.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generates JSON Schema documents from Java types.
 *
 * <p>
 * Example Usage:
 * </p>
 *
 * <pre>{@code
 * JsonSchema schema = SchemaGenerator.create()
 * 		.withRoot(Order.class)
 * 		.withDefinition("customer", Customer.class)
 * 		.withDefinition("lineItem", LineItem.class)
 * 		.generate();
 * System.out.println(schema.toJsonString().orElseThrow());
 * }</pre>
 *
 * <p>
 * A generator may be configured once and invoked repeatedly; each call to
 * {@link #generate()} builds an independent document. Every registered type
 * is expanded once under {@code definitions}, and any other
 * occurrence of a registered composite type becomes a
 * {@code {"$ref": "#/definitions/<name>"}} node. Types that contain
 * themselves must be registered as definitions, otherwise generation does
 * not terminate.
 * </p>
 */
public class SchemaGenerator {

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaGenerator.class);

	private static final String ROOT = "root";

	private final SchemaGeneratorOptions options;
	private final Map<String, Type> definitions = new LinkedHashMap<>();
	private Type root;

	private SchemaGenerator(SchemaGeneratorOptions options) {
		this.options = Objects.requireNonNull(options, "Options cannot be null");
	}

	// ========== Factory Methods ==========

	public static SchemaGenerator create() {
		return new SchemaGenerator(SchemaGeneratorOptions.defaults());
	}

	public static SchemaGenerator create(SchemaGeneratorOptions options) {
		return new SchemaGenerator(options);
	}

	/**
	 * Generates the schema of a single root type and renders it as indented
	 * JSON.
	 *
	 * @param root The root type.
	 * @return The rendered document.
	 * @throws IllegalStateException if generation fails.
	 */
	public static String generateString(Type root) {
		return create().withRoot(root).mustGenerate().toString();
	}

	// ========== Configuration ==========

	/**
	 * Sets the root type whose schema forms the top level of the document.
	 *
	 * @param root A {@link Class} or any other reflective type.
	 * @return This generator for chaining.
	 */
	public SchemaGenerator withRoot(Type root) {
		this.root = Objects.requireNonNull(root, "Root type cannot be null");
		return this;
	}

	/**
	 * Sets a generic root type, e.g.
	 * {@code withRoot(new TypeReference<List<Order>>() {})}.
	 */
	public SchemaGenerator withRoot(TypeReference<?> root) {
		Objects.requireNonNull(root, "Root type reference cannot be null");
		return withRoot(root.getType());
	}

	public SchemaGenerator withDefinition(String name, Type type) {
		Objects.requireNonNull(name, "Definition name cannot be null");
		Objects.requireNonNull(type, "Definition type cannot be null");
		definitions.put(name, type);
		return this;
	}

	public SchemaGenerator withDefinition(String name, TypeReference<?> type) {
		Objects.requireNonNull(type, "Definition type reference cannot be null");
		return withDefinition(name, type.getType());
	}

	public SchemaGenerator withDefinitions(Map<String, ? extends Type> definitions) {
		Objects.requireNonNull(definitions, "Definitions map cannot be null");
		for (Map.Entry<String, ? extends Type> entry : definitions.entrySet()) {
			withDefinition(entry.getKey(), entry.getValue());
		}
		return this;
	}

	public SchemaGeneratorOptions getOptions() {
		return options;
	}

	// ========== Generation ==========

	/**
	 * Generates the document: every definition first, then the root.
	 *
	 * @return A new document; nothing in it is shared with earlier calls.
	 * @throws SchemaGenerationException if a definition or the root fails to
	 *                                   convert. The error names the failing
	 *                                   definition (or {@code root}) and wraps the
	 *                                   field-level cause. No partial document is
	 *                                   returned.
	 */
	public JsonSchema generate() throws SchemaGenerationException {
		ObjectMapper mapper = options.getObjectMapper();
		TypeFactory typeFactory = mapper.getTypeFactory();

		DefinitionRegistry.Builder registryBuilder = DefinitionRegistry.builder(typeFactory);
		definitions.forEach(registryBuilder::register);
		DefinitionRegistry registry = registryBuilder.build();

		TypeSchemaWalker walker = new TypeSchemaWalker(registry, new AnnotationExtractor(mapper), typeFactory);

		Map<String, SchemaNode> generated = new LinkedHashMap<>();
		for (Map.Entry<String, JavaType> definition : registry.definitions().entrySet()) {
			String name = definition.getKey();
			JavaType type = definition.getValue();
			LOGGER.debug("Generating definition '{}' for {}", name, type.toCanonical());
			try {
				generated.put(name, walker.build(type, true));
			} catch (SchemaGenerationException e) {
				throw new SchemaGenerationException(SchemaGenerationError.definitionConversionFailure()
						.message(String.format("error on type %s (%s): %s", type.toCanonical(), name, e.getMessage()))
						.typeName(type.toCanonical())
						.definitionName(name)
						.build(), e);
			}
		}

		SchemaNode rootNode = null;
		if (root != null) {
			JavaType type = typeFactory.constructType(root);
			LOGGER.debug("Generating root schema for {}", type.toCanonical());
			try {
				rootNode = walker.build(type, false);
			} catch (SchemaGenerationException e) {
				throw new SchemaGenerationException(SchemaGenerationError.rootConversionFailure()
						.message(String.format("error on root type %s: %s", type.toCanonical(), e.getMessage()))
						.typeName(type.toCanonical())
						.definitionName(ROOT)
						.build(), e);
			}
		}

		return new JsonSchema(options.getSchemaUri(), generated, rootNode, mapper);
	}

	/**
	 * Generates the document, rethrowing any failure unchecked.
	 *
	 * @return The generated document.
	 * @throws IllegalStateException wrapping the {@link SchemaGenerationException}.
	 */
	public JsonSchema mustGenerate() {
		try {
			return generate();
		} catch (SchemaGenerationException e) {
			throw new IllegalStateException(e.getMessage(), e);
		}
	}
}
