package com.themixednuts.typeschema.generator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.themixednuts.typeschema.annotation.Required;
import com.themixednuts.typeschema.exceptions.SchemaGenerationException;
import com.themixednuts.typeschema.models.JsonSchemaType;
import com.themixednuts.typeschema.models.SchemaGenerationError;
import com.themixednuts.typeschema.models.SchemaNode;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive conversion of a resolved Java type into a {@link SchemaNode} tree.
 *
 * <p>
 * Each category from {@link TypeKind} has its own branch:
 * </p>
 * <ul>
 * <li>primitives map to their {@code type}/{@code format} pair (enums also
 * list their constants);</li>
 * <li>an optional around a primitive becomes
 * {@code anyOf: [<primitive>, {"type": "null"}]}, while an optional around
 * anything else is transparent;</li>
 * <li>{@code byte[]} is a string;</li>
 * <li>sequences get {@code items} unless the element type is opaque;</li>
 * <li>maps whose value type has a schema type get the wildcard property
 * {@code ".*"}, other maps allow additional properties;</li>
 * <li>composites are either a {@code $ref} to a registered definition or an
 * inline object with one property per visible field.</li>
 * </ul>
 *
 * <p>
 * A type that contains itself without being registered as a definition
 * recurses without bound and ends in a {@link StackOverflowError}. Register
 * such types as definitions so that the nested occurrence becomes a
 * reference.
 * </p>
 */
public class TypeSchemaWalker {

	private final DefinitionRegistry registry;
	private final AnnotationExtractor extractor;
	private final TypeFactory typeFactory;

	public TypeSchemaWalker(DefinitionRegistry registry, AnnotationExtractor extractor, TypeFactory typeFactory) {
		this.registry = Objects.requireNonNull(registry, "DefinitionRegistry cannot be null");
		this.extractor = Objects.requireNonNull(extractor, "AnnotationExtractor cannot be null");
		this.typeFactory = Objects.requireNonNull(typeFactory, "TypeFactory cannot be null");
	}

	/**
	 * Builds the schema node for a type.
	 *
	 * @param type             The resolved type to convert.
	 * @param isDefinitionRoot True when generating the body of a definition:
	 *                         the type itself is expanded inline even if it is
	 *                         registered. Nested composites are still
	 *                         referenced.
	 * @return A new node tree owned by the caller.
	 * @throws SchemaGenerationException if a field's annotations are malformed;
	 *                                   the exception names the field path.
	 */
	public SchemaNode build(JavaType type, boolean isDefinitionRoot) throws SchemaGenerationException {
		TypeKind kind = TypeKind.of(type);
		switch (kind.getCategory()) {
			case PRIMITIVE:
				return buildPrimitive(type, kind);
			case OPTIONAL:
				return buildOptional(type, isDefinitionRoot);
			case BYTES:
				return new SchemaNode(JsonSchemaType.STRING);
			case SEQUENCE:
				return buildSequence(type);
			case MAP:
				return buildMap(type);
			case COMPOSITE:
				return buildComposite(type, isDefinitionRoot);
			case OPAQUE:
			default:
				return new SchemaNode();
		}
	}

	private SchemaNode buildPrimitive(JavaType type, TypeKind kind) {
		SchemaNode node = new SchemaNode(kind.getSchemaType(), kind.getFormat());
		Class<?> raw = type.getRawClass();
		if (raw.isEnum()) {
			node.enumValues(enumNames(raw));
		}
		return node;
	}

	private SchemaNode buildOptional(JavaType type, boolean isDefinitionRoot) throws SchemaGenerationException {
		JavaType content = TypeKind.optionalContent(type, typeFactory);
		SchemaNode inner = build(content, isDefinitionRoot);
		if (!TypeKind.of(content).isPrimitive()) {
			return inner;
		}
		return new SchemaNode().anyOf(inner, new SchemaNode(JsonSchemaType.NULL));
	}

	private SchemaNode buildSequence(JavaType type) throws SchemaGenerationException {
		SchemaNode node = new SchemaNode(JsonSchemaType.ARRAY);
		JavaType element = TypeKind.elementType(type);
		if (TypeKind.of(element).getCategory() != TypeKind.Category.OPAQUE) {
			node.items(build(element, false));
		}
		return node;
	}

	private SchemaNode buildMap(JavaType type) {
		SchemaNode node = new SchemaNode(JsonSchemaType.OBJECT);
		TypeKind valueKind = TypeKind.of(type.getContentType());
		if (valueKind.getSchemaType() != null) {
			node.property(".*", new SchemaNode(valueKind.getSchemaType(), valueKind.getFormat()));
		} else {
			node.additionalProperties(true);
		}
		return node;
	}

	private SchemaNode buildComposite(JavaType type, boolean isDefinitionRoot) throws SchemaGenerationException {
		if (!isDefinitionRoot) {
			Optional<String> definitionName = registry.lookup(type);
			if (definitionName.isPresent()) {
				return SchemaNode.reference(definitionName.get());
			}
		}

		String typeName = type.toCanonical();
		SchemaNode node = new SchemaNode(JsonSchemaType.OBJECT).additionalProperties(false);
		extractor.apply(type.getRawClass(), node, typeName, typeName);

		for (JavaType owner : hierarchy(type)) {
			Class<?> declaring = owner.getRawClass();
			for (Field field : declaring.getDeclaredFields()) {
				if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
					continue;
				}
				addField(node, owner, field, typeName);
			}
		}
		return node;
	}

	private void addField(SchemaNode node, JavaType owner, Field field, String typeName)
			throws SchemaGenerationException {
		FieldTag tag = FieldTag.of(field, owner.getRawClass());

		try {
			if (!tag.visible()) {
				// metadata carrier: annotations describe the enclosing object
				extractor.apply(field, node, tag.name(), typeName);
				return;
			}
			if (tag.ignored()) {
				return;
			}

			JavaType fieldType = typeFactory.resolveMemberType(field.getGenericType(), owner.getBindings());
			SchemaNode child = build(fieldType, false);
			extractor.apply(field, child, tag.name(), typeName);
			node.property(tag.name(), child);
		} catch (SchemaGenerationException e) {
			throw new SchemaGenerationException(SchemaGenerationError.fieldConversionFailure()
					.message(String.format("property %s of %s: %s", field.getName(), typeName, e.getMessage()))
					.typeName(typeName)
					.propertyName(tag.name())
					.build(), e);
		}

		if (field.isAnnotationPresent(Required.class) && !tag.omitEmpty()) {
			node.requiredProperty(tag.name());
		}
	}

	// Superclass fields come first, java.lang.Object contributes none.
	private static Deque<JavaType> hierarchy(JavaType type) {
		Deque<JavaType> chain = new ArrayDeque<>();
		for (JavaType current = type; current != null && current.getRawClass() != Object.class; current = current
				.getSuperClass()) {
			chain.addFirst(current);
		}
		return chain;
	}

	private static List<String> enumNames(Class<?> enumClass) {
		List<String> names = new ArrayList<>();
		for (Object constant : enumClass.getEnumConstants()) {
			String name = ((Enum<?>) constant).name();
			try {
				JsonProperty property = enumClass.getField(name).getAnnotation(JsonProperty.class);
				if (property != null && !property.value().isEmpty()) {
					name = property.value();
				}
			} catch (NoSuchFieldException e) {
				throw new IllegalStateException("Enum constant " + name + " has no field in " + enumClass.getName(), e);
			}
			names.add(name);
		}
		return names;
	}
}
