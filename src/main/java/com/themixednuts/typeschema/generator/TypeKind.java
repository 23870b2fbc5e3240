package com.themixednuts.typeschema.generator;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.themixednuts.typeschema.models.JsonSchemaType;
import com.themixednuts.typeschema.models.StringFormatType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Calendar;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Classification of a Java type into the categories the walker handles, with
 * the {@code type}/{@code format} pair the category maps to.
 *
 * <p>
 * Optional wrappers and opaque types carry no schema type of their own; every
 * other category does, including sequences ({@code array}) and maps and
 * composites ({@code object}).
 * </p>
 */
public final class TypeKind {

	/** The walker branch a type is routed to. */
	public enum Category {
		PRIMITIVE,
		OPTIONAL,
		BYTES,
		SEQUENCE,
		MAP,
		COMPOSITE,
		OPAQUE
	}

	private static final Map<Class<?>, TypeKind> PRIMITIVES = new IdentityHashMap<>();

	static {
		primitive(JsonSchemaType.BOOLEAN, null, boolean.class, Boolean.class);
		primitive(JsonSchemaType.INTEGER, null,
				byte.class, Byte.class, short.class, Short.class, int.class, Integer.class, long.class, Long.class,
				BigInteger.class, AtomicInteger.class, AtomicLong.class);
		primitive(JsonSchemaType.NUMBER, null, float.class, Float.class, double.class, Double.class, BigDecimal.class);
		primitive(JsonSchemaType.STRING, null, String.class, char.class, Character.class);
		primitive(JsonSchemaType.STRING, StringFormatType.DATE_TIME,
				Instant.class, OffsetDateTime.class, ZonedDateTime.class, LocalDateTime.class);
		primitive(JsonSchemaType.STRING, StringFormatType.DATE, LocalDate.class);
		primitive(JsonSchemaType.STRING, StringFormatType.UUID, UUID.class);
		primitive(JsonSchemaType.STRING, StringFormatType.URI, URI.class, URL.class);
	}

	private static final TypeKind DATE_TIME = new TypeKind(Category.PRIMITIVE, JsonSchemaType.STRING,
			StringFormatType.DATE_TIME);
	private static final TypeKind STRING = new TypeKind(Category.PRIMITIVE, JsonSchemaType.STRING, null);
	private static final TypeKind OPTIONAL = new TypeKind(Category.OPTIONAL, null, null);
	private static final TypeKind BYTES = new TypeKind(Category.BYTES, JsonSchemaType.STRING, null);
	private static final TypeKind SEQUENCE = new TypeKind(Category.SEQUENCE, JsonSchemaType.ARRAY, null);
	private static final TypeKind MAP = new TypeKind(Category.MAP, JsonSchemaType.OBJECT, null);
	private static final TypeKind COMPOSITE = new TypeKind(Category.COMPOSITE, JsonSchemaType.OBJECT, null);
	private static final TypeKind OPAQUE = new TypeKind(Category.OPAQUE, null, null);

	private final Category category;
	private final JsonSchemaType schemaType;
	private final StringFormatType format;

	private TypeKind(Category category, JsonSchemaType schemaType, StringFormatType format) {
		this.category = category;
		this.schemaType = schemaType;
		this.format = format;
	}

	private static void primitive(JsonSchemaType schemaType, StringFormatType format, Class<?>... classes) {
		TypeKind kind = new TypeKind(Category.PRIMITIVE, schemaType, format);
		for (Class<?> clazz : classes) {
			PRIMITIVES.put(clazz, kind);
		}
	}

	/**
	 * Classifies a resolved Jackson type.
	 *
	 * @param type The type to classify. Must not be null.
	 * @return The category and the schema type/format it maps to.
	 */
	public static TypeKind of(JavaType type) {
		Class<?> raw = type.getRawClass();

		TypeKind primitive = PRIMITIVES.get(raw);
		if (primitive != null) {
			return primitive;
		}
		if (raw.isEnum()) {
			return STRING;
		}
		if (Date.class.isAssignableFrom(raw) || Calendar.class.isAssignableFrom(raw)) {
			return DATE_TIME;
		}
		if (CharSequence.class.isAssignableFrom(raw)) {
			return STRING;
		}
		if (isOptional(raw)) {
			return OPTIONAL;
		}
		if (raw == byte[].class || raw == Byte[].class) {
			return BYTES;
		}
		// JsonNode is Iterable but carries arbitrary JSON
		if (JsonNode.class.isAssignableFrom(raw)) {
			return OPAQUE;
		}
		if (type.isArrayType() || type.isCollectionLikeType() || Iterable.class.isAssignableFrom(raw)) {
			return SEQUENCE;
		}
		if (type.isMapLikeType()) {
			return MAP;
		}
		if (raw == Object.class || raw.isInterface() || raw.isPrimitive()) {
			return OPAQUE;
		}
		return COMPOSITE;
	}

	/**
	 * Returns the type wrapped by an optional-like type.
	 *
	 * @param type        A type classified as {@link Category#OPTIONAL}.
	 * @param typeFactory The factory used to construct primitive content types.
	 * @return The wrapped type; the unknown type when unbound.
	 */
	public static JavaType optionalContent(JavaType type, TypeFactory typeFactory) {
		Class<?> raw = type.getRawClass();
		if (raw == OptionalInt.class) {
			return typeFactory.constructType(int.class);
		}
		if (raw == OptionalLong.class) {
			return typeFactory.constructType(long.class);
		}
		if (raw == OptionalDouble.class) {
			return typeFactory.constructType(double.class);
		}
		return type.containedTypeOrUnknown(0);
	}

	/**
	 * Returns the element type of a sequence.
	 *
	 * @param type A type classified as {@link Category#SEQUENCE}.
	 * @return The element type; the unknown type when unbound.
	 */
	public static JavaType elementType(JavaType type) {
		if (type.isArrayType() || type.isCollectionLikeType()) {
			return type.getContentType();
		}
		JavaType iterable = type.findSuperType(Iterable.class);
		return iterable != null ? iterable.containedTypeOrUnknown(0) : TypeFactory.unknownType();
	}

	private static boolean isOptional(Class<?> raw) {
		return raw == Optional.class || raw == OptionalInt.class || raw == OptionalLong.class
				|| raw == OptionalDouble.class || raw == AtomicReference.class;
	}

	public Category getCategory() {
		return category;
	}

	/** The schema type for this kind, or null for optional and opaque types. */
	public JsonSchemaType getSchemaType() {
		return schemaType;
	}

	public StringFormatType getFormat() {
		return format;
	}

	/** True for kinds that map directly to a {@code type}/{@code format} pair. */
	public boolean isPrimitive() {
		return category == Category.PRIMITIVE;
	}

	@Override
	public String toString() {
		return category + (schemaType != null ? "(" + schemaType + (format != null ? ", " + format : "") + ")" : "");
	}
}
