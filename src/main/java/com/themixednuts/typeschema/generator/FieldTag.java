package com.themixednuts.typeschema.generator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Serialization view of a single field, read from its Jackson annotations.
 *
 * @param name      External property name: the {@code @JsonProperty} value,
 *                  or the Java field name when absent or empty.
 * @param visible   Whether the field is part of the serialized form. Fields
 *                  that are not visible carry metadata for the enclosing
 *                  object instead.
 * @param ignored   Whether the field is excluded through {@code @JsonIgnore}
 *                  or the name {@code "-"}.
 * @param omitEmpty Whether the field is left out of output when empty, which
 *                  suppresses its required flag.
 */
public record FieldTag(String name, boolean visible, boolean ignored, boolean omitEmpty) {

	static final String SKIP_NAME = "-";

	/**
	 * Reads the serialization view of a field.
	 *
	 * @param field     The field being walked.
	 * @param declaring The class declaring the field; its class-level
	 *                  {@code @JsonInclude} applies when the field has none.
	 * @return The parsed tag.
	 */
	public static FieldTag of(Field field, Class<?> declaring) {
		JsonProperty property = field.getAnnotation(JsonProperty.class);
		String name = property != null && !property.value().isEmpty() ? property.value() : field.getName();

		JsonIgnore ignore = field.getAnnotation(JsonIgnore.class);
		boolean ignored = (ignore != null && ignore.value()) || SKIP_NAME.equals(name);

		int modifiers = field.getModifiers();
		boolean visible = !Modifier.isTransient(modifiers)
				&& (declaring.isRecord() || Modifier.isPublic(modifiers) || property != null);

		return new FieldTag(name, visible, ignored, isOmitEmpty(field, declaring));
	}

	private static boolean isOmitEmpty(Field field, Class<?> declaring) {
		JsonInclude include = field.getAnnotation(JsonInclude.class);
		if (include == null || include.value() == JsonInclude.Include.USE_DEFAULTS) {
			include = declaring.getAnnotation(JsonInclude.class);
		}
		if (include == null) {
			return false;
		}
		JsonInclude.Include value = include.value();
		return value != JsonInclude.Include.ALWAYS && value != JsonInclude.Include.USE_DEFAULTS;
	}
}
