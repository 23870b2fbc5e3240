package com.themixednuts.typeschema.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.themixednuts.typeschema.annotation.ConstValue;
import com.themixednuts.typeschema.annotation.DefaultValue;
import com.themixednuts.typeschema.annotation.Description;
import com.themixednuts.typeschema.annotation.EnumValues;
import com.themixednuts.typeschema.annotation.ExclusiveMaximum;
import com.themixednuts.typeschema.annotation.ExclusiveMinimum;
import com.themixednuts.typeschema.annotation.Extensions;
import com.themixednuts.typeschema.annotation.MaxLength;
import com.themixednuts.typeschema.annotation.Maximum;
import com.themixednuts.typeschema.annotation.MinLength;
import com.themixednuts.typeschema.annotation.Minimum;
import com.themixednuts.typeschema.annotation.MultipleOf;
import com.themixednuts.typeschema.annotation.Pattern;
import com.themixednuts.typeschema.annotation.Title;
import com.themixednuts.typeschema.exceptions.SchemaGenerationException;
import com.themixednuts.typeschema.models.JsonSchemaType;
import com.themixednuts.typeschema.models.SchemaGenerationError;
import com.themixednuts.typeschema.models.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.AnnotatedElement;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns the declarative annotations of a field (or of a type) into schema
 * keywords on an already built node.
 *
 * <p>
 * Validators are chosen by the node's resolved {@code type}: string
 * validators for {@code string}, numeric validators for {@code number} and
 * {@code integer}, none otherwise. A validator whose literal does not parse is
 * left out of the node and logged at DEBUG; it is not an error. Defaults and
 * extensions, on the other hand, fail the generation when malformed.
 * </p>
 */
public class AnnotationExtractor {

	private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationExtractor.class);

	private static final String ENUM_SEPARATOR = "|";
	private static final Set<String> TRUE_LITERALS = Set.of("1", "t", "T", "TRUE", "true", "True");
	private static final Set<String> FALSE_LITERALS = Set.of("0", "f", "F", "FALSE", "false", "False");

	private final ObjectReader extensionsReader;

	public AnnotationExtractor(ObjectMapper mapper) {
		Objects.requireNonNull(mapper, "ObjectMapper cannot be null");
		// a payload is exactly one JSON value
		this.extensionsReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
	}

	/**
	 * Applies title, description, validators, default and extensions found on
	 * {@code source} to {@code target}, in that order.
	 *
	 * @param source       The annotated field or type.
	 * @param target       The node receiving the keywords; its type must already
	 *                     be set.
	 * @param propertyName The external property name, used in error messages.
	 * @param typeName     The enclosing type name, used in error context.
	 * @throws SchemaGenerationException if the default cannot be coerced to the
	 *                                   node's type or the extensions are not a
	 *                                   JSON object.
	 */
	public void apply(AnnotatedElement source, SchemaNode target, String propertyName, String typeName)
			throws SchemaGenerationException {
		Description description = source.getAnnotation(Description.class);
		if (description != null) {
			target.description(description.value());
		}
		Title title = source.getAnnotation(Title.class);
		if (title != null) {
			target.title(title.value());
		}

		addValidators(source, target, propertyName);

		DefaultValue defaultValue = source.getAnnotation(DefaultValue.class);
		if (defaultValue != null) {
			applyDefault(defaultValue.value(), target, propertyName, typeName);
		}

		Extensions extensions = source.getAnnotation(Extensions.class);
		if (extensions != null) {
			target.extensions(parseExtensions(extensions.value(), propertyName, typeName));
		}
	}

	// ========== Validators ==========

	private void addValidators(AnnotatedElement source, SchemaNode target, String propertyName) {
		JsonSchemaType type = target.getType();
		if (type == null) {
			return;
		}
		if (type.isString()) {
			addStringValidators(source, target, propertyName);
		} else if (type.isNumeric()) {
			addNumberValidators(source, target, propertyName);
		}
	}

	private void addStringValidators(AnnotatedElement source, SchemaNode target, String propertyName) {
		MinLength minLength = source.getAnnotation(MinLength.class);
		if (minLength != null) {
			target.minLength(parseLong(minLength.value(), "minLength", propertyName));
		}
		MaxLength maxLength = source.getAnnotation(MaxLength.class);
		if (maxLength != null) {
			target.maxLength(parseLong(maxLength.value(), "maxLength", propertyName));
		}
		Pattern pattern = source.getAnnotation(Pattern.class);
		if (pattern != null && !pattern.value().isEmpty()) {
			target.pattern(pattern.value());
		}
		EnumValues enumValues = source.getAnnotation(EnumValues.class);
		if (enumValues != null && !enumValues.value().isEmpty()) {
			target.enumValues(Arrays.asList(enumValues.value().split(java.util.regex.Pattern.quote(ENUM_SEPARATOR), -1)));
		}
		ConstValue constValue = source.getAnnotation(ConstValue.class);
		if (constValue != null && !constValue.value().isEmpty()) {
			target.constValue(constValue.value());
		}
	}

	private void addNumberValidators(AnnotatedElement source, SchemaNode target, String propertyName) {
		MultipleOf multipleOf = source.getAnnotation(MultipleOf.class);
		if (multipleOf != null) {
			target.multipleOf(parseDouble(multipleOf.value(), "multipleOf", propertyName));
		}
		Minimum minimum = source.getAnnotation(Minimum.class);
		if (minimum != null) {
			target.minimum(parseDouble(minimum.value(), "minimum", propertyName));
		}
		Maximum maximum = source.getAnnotation(Maximum.class);
		if (maximum != null) {
			target.maximum(parseDouble(maximum.value(), "maximum", propertyName));
		}
		ExclusiveMinimum exclusiveMinimum = source.getAnnotation(ExclusiveMinimum.class);
		if (exclusiveMinimum != null) {
			target.exclusiveMinimum(parseDouble(exclusiveMinimum.value(), "exclusiveMinimum", propertyName));
		}
		ExclusiveMaximum exclusiveMaximum = source.getAnnotation(ExclusiveMaximum.class);
		if (exclusiveMaximum != null) {
			target.exclusiveMaximum(parseDouble(exclusiveMaximum.value(), "exclusiveMaximum", propertyName));
		}
		ConstValue constValue = source.getAnnotation(ConstValue.class);
		if (constValue != null) {
			if (target.getType() == JsonSchemaType.NUMBER) {
				Double parsed = parseDouble(constValue.value(), "const", propertyName);
				if (parsed != null) {
					target.constValue(parsed);
				}
			} else {
				Long parsed = parseLong(constValue.value(), "const", propertyName);
				if (parsed != null) {
					target.constValue(parsed);
				}
			}
		}
	}

	private static Long parseLong(String literal, String keyword, String propertyName) {
		try {
			return Long.parseLong(literal);
		} catch (NumberFormatException e) {
			LOGGER.debug("Ignoring {} on property {}: {} is not an integer", keyword, propertyName, literal);
			return null;
		}
	}

	private static Double parseDouble(String literal, String keyword, String propertyName) {
		Double parsed = toFiniteDouble(literal);
		if (parsed == null) {
			LOGGER.debug("Ignoring {} on property {}: {} is not a number", keyword, propertyName, literal);
		}
		return parsed;
	}

	// NaN and the infinities have no JSON representation
	private static Double toFiniteDouble(String literal) {
		try {
			double value = Double.parseDouble(literal);
			return Double.isFinite(value) ? value : null;
		} catch (NumberFormatException e) {
			return null;
		}
	}

	// ========== Default ==========

	private void applyDefault(String literal, SchemaNode target, String propertyName, String typeName)
			throws SchemaGenerationException {
		JsonSchemaType type = target.getType();
		if (type == JsonSchemaType.STRING) {
			target.defaultValue(literal);
		} else if (type == JsonSchemaType.NUMBER || type == JsonSchemaType.INTEGER) {
			Double parsed = toFiniteDouble(literal);
			if (parsed == null) {
				throw defaultParseFailure(literal, "float64", propertyName, typeName);
			}
			target.defaultValue(parsed);
		} else if (type == JsonSchemaType.BOOLEAN) {
			if (TRUE_LITERALS.contains(literal)) {
				target.defaultValue(true);
			} else if (FALSE_LITERALS.contains(literal)) {
				target.defaultValue(false);
			} else {
				throw defaultParseFailure(literal, "bool", propertyName, typeName);
			}
		} else {
			String typeLabel = type == null ? "" : type.toString();
			throw new SchemaGenerationException(SchemaGenerationError.unsupportedDefaultType()
					.message(String.format("default not supported for type \"%s\" on property %s", typeLabel, propertyName))
					.typeName(typeName)
					.propertyName(propertyName)
					.attemptedValue(literal)
					.build());
		}
	}

	private static SchemaGenerationException defaultParseFailure(String literal, String target, String propertyName,
			String typeName) {
		return new SchemaGenerationException(SchemaGenerationError.defaultParseFailure()
				.message(String.format("could not parse \"%s\" to %s for property %s", literal, target, propertyName))
				.typeName(typeName)
				.propertyName(propertyName)
				.attemptedValue(literal)
				.build());
	}

	// ========== Extensions ==========

	private Map<String, JsonNode> parseExtensions(String payload, String propertyName, String typeName)
			throws SchemaGenerationException {
		JsonNode parsed;
		try {
			parsed = extensionsReader.readTree(payload);
		} catch (JsonProcessingException e) {
			throw extensionsParseFailure(payload, e.getOriginalMessage(), propertyName, typeName, e);
		}
		if (parsed == null || !parsed.isObject()) {
			String found = parsed == null || parsed.isMissingNode() ? "no content" : parsed.getNodeType().toString();
			throw extensionsParseFailure(payload, "expected a JSON object but found " + found, propertyName, typeName,
					null);
		}

		Map<String, JsonNode> entries = new LinkedHashMap<>();
		parsed.fields().forEachRemaining(entry -> entries.put(entry.getKey(), entry.getValue()));
		return entries;
	}

	private static SchemaGenerationException extensionsParseFailure(String payload, String reason,
			String propertyName, String typeName, Throwable cause) {
		SchemaGenerationError error = SchemaGenerationError.extensionsParseFailure()
				.message(String.format("invalid \"extensions\" value \"%s\" on property %s: %s", payload, propertyName,
						reason))
				.typeName(typeName)
				.propertyName(propertyName)
				.attemptedValue(payload)
				.build();
		return cause == null ? new SchemaGenerationException(error) : new SchemaGenerationException(error, cause);
	}
}
