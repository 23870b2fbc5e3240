package com.themixednuts.typeschema;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Immutable configuration of a {@link SchemaGenerator}.
 *
 * <p>
 * The dialect URI is written as {@code $schema} at the top of every generated
 * document. The {@link ObjectMapper} resolves Java types, parses
 * {@code @Extensions} payloads and renders documents to text; pass a custom
 * one to share type caches or modules with the rest of an application.
 * </p>
 */
public final class SchemaGeneratorOptions {

	/** Dialect URI used when none is configured. */
	public static final String DEFAULT_SCHEMA = "http://json-schema.org/schema#";

	// Reusable ObjectMapper instance. Used as default.
	static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

	private static final SchemaGeneratorOptions DEFAULTS = builder().build();

	private final String schemaUri;
	private final ObjectMapper objectMapper;

	private SchemaGeneratorOptions(String schemaUri, ObjectMapper objectMapper) {
		this.schemaUri = schemaUri;
		this.objectMapper = objectMapper;
	}

	public static SchemaGeneratorOptions defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String getSchemaUri() {
		return schemaUri;
	}

	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	public Builder toBuilder() {
		return new Builder().schemaUri(schemaUri).objectMapper(objectMapper);
	}

	@Override
	public String toString() {
		return "SchemaGeneratorOptions{schemaUri=" + schemaUri + "}";
	}

	public static final class Builder {
		private String schemaUri;
		private ObjectMapper objectMapper;

		private Builder() {
		}

		/**
		 * Sets the dialect URI. A null or blank value selects
		 * {@link #DEFAULT_SCHEMA}.
		 */
		public Builder schemaUri(String schemaUri) {
			this.schemaUri = schemaUri;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
			return this;
		}

		public SchemaGeneratorOptions build() {
			String uri = schemaUri == null || schemaUri.isBlank() ? DEFAULT_SCHEMA : schemaUri;
			ObjectMapper mapper = objectMapper != null ? objectMapper : DEFAULT_MAPPER;
			return new SchemaGeneratorOptions(uri, mapper);
		}
	}
}
