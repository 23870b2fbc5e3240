package com.themixednuts.typeschema.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Structured description of a schema generation failure.
 * Carries the error category, a stable error code and the position in the
 * type graph where the malformed input was found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "errorType", "errorCode", "message", "context" })
public class SchemaGenerationError {

	private final ErrorType errorType;
	private final ErrorCode errorCode;
	private final String message;
	private final ErrorContext context;

	/**
	 * Categories of errors that can occur while generating a schema.
	 */
	public enum ErrorType {
		/** Field annotations that cannot be turned into schema keywords */
		EXTRACTION,

		/** A type, field, definition or root that failed to convert */
		CONVERSION
	}

	/**
	 * Specific error subcategories for programmatic handling.
	 */
	public enum ErrorCode {
		// Extraction errors
		UNSUPPORTED_DEFAULT_TYPE("EXT_001", ErrorType.EXTRACTION),
		DEFAULT_PARSE_FAILURE("EXT_002", ErrorType.EXTRACTION),
		EXTENSIONS_PARSE_FAILURE("EXT_003", ErrorType.EXTRACTION),

		// Conversion errors
		FIELD_CONVERSION_FAILURE("CNV_001", ErrorType.CONVERSION),
		ROOT_CONVERSION_FAILURE("CNV_002", ErrorType.CONVERSION),
		DEFINITION_CONVERSION_FAILURE("CNV_003", ErrorType.CONVERSION);

		private final String code;
		private final ErrorType errorType;

		ErrorCode(String code, ErrorType errorType) {
			this.code = code;
			this.errorType = errorType;
		}

		public String getCode() {
			return code;
		}

		public ErrorType getErrorType() {
			return errorType;
		}
	}

	/**
	 * Where in the type graph the error occurred.
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({ "typeName", "propertyName", "definitionName", "attemptedValue" })
	public static class ErrorContext {
		private final String typeName;
		private final String propertyName;
		private final String definitionName;
		private final String attemptedValue;

		public ErrorContext(String typeName, String propertyName, String definitionName, String attemptedValue) {
			this.typeName = typeName;
			this.propertyName = propertyName;
			this.definitionName = definitionName;
			this.attemptedValue = attemptedValue;
		}

		@JsonProperty("typeName")
		public String getTypeName() {
			return typeName;
		}

		@JsonProperty("propertyName")
		public String getPropertyName() {
			return propertyName;
		}

		@JsonProperty("definitionName")
		public String getDefinitionName() {
			return definitionName;
		}

		@JsonProperty("attemptedValue")
		public String getAttemptedValue() {
			return attemptedValue;
		}
	}

	public SchemaGenerationError(ErrorCode errorCode, String message, ErrorContext context) {
		this.errorCode = errorCode;
		this.errorType = errorCode != null ? errorCode.getErrorType() : null;
		this.message = message;
		this.context = context;
	}

	@JsonProperty("errorType")
	public ErrorType getErrorType() {
		return errorType;
	}

	@JsonProperty("errorCode")
	public ErrorCode getErrorCode() {
		return errorCode;
	}

	@JsonProperty("message")
	public String getMessage() {
		return message;
	}

	@JsonProperty("context")
	public ErrorContext getContext() {
		return context;
	}

	// Builder class for easy construction
	public static class Builder {
		private ErrorCode errorCode;
		private String message;
		private String typeName;
		private String propertyName;
		private String definitionName;
		private String attemptedValue;

		public Builder errorCode(ErrorCode errorCode) {
			this.errorCode = errorCode;
			return this;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder typeName(String typeName) {
			this.typeName = typeName;
			return this;
		}

		public Builder propertyName(String propertyName) {
			this.propertyName = propertyName;
			return this;
		}

		public Builder definitionName(String definitionName) {
			this.definitionName = definitionName;
			return this;
		}

		public Builder attemptedValue(String attemptedValue) {
			this.attemptedValue = attemptedValue;
			return this;
		}

		public SchemaGenerationError build() {
			ErrorContext context = null;
			if (typeName != null || propertyName != null || definitionName != null || attemptedValue != null) {
				context = new ErrorContext(typeName, propertyName, definitionName, attemptedValue);
			}
			return new SchemaGenerationError(errorCode, message, context);
		}
	}

	// Static factory methods for each error code
	public static Builder unsupportedDefaultType() {
		return new Builder().errorCode(ErrorCode.UNSUPPORTED_DEFAULT_TYPE);
	}

	public static Builder defaultParseFailure() {
		return new Builder().errorCode(ErrorCode.DEFAULT_PARSE_FAILURE);
	}

	public static Builder extensionsParseFailure() {
		return new Builder().errorCode(ErrorCode.EXTENSIONS_PARSE_FAILURE);
	}

	public static Builder fieldConversionFailure() {
		return new Builder().errorCode(ErrorCode.FIELD_CONVERSION_FAILURE);
	}

	public static Builder rootConversionFailure() {
		return new Builder().errorCode(ErrorCode.ROOT_CONVERSION_FAILURE);
	}

	public static Builder definitionConversionFailure() {
		return new Builder().errorCode(ErrorCode.DEFINITION_CONVERSION_FAILURE);
	}
}
