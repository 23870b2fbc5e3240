package com.themixednuts.typeschema.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Format identifiers emitted for STRING schemas produced from well-known Java
 * value types.
 */
public enum StringFormatType {
	DATE_TIME("date-time"),
	DATE("date"),
	UUID("uuid"),
	URI("uri");

	private final String value;

	StringFormatType(String value) {
		this.value = value;
	}

	@JsonValue
	@Override
	public String toString() {
		return value;
	}
}
