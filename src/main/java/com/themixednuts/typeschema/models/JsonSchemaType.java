package com.themixednuts.typeschema.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The primitive JSON Schema instance types a {@link SchemaNode} can declare
 * through its {@code type} keyword.
 *
 * @see <a href="https://json-schema.org/draft-07/json-schema-validation.html#rfc.section.6.1.1">Draft 7 type</a>
 */
public enum JsonSchemaType {
  STRING("string"),
  NUMBER("number"),
  INTEGER("integer"),
  BOOLEAN("boolean"),
  ARRAY("array"),
  OBJECT("object"),
  NULL("null");

  private final String value;

  JsonSchemaType(String value) {
    this.value = value;
  }

  /**
   * Returns the keyword value as it appears in a schema document.
   *
   * @return The JSON schema type string.
   */
  @JsonValue
  @Override
  public String toString() {
    return value;
  }

  /** Types whose annotations may carry string validators. */
  public boolean isString() {
    return this == STRING;
  }

  /** Types whose annotations may carry numeric validators. */
  public boolean isNumeric() {
    return this == NUMBER || this == INTEGER;
  }
}
