package com.themixednuts.typeschema.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field as required in the enclosing object's {@code required} list.
 * Ignored when the field is also marked to be omitted when empty through
 * Jackson's {@code @JsonInclude}.
 */
@Retention(RetentionPolicy.RUNTIME) // Read reflectively while walking fields
@Target(ElementType.FIELD)
public @interface Required {
}
