package com.themixednuts.typeschema.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Default literal for the field. The literal is coerced by the resolved schema
 * type: strings pass through, numbers and integers are parsed as doubles and
 * booleans as {@code true}/{@code false}. Any other type rejects the default.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface DefaultValue {
	String value();
}
