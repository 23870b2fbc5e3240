package com.themixednuts.typeschema.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Longer explanation emitted as the {@code description} keyword. Placed on a
 * type or on a non-visible field it describes the enclosing object.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ ElementType.TYPE, ElementType.FIELD })
public @interface Description {
	String value();
}
