package com.themixednuts.typeschema.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Constant value of a string, number or integer field. Kept as text for
 * strings, parsed as a double for numbers and as a long for integers.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface ConstValue {
	String value();
}
