package com.themixednuts.typeschema.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * JSON object literal whose top-level entries are merged into the generated
 * node next to the standard keywords, e.g.
 * {@code @Extensions("{\"enumNames\": [\"A\", \"B\"]}")}. Same-named keywords
 * are replaced by the extension entry.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ ElementType.TYPE, ElementType.FIELD })
public @interface Extensions {
	String value();
}
