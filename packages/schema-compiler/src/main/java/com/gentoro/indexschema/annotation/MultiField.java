package com.gentoro.indexschema.annotation;

import java.lang.annotation.*;

/** One sub-field of a {@link Property}, rendered under the property's {@code fields} key. */
@Retention(RetentionPolicy.RUNTIME)
@Target({})
@Documented
public @interface MultiField {

  String name();

  String type();

  String analyzer() default "";

  String searchAnalyzer() default "";

  /** Extra mapping parameters as a JSON object literal. */
  String settings() default "";
}
