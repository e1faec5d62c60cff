package com.gentoro.indexschema.annotation;

import java.lang.annotation.*;

/**
 * Maps a field to a scalar schema field.
 *
 * <pre>
 *   {@literal @}Property(type = "text", analyzer = "english",
 *             fields = {{@literal @}MultiField(name = "raw", type = "keyword")})
 *   private String title;
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
@Documented
public @interface Property {

  /** Schema field name. Empty means the snake-cased field name. */
  String name() default "";

  /** Search engine field type, e.g. {@code text}, {@code keyword}, {@code date}. */
  String type();

  String analyzer() default "";

  String searchAnalyzer() default "";

  String searchQuoteAnalyzer() default "";

  /** Additional representations of the same value indexed under sub-field names. */
  MultiField[] fields() default {};

  /** Extra mapping parameters as a JSON object literal, e.g. {@code {"index": false}}. */
  String settings() default "";
}
