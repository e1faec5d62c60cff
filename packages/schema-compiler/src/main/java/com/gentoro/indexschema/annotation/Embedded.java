package com.gentoro.indexschema.annotation;

import java.lang.annotation.*;

/**
 * Maps a field to a structured sub-document. The target class must be annotated with either
 * {@link ObjectType} or {@link NestedType}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
@Documented
public @interface Embedded {

  /** The embedded class whose properties are mapped under this field. */
  Class<?> value();

  /** Schema field name. Empty means the snake-cased field name. */
  String name() default "";

  /** Extra mapping parameters as a JSON object literal, e.g. {@code {"dynamic": "strict"}}. */
  String settings() default "";
}
