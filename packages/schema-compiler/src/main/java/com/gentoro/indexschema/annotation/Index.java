package com.gentoro.indexschema.annotation;

import java.lang.annotation.*;

/**
 * Declares a class as a search index document. Read once per compilation by the schema compiler.
 *
 * <pre>
 *   {@literal @}Index(alias = "products", defaultIndex = true,
 *          settings = "{\"number_of_shards\": 1}")
 *   public class Product { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface Index {

  String DEFAULT_TYPE_NAME = "_doc";

  /** Index alias. Empty means the snake-cased simple class name. */
  String alias() default "";

  /** Whether this index is the one used when no alias is given. */
  boolean defaultIndex() default false;

  /** Legacy mapping type name, used as the single key under {@code mappings}. */
  String typeName() default DEFAULT_TYPE_NAME;

  /** Index settings as a JSON object literal, e.g. {@code {"number_of_replicas": 0}}. */
  String settings() default "";
}
