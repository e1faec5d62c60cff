package com.gentoro.indexschema.annotation;

import java.lang.annotation.*;

/**
 * Marks an embeddable class that is mapped with the {@code nested} type, so that each element of
 * an array is indexed as its own hidden document.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface NestedType {
  String TYPE = "nested";
}
