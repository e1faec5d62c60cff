package com.gentoro.indexschema.annotation;

import java.lang.annotation.*;

/** Marks an embeddable class that is mapped with the {@code object} type. */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface ObjectType {
  String TYPE = "object";
}
