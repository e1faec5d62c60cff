package com.gentoro.indexschema.mapping;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.util.List;
import java.util.Optional;

/**
 * Source of the declarations the compiler works from. An absent annotation is a valid answer, never
 * an error.
 */
public interface AnnotationReader {

  <A extends Annotation> Optional<A> getClassAnnotation(Class<?> type, Class<A> annotationType);

  /** Instance fields declared directly on {@code type}, in declaration order. */
  List<Field> getDeclaredProperties(Class<?> type);

  List<Annotation> getPropertyAnnotations(Field property);
}
