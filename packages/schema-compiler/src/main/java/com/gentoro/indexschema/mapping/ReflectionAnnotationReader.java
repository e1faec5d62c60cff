package com.gentoro.indexschema.mapping;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** {@link AnnotationReader} backed by runtime-retained annotations. */
public class ReflectionAnnotationReader implements AnnotationReader {

  @Override
  public <A extends Annotation> Optional<A> getClassAnnotation(
      Class<?> type, Class<A> annotationType) {
    return Optional.ofNullable(type.getDeclaredAnnotation(annotationType));
  }

  @Override
  public List<Field> getDeclaredProperties(Class<?> type) {
    return Arrays.stream(type.getDeclaredFields())
        .filter(f -> !Modifier.isStatic(f.getModifiers()))
        .filter(f -> !f.isSynthetic())
        .toList();
  }

  @Override
  public List<Annotation> getPropertyAnnotations(Field property) {
    return List.of(property.getDeclaredAnnotations());
  }
}
