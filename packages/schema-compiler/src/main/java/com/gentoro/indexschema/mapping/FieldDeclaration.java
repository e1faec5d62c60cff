package com.gentoro.indexschema.mapping;

import com.gentoro.indexschema.annotation.Embedded;
import com.gentoro.indexschema.annotation.Property;
import java.lang.annotation.Annotation;
import java.util.Map;
import java.util.Optional;

/**
 * A property annotation that takes part in the schema mapping. Annotations that do not map to a
 * schema field are not represented.
 */
public sealed interface FieldDeclaration
    permits ScalarFieldDeclaration, EmbeddedFieldDeclaration {

  /** Explicit schema field name, or {@code null} to derive it from the property name. */
  String name();

  /** Free-form mapping parameters the declaration carries besides its typed attributes. */
  Map<String, Object> toSettings();

  /**
   * Converts a property annotation into a declaration.
   *
   * @return empty when the annotation does not describe a schema field
   * @throws com.gentoro.indexschema.exception.SerializationException when a settings literal is
   *     not a JSON object
   */
  static Optional<FieldDeclaration> of(Annotation annotation) {
    if (annotation instanceof Property property) {
      return Optional.of(ScalarFieldDeclaration.from(property));
    }
    if (annotation instanceof Embedded embedded) {
      return Optional.of(EmbeddedFieldDeclaration.from(embedded));
    }
    return Optional.empty();
  }
}
