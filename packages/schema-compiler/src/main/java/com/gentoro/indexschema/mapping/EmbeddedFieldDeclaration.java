package com.gentoro.indexschema.mapping;

import com.gentoro.indexschema.annotation.Embedded;
import com.gentoro.indexschema.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;

/** Declaration of a structured sub-document, read from {@link Embedded}. */
public record EmbeddedFieldDeclaration(
    String name, Class<?> targetClass, Map<String, Object> settings) implements FieldDeclaration {

  public EmbeddedFieldDeclaration {
    settings = settings == null ? Map.of() : settings;
  }

  public static EmbeddedFieldDeclaration from(Embedded embedded) {
    return new EmbeddedFieldDeclaration(
        ScalarFieldDeclaration.blankToNull(embedded.name()),
        embedded.value(),
        JacksonUtility.readJsonObject(embedded.settings()));
  }

  @Override
  public Map<String, Object> toSettings() {
    return new LinkedHashMap<>(settings);
  }
}
