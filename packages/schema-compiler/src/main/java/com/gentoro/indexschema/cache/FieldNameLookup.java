package com.gentoro.indexschema.cache;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over the field name tables the mapping compiler stores in a {@link
 * MetadataCache}. Used when documents are converted to and from their indexed form.
 */
public class FieldNameLookup {
  private final MetadataCache cache;

  public FieldNameLookup(MetadataCache cache) {
    this.cache = cache;
  }

  /** Schema field name of {@code property} on {@code type}. */
  public Optional<String> schemaFieldName(Class<?> type, String property) {
    return lookup(MetadataCache.OBJ_CACHED_FIELDS, type, property);
  }

  /** Property name behind the schema field {@code schemaField} of {@code type}. */
  public Optional<String> propertyName(Class<?> type, String schemaField) {
    return lookup(MetadataCache.ARRAY_CACHED_FIELDS, type, schemaField);
  }

  /** Fully-qualified class name embedded under {@code property}, if it is an embedded field. */
  public Optional<String> embeddedClassName(Class<?> type, String property) {
    return lookup(MetadataCache.EMBEDDED_CACHED_FIELDS, type, property);
  }

  public Map<String, Object> table(String key, Class<?> type) {
    Object tables = cache.fetch(key);
    if (tables instanceof Map<?, ?> byClass && byClass.get(type.getName()) instanceof Map<?, ?> t) {
      @SuppressWarnings("unchecked")
      Map<String, Object> table = (Map<String, Object>) t;
      return table;
    }
    return Map.of();
  }

  private Optional<String> lookup(String key, Class<?> type, String name) {
    return Optional.ofNullable(table(key, type).get(name)).map(Object::toString);
  }
}
