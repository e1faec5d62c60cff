package com.gentoro.indexschema.cache;

/**
 * Key/value store shared between the mapping compiler, which writes the field name tables, and the
 * code that later translates between property names and schema field names.
 *
 * <p>Writes are last-writer-wins per key. There is no transaction across keys, so a reader may
 * observe one field table updated and another one stale.
 */
public interface MetadataCache {

  /** Property name to schema field name, per document class. */
  String OBJ_CACHED_FIELDS = "indexschema.obj_fields";

  /** Property name to embedded class name, per document class. */
  String EMBEDDED_CACHED_FIELDS = "indexschema.embedded_fields";

  /** Schema field name to property name, per document class. */
  String ARRAY_CACHED_FIELDS = "indexschema.array_fields";

  /** Index alias to document class name. */
  String INDEXES = "indexschema.indexes";

  boolean contains(String key);

  /** Returns the stored value, or {@code null} when the key is absent. */
  Object fetch(String key);

  boolean save(String key, Object value);

  boolean delete(String key);
}
