package com.gentoro.indexschema.mapping;

import com.gentoro.indexschema.annotation.NestedType;
import com.gentoro.indexschema.annotation.ObjectType;
import com.gentoro.indexschema.cache.MetadataCache;
import com.gentoro.indexschema.exception.CircularEmbeddingException;
import com.gentoro.indexschema.exception.MappingException;
import com.gentoro.indexschema.exception.SerializationException;
import com.gentoro.indexschema.utility.StringUtility;
import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the annotated properties of a document class into the {@code properties} section of an
 * index mapping.
 *
 * <h2>Field name tables</h2>
 *
 * Every extraction of a class overwrites that class's entries in the {@link MetadataCache}:
 *
 * <ul>
 *   <li>{@link MetadataCache#OBJ_CACHED_FIELDS}: property name to schema field name
 *   <li>{@link MetadataCache#ARRAY_CACHED_FIELDS}: schema field name to property name
 *   <li>{@link MetadataCache#EMBEDDED_CACHED_FIELDS}: property name to embedded class name, only
 *       written when the class has embedded fields
 * </ul>
 *
 * Each entry is a map keyed by fully-qualified class name, so classes with equally named fields
 * never share a table.
 */
public class FieldMetadataExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(FieldMetadataExtractor.class);

  private final AnnotationReader reader;
  private final PropertyCatalog catalog;
  private final MetadataCache cache;

  public FieldMetadataExtractor(
      AnnotationReader reader, PropertyCatalog catalog, MetadataCache cache) {
    this.reader = reader;
    this.catalog = catalog;
    this.cache = cache;
  }

  /**
   * Builds the mapping fragment of {@code type}, keyed by schema field name.
   *
   * @throws MappingException when an embedded class has no usable mapping kind marker or a
   *     settings literal is malformed
   * @throws CircularEmbeddingException when a class embeds itself, directly or through others
   */
  public Map<String, Object> extract(Class<?> type) {
    return extract(type, new LinkedHashSet<>());
  }

  private Map<String, Object> extract(Class<?> type, Set<Class<?>> path) {
    if (!path.add(type)) {
      List<String> cycle = new ArrayList<>();
      path.forEach(c -> cycle.add(c.getName()));
      cycle.add(type.getName());
      throw new CircularEmbeddingException(cycle);
    }
    try {
      return extractProperties(type, path);
    } finally {
      path.remove(type);
    }
  }

  private Map<String, Object> extractProperties(Class<?> type, Set<Class<?>> path) {
    log.debug("Extracting field metadata for {}", type.getName());

    Map<String, Object> mapping = new LinkedHashMap<>();
    Map<String, String> objFields = new LinkedHashMap<>();
    Map<String, String> arrayFields = new LinkedHashMap<>();
    Map<String, String> embeddedFields = new LinkedHashMap<>();

    for (Map.Entry<String, Field> property : catalog.resolve(type).entrySet()) {
      String name = property.getKey();

      for (Annotation annotation : reader.getPropertyAnnotations(property.getValue())) {
        Optional<FieldDeclaration> declaration = readDeclaration(type, name, annotation);
        if (declaration.isEmpty()) {
          continue;
        }

        FieldDeclaration field = declaration.get();
        Map<String, Object> fieldMapping = field.toSettings();

        if (field instanceof ScalarFieldDeclaration scalar) {
          putIfSet(fieldMapping, "type", scalar.type());
          putIfSet(fieldMapping, "analyzer", scalar.analyzer());
          putIfSet(fieldMapping, "search_analyzer", scalar.searchAnalyzer());
          putIfSet(fieldMapping, "search_quote_analyzer", scalar.searchQuoteAnalyzer());
          if (!scalar.fields().isEmpty()) {
            fieldMapping.put("fields", scalar.fieldsMapping());
          }
        } else if (field instanceof EmbeddedFieldDeclaration embedded) {
          Class<?> target = embedded.targetClass();
          fieldMapping.put("type", objectMappingType(target));
          fieldMapping.put("properties", extract(target, path));
          embeddedFields.put(name, target.getName());
        }

        String schemaFieldName =
            field.name() != null ? field.name() : StringUtility.snakeCase(name);
        mapping.put(schemaFieldName, MappingTree.prune(fieldMapping));
        objFields.put(name, schemaFieldName);
        arrayFields.put(schemaFieldName, name);
      }
    }

    // Embedded fields are optional, the other two tables are always written.
    if (!embeddedFields.isEmpty()) {
      saveTable(MetadataCache.EMBEDDED_CACHED_FIELDS, type, embeddedFields);
    }
    saveTable(MetadataCache.ARRAY_CACHED_FIELDS, type, arrayFields);
    saveTable(MetadataCache.OBJ_CACHED_FIELDS, type, objFields);

    log.trace("Extracted {} schema fields for {}", mapping.size(), type.getName());
    return mapping;
  }

  private Optional<FieldDeclaration> readDeclaration(
      Class<?> type, String property, Annotation annotation) {
    try {
      return FieldDeclaration.of(annotation);
    } catch (SerializationException e) {
      throw new MappingException(
          "Invalid settings on %s#%s: %s".formatted(type.getName(), property, e.getMessage()),
          Map.of("class", type.getName(), "property", property),
          e);
    }
  }

  /**
   * Mapping kind of an embeddable class: {@code object} or {@code nested}, selected by exactly one
   * of {@link ObjectType} and {@link NestedType}.
   */
  String objectMappingType(Class<?> type) {
    boolean object = reader.getClassAnnotation(type, ObjectType.class).isPresent();
    boolean nested = reader.getClassAnnotation(type, NestedType.class).isPresent();

    if (object && nested) {
      throw new MappingException(
          ("%s is annotated with both @ObjectType and @NestedType, an embeddable object must use"
                  + " exactly one.")
              .formatted(type.getName()),
          Map.of("class", type.getName()));
    }
    if (object) {
      return ObjectType.TYPE;
    }
    if (nested) {
      return NestedType.TYPE;
    }
    throw new MappingException(
        "%s must be annotated with @ObjectType or @NestedType to be used as embeddable object."
            .formatted(type.getName()),
        Map.of("class", type.getName()));
  }

  // Typed attributes win over settings keys of the same name, unset ones leave them alone.
  private static void putIfSet(Map<String, Object> mapping, String key, String value) {
    if (value != null) {
      mapping.put(key, value);
    }
  }

  private void saveTable(String key, Class<?> type, Map<String, String> table) {
    Map<String, Object> item = new LinkedHashMap<>(MappingTree.asStringKeyed(cache.fetch(key)));
    item.put(type.getName(), Collections.unmodifiableMap(table));
    cache.save(key, item);
  }
}
