package com.gentoro.indexschema.mapping;

import com.gentoro.indexschema.annotation.Index;
import com.gentoro.indexschema.cache.MetadataCache;
import com.gentoro.indexschema.exception.MappingException;
import com.gentoro.indexschema.exception.SerializationException;
import com.gentoro.indexschema.utility.JacksonUtility;
import com.gentoro.indexschema.utility.StringUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Compiles an {@link Index} annotated document class into an index definition:
 *
 * <pre>
 * { "settings": { "analysis": {...}, ...index settings },
 *   "mappings": { "&lt;typeName&gt;": { "properties": {...} } } }
 * </pre>
 *
 * Empty values are pruned from the whole definition.
 */
public class SchemaCompiler {
  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(SchemaCompiler.class);

  /** Returned by {@link #documentClassName(String)} for aliases nobody registered. */
  public static final String UNKNOWN_DOCUMENT = "unknown";

  private final AnnotationReader reader;
  private final FieldMetadataExtractor extractor;
  private final AnalysisConfigResolver analysisResolver;
  private final MetadataCache cache;

  public SchemaCompiler(
      AnnotationReader reader,
      FieldMetadataExtractor extractor,
      AnalysisConfigResolver analysisResolver,
      MetadataCache cache) {
    this.reader = reader;
    this.extractor = extractor;
    this.analysisResolver = analysisResolver;
    this.cache = cache;
  }

  /** Wires the default reflection based collaborators around {@code cache}. */
  public static SchemaCompiler create(MetadataCache cache, Map<String, Object> analysisConfig) {
    AnnotationReader reader = new ReflectionAnnotationReader();
    FieldMetadataExtractor extractor =
        new FieldMetadataExtractor(reader, new ReflectivePropertyCatalog(reader), cache);
    return new SchemaCompiler(
        reader, extractor, new AnalysisConfigResolver(extractor, analysisConfig), cache);
  }

  /**
   * Returns the index definition of {@code type}, or an empty map when the class has no {@link
   * Index} annotation or cannot be a document (interfaces, annotations, enums, primitives, arrays).
   */
  public Map<String, Object> compile(Class<?> type) {
    if (!isDocumentCandidate(type)) {
      return new LinkedHashMap<>();
    }
    Optional<Index> index = indexAnnotation(type);
    if (index.isEmpty()) {
      return new LinkedHashMap<>();
    }

    Map<String, Object> settings = indexSettings(type, index.get());
    settings.put("analysis", analysisResolver.resolveAnalysis(type));

    Map<String, Object> typeMapping = new LinkedHashMap<>();
    typeMapping.put("properties", extractor.extract(type));
    Map<String, Object> mappings = new LinkedHashMap<>();
    mappings.put(index.get().typeName(), typeMapping);

    Map<String, Object> definition = new LinkedHashMap<>();
    definition.put("settings", settings);
    definition.put("mappings", mappings);

    log.debug("Compiled index definition for {}", type.getName());
    return MappingTree.prune(definition);
  }

  public String compileAsJson(Class<?> type) {
    return JacksonUtility.toJson(compile(type));
  }

  /** Alias from {@link Index#alias()}, or the snake-cased simple class name. */
  public String indexAlias(Class<?> type) {
    return indexAnnotation(type)
        .map(Index::alias)
        .filter(alias -> !alias.isBlank())
        .orElseGet(() -> StringUtility.snakeCase(type.getSimpleName()));
  }

  public boolean isDefaultIndex(Class<?> type) {
    return indexAnnotation(type).map(Index::defaultIndex).orElse(false);
  }

  public Optional<Index> indexAnnotation(Class<?> type) {
    return reader.getClassAnnotation(type, Index.class);
  }

  /**
   * @deprecated mapping types are removed from the search engine; kept for the mapping layout.
   */
  @Deprecated
  public String typeName(Class<?> type) {
    return indexAnnotation(type).map(Index::typeName).orElse(Index.DEFAULT_TYPE_NAME);
  }

  /**
   * Reverse lookup of the document class registered for {@code alias}. The registry entry is
   * written by {@link com.gentoro.indexschema.registry.IndexRegistry}.
   */
  public String documentClassName(String alias) {
    if (cache.contains(MetadataCache.INDEXES)) {
      Object className = MappingTree.asStringKeyed(cache.fetch(MetadataCache.INDEXES)).get(alias);
      if (className != null) {
        return className.toString();
      }
    }
    return UNKNOWN_DOCUMENT;
  }

  public FieldMetadataExtractor getExtractor() {
    return extractor;
  }

  private Map<String, Object> indexSettings(Class<?> type, Index index) {
    try {
      return JacksonUtility.readJsonObject(index.settings());
    } catch (SerializationException e) {
      throw new MappingException(
          "Invalid index settings on %s: %s".formatted(type.getName(), e.getMessage()),
          Map.of("class", type.getName()),
          e);
    }
  }

  private static boolean isDocumentCandidate(Class<?> type) {
    return !(type.isInterface()
        || type.isAnnotation()
        || type.isEnum()
        || type.isPrimitive()
        || type.isArray());
  }
}
