package com.gentoro.indexschema.mapping;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reduces the global analysis configuration to the components a document class actually uses.
 *
 * <p>Analyzers are selected from the names referenced by the class mapping under {@code analyzer},
 * {@code search_analyzer} and {@code search_quote_analyzer}. Tokenizers, filters, normalizers and
 * char filters are then selected from the names referenced by the analysis settings collected so
 * far, one kind after the other. The closure is a single level: a component referenced only by
 * another tokenizer or filter definition is included only if its kind comes later in that order.
 */
public class AnalysisConfigResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(AnalysisConfigResolver.class);

  public static final String ANALYZER = "analyzer";

  static final List<String> ANALYZER_KEYS =
      List.of(ANALYZER, "search_analyzer", "search_quote_analyzer");

  static final List<String> COMPONENT_KINDS =
      List.of("tokenizer", "filter", "normalizer", "char_filter");

  private final FieldMetadataExtractor extractor;
  private final Map<String, Object> analysisConfig;

  public AnalysisConfigResolver(
      FieldMetadataExtractor extractor, Map<String, Object> analysisConfig) {
    this.extractor = extractor;
    this.analysisConfig = analysisConfig == null ? Map.of() : analysisConfig;
  }

  /** Resolves against the analysis configuration this resolver was created with. */
  public Map<String, Object> resolveAnalysis(Class<?> type) {
    return resolveAnalysis(type, analysisConfig);
  }

  public Map<String, Object> resolveAnalysis(Class<?> type, Map<String, ?> globalConfig) {
    Map<String, Object> config = new LinkedHashMap<>();
    Map<String, Object> mapping = extractor.extract(type);

    Set<String> analyzers = new LinkedHashSet<>();
    for (String key : ANALYZER_KEYS) {
      analyzers.addAll(MappingTree.collectValues(key, mapping));
    }
    copyReferenced(ANALYZER, analyzers, globalConfig, config);

    for (String kind : COMPONENT_KINDS) {
      copyReferenced(kind, MappingTree.collectValues(kind, config), globalConfig, config);
    }

    log.debug("Resolved analysis sections {} for {}", config.keySet(), type.getName());
    return config;
  }

  private static void copyReferenced(
      String kind, Set<String> names, Map<String, ?> globalConfig, Map<String, Object> config) {
    Map<String, Object> available = MappingTree.asStringKeyed(globalConfig.get(kind));
    for (String name : names) {
      Object definition = available.get(name);
      if (definition == null) {
        continue;
      }
      section(config, kind).put(name, definition);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> section(Map<String, Object> config, String kind) {
    return (Map<String, Object>) config.computeIfAbsent(kind, k -> new LinkedHashMap<>());
  }
}
