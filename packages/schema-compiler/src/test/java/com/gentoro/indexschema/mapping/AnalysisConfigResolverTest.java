package com.gentoro.indexschema.mapping;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.indexschema.cache.InMemoryMetadataCache;
import com.gentoro.indexschema.fixtures.AnalysisFixtures;
import com.gentoro.indexschema.fixtures.Article;
import com.gentoro.indexschema.fixtures.Location;
import com.gentoro.indexschema.fixtures.Product;
import com.gentoro.indexschema.fixtures.Review;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnalysisConfigResolverTest {

  private AnalysisConfigResolver resolver;

  @BeforeEach
  void setUp() {
    AnnotationReader reader = new ReflectionAnnotationReader();
    FieldMetadataExtractor extractor =
        new FieldMetadataExtractor(
            reader, new ReflectivePropertyCatalog(reader), new InMemoryMetadataCache());
    resolver = new AnalysisConfigResolver(extractor, AnalysisFixtures.global());
  }

  @Test
  @DisplayName("only analyzers referenced by the mapping are copied")
  void unreferencedAnalyzersExcluded() {
    Map<String, Object> analysis = resolver.resolveAnalysis(Product.class);

    Map<String, Object> analyzers = MappingTree.asStringKeyed(analysis.get("analyzer"));
    assertEquals(List.of("incremental", "category_analyzer"), List.copyOf(analyzers.keySet()));
    assertFalse(analyzers.containsKey("unused_analyzer"));
  }

  @Test
  @DisplayName("built-in analyzers missing from the global config are not invented")
  void builtInAnalyzersIgnored() {
    Map<String, Object> analysis = resolver.resolveAnalysis(Product.class);

    assertFalse(MappingTree.asStringKeyed(analysis.get("analyzer")).containsKey("standard"));
  }

  @Test
  @DisplayName("components referenced by copied analyzers are copied")
  void componentsOfCopiedAnalyzers() {
    Map<String, Object> analysis = resolver.resolveAnalysis(Product.class);

    assertEquals(
        Map.of("path_tokenizer", Map.of("type", "path_hierarchy", "delimiter", "/")),
        analysis.get("tokenizer"));
    assertEquals(
        Map.of("edge_ngram_filter", Map.of("type", "edge_ngram", "min_gram", 1, "max_gram", 20)),
        analysis.get("filter"));
    assertEquals(
        Map.of("html_strip_custom", Map.of("type", "html_strip")), analysis.get("char_filter"));
    assertFalse(analysis.containsKey("normalizer"));
  }

  @Test
  @DisplayName("components referenced only by other components are not followed")
  void closureIsShallow() {
    Map<String, Object> analysis = resolver.resolveAnalysis(Review.class);

    Map<String, Object> filters = MappingTree.asStringKeyed(analysis.get("filter"));
    assertTrue(filters.containsKey("guarded"));
    assertFalse(filters.containsKey("inner_lowercase"));
  }

  @Test
  @DisplayName("search quote analyzers count as references")
  void searchQuoteAnalyzer() {
    Map<String, Object> global =
        Map.of("analyzer", Map.of("quoted", Map.of("type", "custom", "tokenizer", "keyword")));

    Map<String, Object> analysis = resolver.resolveAnalysis(Article.class, global);

    assertEquals(global, analysis);
  }

  @Test
  @DisplayName("mapping without analyzers yields an empty config")
  void noAnalyzers() {
    assertTrue(resolver.resolveAnalysis(Location.class).isEmpty());
  }

  @Test
  @DisplayName("missing global config yields an empty config")
  void emptyGlobalConfig() {
    assertTrue(resolver.resolveAnalysis(Product.class, Map.of()).isEmpty());
  }
}
