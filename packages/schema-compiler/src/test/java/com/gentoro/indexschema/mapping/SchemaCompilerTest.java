package com.gentoro.indexschema.mapping;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.indexschema.cache.InMemoryMetadataCache;
import com.gentoro.indexschema.cache.MetadataCache;
import com.gentoro.indexschema.exception.MappingException;
import com.gentoro.indexschema.fixtures.AnalysisFixtures;
import com.gentoro.indexschema.fixtures.Article;
import com.gentoro.indexschema.fixtures.InvalidEmbeddings;
import com.gentoro.indexschema.fixtures.Location;
import com.gentoro.indexschema.fixtures.NotADocument;
import com.gentoro.indexschema.fixtures.Product;
import com.gentoro.indexschema.fixtures.Review;
import com.gentoro.indexschema.fixtures.Searchable;
import com.gentoro.indexschema.utility.JacksonUtility;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SchemaCompilerTest {

  private MetadataCache cache;
  private SchemaCompiler compiler;

  @BeforeEach
  void setUp() {
    cache = new InMemoryMetadataCache();
    compiler = SchemaCompiler.create(cache, AnalysisFixtures.global());
  }

  @Test
  @DisplayName("classes without @Index compile to an empty definition")
  void noIndexAnnotation() {
    assertTrue(compiler.compile(NotADocument.class).isEmpty());
    assertTrue(compiler.compile(Location.class).isEmpty());
  }

  @Test
  @DisplayName("interfaces never compile, even when annotated")
  void interfacesSkipped() {
    assertTrue(compiler.compile(Searchable.class).isEmpty());
  }

  @Test
  @DisplayName("definition holds settings with analysis and mappings under the type name")
  void definitionShape() {
    Map<String, Object> definition = compiler.compile(Product.class);

    Map<String, Object> settings = MappingTree.asStringKeyed(definition.get("settings"));
    assertEquals(1, settings.get("number_of_shards"));
    assertEquals(0, settings.get("number_of_replicas"));
    assertTrue(MappingTree.asStringKeyed(settings.get("analysis")).containsKey("analyzer"));

    Map<String, Object> mappings = MappingTree.asStringKeyed(definition.get("mappings"));
    assertEquals(Set.of("_doc"), mappings.keySet());
    Map<String, Object> properties =
        MappingTree.asStringKeyed(MappingTree.asStringKeyed(mappings.get("_doc")).get("properties"));
    assertEquals(compiler.getExtractor().extract(Product.class), properties);
  }

  @Test
  @DisplayName("custom type name is used as the mapping key")
  void customTypeName() {
    Map<String, Object> mappings =
        MappingTree.asStringKeyed(compiler.compile(Review.class).get("mappings"));

    assertTrue(mappings.containsKey("review"));
  }

  @Test
  @DisplayName("empty settings are pruned from the definition")
  void emptySettingsPruned() {
    Map<String, Object> definition =
        SchemaCompiler.create(new InMemoryMetadataCache(), Map.of()).compile(Article.class);

    assertFalse(definition.containsKey("settings"));
    assertTrue(definition.containsKey("mappings"));
  }

  @Test
  @DisplayName("compileAsJson renders the definition as JSON")
  void compileAsJson() throws Exception {
    JsonNode json = JacksonUtility.getJsonMapper().readTree(compiler.compileAsJson(Product.class));

    assertEquals(
        "nested", json.at("/mappings/_doc/properties/categories/type").asText());
    assertEquals(
        "path_hierarchy", json.at("/settings/analysis/tokenizer/path_tokenizer/type").asText());
  }

  @Test
  @DisplayName("fatal mapping errors abort the compilation")
  void mappingErrorsPropagate() {
    assertThrows(
        MappingException.class, () -> compiler.compile(InvalidEmbeddings.EmbedsUnmarked.class));
  }

  @Test
  @DisplayName("alias comes from the annotation or the snake-cased class name")
  void indexAlias() {
    assertEquals("products", compiler.indexAlias(Product.class));
    assertEquals("article", compiler.indexAlias(Article.class));
    assertEquals("not_a_document", compiler.indexAlias(NotADocument.class));
  }

  @Test
  void defaultIndexFlag() {
    assertTrue(compiler.isDefaultIndex(Product.class));
    assertFalse(compiler.isDefaultIndex(Article.class));
    assertFalse(compiler.isDefaultIndex(NotADocument.class));
  }

  @Test
  void indexAnnotation() {
    assertTrue(compiler.indexAnnotation(Product.class).isPresent());
    assertTrue(compiler.indexAnnotation(NotADocument.class).isEmpty());
  }

  @Test
  @SuppressWarnings("deprecation")
  void typeName() {
    assertEquals("_doc", compiler.typeName(Product.class));
    assertEquals("review", compiler.typeName(Review.class));
    assertEquals("_doc", compiler.typeName(NotADocument.class));
  }

  @Test
  @DisplayName("document class lookup reads the index registry entry")
  void documentClassName() {
    assertEquals(SchemaCompiler.UNKNOWN_DOCUMENT, compiler.documentClassName("products"));

    cache.save(MetadataCache.INDEXES, Map.of("products", Product.class.getName()));

    assertEquals(Product.class.getName(), compiler.documentClassName("products"));
    assertEquals(SchemaCompiler.UNKNOWN_DOCUMENT, compiler.documentClassName("missing"));
  }
}
