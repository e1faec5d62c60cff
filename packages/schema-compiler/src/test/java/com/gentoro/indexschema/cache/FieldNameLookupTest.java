package com.gentoro.indexschema.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.indexschema.fixtures.AnalysisFixtures;
import com.gentoro.indexschema.fixtures.Category;
import com.gentoro.indexschema.fixtures.Location;
import com.gentoro.indexschema.fixtures.Product;
import com.gentoro.indexschema.mapping.SchemaCompiler;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FieldNameLookupTest {

  @Test
  @DisplayName("lookups answer from the tables written by a compilation")
  void lookupsAfterCompile() {
    MetadataCache cache = new InMemoryMetadataCache();
    SchemaCompiler.create(cache, AnalysisFixtures.global()).compile(Product.class);
    FieldNameLookup lookup = new FieldNameLookup(cache);

    assertEquals(Optional.of("price_eur"), lookup.schemaFieldName(Product.class, "price"));
    assertEquals(Optional.of("price"), lookup.propertyName(Product.class, "price_eur"));
    assertEquals(
        Optional.of(Category.class.getName()), lookup.embeddedClassName(Product.class, "categories"));
    assertEquals(Optional.of("category_id"), lookup.schemaFieldName(Category.class, "categoryId"));
  }

  @Test
  @DisplayName("missing classes and fields resolve to empty")
  void missingEntries() {
    MetadataCache cache = new InMemoryMetadataCache();
    FieldNameLookup lookup = new FieldNameLookup(cache);

    assertTrue(lookup.schemaFieldName(Product.class, "price").isEmpty());

    SchemaCompiler.create(cache, AnalysisFixtures.global()).compile(Product.class);

    assertTrue(lookup.schemaFieldName(Product.class, "internalNote").isEmpty());
    assertTrue(lookup.embeddedClassName(Location.class, "coordinates").isEmpty());
  }

  @Test
  @DisplayName("tables written to a file cache are readable by a later process")
  void fileCacheRoundTrip(@TempDir Path tempDir) {
    Path file = tempDir.resolve("metadata.json");
    SchemaCompiler.create(new FileMetadataCache(file), AnalysisFixtures.global())
        .compile(Product.class);

    FieldNameLookup lookup = new FieldNameLookup(new FileMetadataCache(file));

    assertEquals(Optional.of("title"), lookup.propertyName(Product.class, "title"));
    assertEquals(
        Optional.of(Location.class.getName()), lookup.embeddedClassName(Product.class, "location"));
  }
}
