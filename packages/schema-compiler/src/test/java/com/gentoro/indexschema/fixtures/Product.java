package com.gentoro.indexschema.fixtures;

import com.gentoro.indexschema.annotation.Embedded;
import com.gentoro.indexschema.annotation.Index;
import com.gentoro.indexschema.annotation.MultiField;
import com.gentoro.indexschema.annotation.Property;
import java.util.List;

@Index(
    alias = "products",
    defaultIndex = true,
    settings = "{\"number_of_shards\": 1, \"number_of_replicas\": 0}")
public class Product {

  public static final String TYPE = "product";

  @Property(type = "keyword")
  private String id;

  @Property(
      type = "text",
      analyzer = "incremental",
      searchAnalyzer = "standard",
      fields = {@MultiField(name = "raw", type = "keyword")})
  private String title;

  @Property(name = "price_eur", type = "float")
  private double price;

  @Embedded(Category.class)
  private List<Category> categories;

  @Embedded(value = Location.class, settings = "{\"dynamic\": \"strict\"}")
  private Location location;

  private String internalNote;
}
