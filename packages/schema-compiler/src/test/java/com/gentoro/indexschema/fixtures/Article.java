package com.gentoro.indexschema.fixtures;

import com.gentoro.indexschema.annotation.Index;
import com.gentoro.indexschema.annotation.Property;

@Index
public class Article extends BaseDocument {

  @Property(name = "article_id", type = "keyword")
  private String id;

  @Property(type = "text", searchQuoteAnalyzer = "quoted")
  private String userName;

  @Property(type = "boolean", settings = "{\"index\": false}")
  private boolean draft;
}
