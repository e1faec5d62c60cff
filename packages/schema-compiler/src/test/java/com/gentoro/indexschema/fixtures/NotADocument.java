package com.gentoro.indexschema.fixtures;

import com.gentoro.indexschema.annotation.Property;

public class NotADocument {

  @Property(type = "keyword")
  private String code;
}
