package com.gentoro.indexschema.fixtures;

import com.gentoro.indexschema.annotation.Property;

public abstract class BaseDocument {

  @Property(type = "keyword")
  private String id;

  @Property(type = "date", settings = "{\"format\": \"strict_date_optional_time\"}")
  private String createdAt;
}
