package com.gentoro.indexschema.exception;

import java.util.Map;

/**
 * A document class is declared in a way the mapping compiler cannot turn into a schema, for
 * example an embedded class without a mapping kind marker.
 */
public class MappingException extends SchemaException {
  public MappingException(String message) {
    super(SchemaErrorCode.MAPPING_ERROR, message);
  }

  public MappingException(String message, Map<String, ?> context) {
    super(SchemaErrorCode.MAPPING_ERROR, message, context);
  }

  public MappingException(String message, Map<String, ?> context, Throwable cause) {
    super(SchemaErrorCode.MAPPING_ERROR, message, context, cause);
  }
}
