package com.gentoro.indexschema.exception;

/** JSON/YAML (de)serialization failure. */
public class SerializationException extends SchemaException {
  public SerializationException(String message) {
    super(SchemaErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(SchemaErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
