package com.gentoro.indexschema.exception;

/** Configuration problem detected while loading settings or registering documents. */
public class ConfigException extends SchemaException {
  public ConfigException(String message) {
    super(SchemaErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SchemaErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
