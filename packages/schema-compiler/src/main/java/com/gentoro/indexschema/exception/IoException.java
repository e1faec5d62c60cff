package com.gentoro.indexschema.exception;

/** I/O related failure (file system access). */
public class IoException extends SchemaException {
  public IoException(String message) {
    super(SchemaErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(SchemaErrorCode.IO_ERROR, message, cause);
  }
}
