package com.gentoro.indexschema.exception;

/**
 * Canonical error codes for IndexSchema. Codes are stable and suitable for logs and for the
 * command line error report. Prefer the most specific code that reflects the failure origin.
 */
public enum SchemaErrorCode {
  // Generic
  UNKNOWN,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  MAPPING_ERROR,
  CIRCULAR_EMBEDDING,
}
