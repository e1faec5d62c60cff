package com.gentoro.indexschema.exception;

/** An operation was invoked while the component is not in a state that allows it. */
public class StateException extends SchemaException {
  public StateException(String message) {
    super(SchemaErrorCode.FAILED_PRECONDITION, message);
  }
}
