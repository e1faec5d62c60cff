package com.gentoro.indexschema.exception;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured view of a failure for the command line error report.
 *
 * @param type simple class name of the exception
 * @param message exception message, empty when it had none
 * @param code error code, {@link SchemaErrorCode#UNKNOWN} for exceptions outside the hierarchy
 * @param context context entries of a {@link SchemaException}, empty otherwise
 * @param rootCause message of the innermost cause, when it differs from {@code message}
 * @param timestamp when the details were captured
 */
public record ErrorDetails(
    String type,
    String message,
    SchemaErrorCode code,
    Map<String, Object> context,
    Optional<String> rootCause,
    Instant timestamp) {

  public ErrorDetails {
    context = context == null ? Map.of() : context;
    rootCause = rootCause == null ? Optional.empty() : rootCause;
  }

  /** The document or embedded class the failure was reported for. */
  public Optional<String> documentClass() {
    return Optional.ofNullable(context.get("class")).map(String::valueOf);
  }

  /** Class chain of a circular embedding, empty for other failures. */
  public List<String> embeddingPath() {
    if (context.get("path") instanceof List<?> path) {
      return path.stream().map(String::valueOf).toList();
    }
    return List.of();
  }

  /** One line such as {@code [MAPPING_ERROR] MappingException: ... (class a.B)}. */
  public String summary() {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(code).append("] ").append(type);
    if (!message.isEmpty()) {
      sb.append(": ").append(message);
    }
    documentClass().ifPresent(c -> sb.append(" (class ").append(c).append(')'));
    rootCause.ifPresent(c -> sb.append(" caused by ").append(c));
    return sb.toString();
  }
}
