package com.gentoro.indexschema.exception;

import java.util.List;
import java.util.Map;

/** An embedded class refers back to a class that is already on the current embedding path. */
public class CircularEmbeddingException extends SchemaException {
  private final List<String> path;

  public CircularEmbeddingException(List<String> path) {
    super(
        SchemaErrorCode.CIRCULAR_EMBEDDING,
        "Circular embedding detected: " + String.join(" -> ", path),
        Map.of("path", List.copyOf(path)));
    this.path = List.copyOf(path);
  }

  /** Class names from the outermost document to the class that closed the cycle. */
  public List<String> getPath() {
    return path;
  }
}
