package com.gentoro.indexschema.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void keepsCodeAndContextOfSchemaExceptions() {
    MappingException error =
        new MappingException("bad settings", Map.of("class", "a.B", "property", "title"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(error);

    assertEquals("MappingException", details.type());
    assertEquals(SchemaErrorCode.MAPPING_ERROR, details.code());
    assertEquals("title", details.context().get("property"));
    assertEquals(Optional.of("a.B"), details.documentClass());
    assertEquals("[MAPPING_ERROR] MappingException: bad settings (class a.B)", details.summary());
  }

  @Test
  void otherThrowablesAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals(SchemaErrorCode.UNKNOWN, details.code());
    assertEquals("", details.message());
    assertTrue(details.context().isEmpty());
    assertEquals(Optional.empty(), details.rootCause());
    assertEquals("[UNKNOWN] IllegalStateException", details.summary());
  }

  @Test
  @DisplayName("the innermost cause is reported when its message differs")
  void rootCauseIsReported() {
    IoException error =
        new IoException("Failed to write output: out.json", new IOException("disk full"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(error);

    assertEquals(Optional.of("disk full"), details.rootCause());
    assertTrue(details.summary().endsWith("caused by disk full"));
  }

  @Test
  void circularEmbeddingExposesPath() {
    CircularEmbeddingException error =
        new CircularEmbeddingException(List.of("a.Left", "a.Right", "a.Left"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(error);

    assertEquals(SchemaErrorCode.CIRCULAR_EMBEDDING, details.code());
    assertEquals(List.of("a.Left", "a.Right", "a.Left"), error.getPath());
    assertEquals(error.getPath(), details.embeddingPath());
    assertEquals(Optional.empty(), details.documentClass());
  }

  @Test
  void compactStackTraceHonoursFrameLimit() {
    Exception error = new Exception("boom");

    String trace = ExceptionUtil.formatCompactStackTrace(error, 2);

    assertEquals(1, trace.split(" > ").length - 1);
    assertTrue(
        trace.startsWith(
            ExceptionUtilTest.class.getName() + ".compactStackTraceHonoursFrameLimit ("));
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }
}
