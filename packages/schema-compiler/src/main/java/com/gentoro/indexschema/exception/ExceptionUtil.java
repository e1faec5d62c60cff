package com.gentoro.indexschema.exception;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/** Turns exceptions into {@link ErrorDetails} and short stack summaries for the error report. */
public final class ExceptionUtil {
  static final int DEFAULT_FRAMES = 10;

  private ExceptionUtil() {}

  public static ErrorDetails toErrorDetails(Throwable t) {
    String message = t.getMessage() == null ? "" : t.getMessage();
    Optional<String> rootCause =
        Optional.ofNullable(rootCause(t).getMessage()).filter(m -> !m.equals(message));
    if (t instanceof SchemaException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          message,
          ex.getCode(),
          ex.getContext(),
          rootCause,
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        message,
        SchemaErrorCode.UNKNOWN,
        null,
        rootCause,
        Instant.now());
  }

  /** Innermost cause of {@code t}, or {@code t} itself. */
  public static Throwable rootCause(Throwable t) {
    Throwable current = t;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Top {@code maxFrames} frames of {@code t} on one line, e.g. {@code a.Foo.bar (Foo.java:42) >
   * a.App.main (App.java:10)}. A non-positive limit keeps every frame.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] frames = t.getStackTrace();
    long limit = maxFrames <= 0 ? frames.length : maxFrames;
    return Arrays.stream(frames)
        .limit(limit)
        .map(ExceptionUtil::formatFrame)
        .collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  private static String formatFrame(StackTraceElement frame) {
    String file = frame.getFileName() == null ? "Unknown Source" : frame.getFileName();
    String location = frame.getLineNumber() >= 0 ? file + ":" + frame.getLineNumber() : file;
    return frame.getClassName() + "." + frame.getMethodName() + " (" + location + ")";
  }
}
