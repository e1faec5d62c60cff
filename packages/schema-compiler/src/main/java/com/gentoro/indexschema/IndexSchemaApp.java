package com.gentoro.indexschema;

import com.gentoro.indexschema.exception.ErrorDetails;
import com.gentoro.indexschema.exception.ExceptionUtil;

public class IndexSchemaApp {

  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(IndexSchemaApp.class);

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /** Runs the application and returns the process exit code. */
  static int run(String[] args) {
    try {
      IndexSchema app = new IndexSchema(args);
      app.initialize();
      app.run(System.out);
      return 0;
    } catch (Exception e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.error(
          "IndexSchema failed {} at {}",
          details.summary(),
          ExceptionUtil.formatCompactStackTrace(e));
      if (!details.embeddingPath().isEmpty()) {
        log.error("Embedding path: {}", String.join(" -> ", details.embeddingPath()));
      } else if (!details.context().isEmpty()) {
        log.error("Error context: {}", details.context());
      }
      return 1;
    }
  }
}
