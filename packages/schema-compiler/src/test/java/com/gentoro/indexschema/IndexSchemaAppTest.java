package com.gentoro.indexschema;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class IndexSchemaAppTest {

  @Test
  void returnsZeroOnSuccess() {
    assertEquals(
        0,
        IndexSchemaApp.run(
            new String[] {"--config-file", "classpath:indexschema-test.yaml", "--mode", "help"}));
  }

  @Test
  void returnsOneForInvalidMode() {
    assertEquals(1, IndexSchemaApp.run(new String[] {"--mode", "serve"}));
  }

  @Test
  void returnsOneForMissingDocumentClass() {
    assertEquals(
        1,
        IndexSchemaApp.run(
            new String[] {
              "--config-file", "classpath:indexschema-test.yaml", "--document", "com.example.Nope"
            }));
  }
}
