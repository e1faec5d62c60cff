package com.gentoro.indexschema.cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local {@link MetadataCache}; contents are lost when the JVM exits. */
public class InMemoryMetadataCache implements MetadataCache {
  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(InMemoryMetadataCache.class);
  private final Map<String, Object> entries = new ConcurrentHashMap<>();

  @Override
  public boolean contains(String key) {
    return entries.containsKey(key);
  }

  @Override
  public Object fetch(String key) {
    try {
      return entries.get(key);
    } finally {
      log.trace("MetadataCache: fetch {}", key);
    }
  }

  @Override
  public boolean save(String key, Object value) {
    if (value == null) {
      return delete(key);
    }
    entries.put(key, value);
    log.trace("MetadataCache: save {}", key);
    return true;
  }

  @Override
  public boolean delete(String key) {
    log.trace("MetadataCache: delete {}", key);
    return entries.remove(key) != null;
  }

  public void clear() {
    entries.clear();
    log.trace("MetadataCache: clear");
  }
}
