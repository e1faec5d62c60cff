package com.gentoro.indexschema.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.indexschema.exception.IoException;
import com.gentoro.indexschema.exception.SerializationException;
import com.gentoro.indexschema.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link MetadataCache} persisted as a single JSON document, so that the field name tables written
 * while compiling schemas survive until the process that reads documents starts.
 *
 * <p>The whole file is rewritten on every change through a temporary sibling file that is moved
 * into place. Values must be JSON serializable; nested maps come back as {@link LinkedHashMap}.
 */
public class FileMetadataCache implements MetadataCache {
  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(FileMetadataCache.class);

  private final Path file;
  private final Map<String, Object> entries;

  public FileMetadataCache(Path file) {
    this.file = file;
    this.entries = load(file);
  }

  public Path getFile() {
    return file;
  }

  @Override
  public synchronized boolean contains(String key) {
    return entries.containsKey(key);
  }

  @Override
  public synchronized Object fetch(String key) {
    return entries.get(key);
  }

  @Override
  public synchronized boolean save(String key, Object value) {
    if (value == null) {
      return delete(key);
    }
    Map<String, Object> updated = new LinkedHashMap<>(entries);
    updated.put(key, value);
    flush(updated);
    entries.put(key, value);
    log.trace("FileMetadataCache: saved {} to {}", key, file);
    return true;
  }

  @Override
  public synchronized boolean delete(String key) {
    if (!entries.containsKey(key)) {
      return false;
    }
    Map<String, Object> updated = new LinkedHashMap<>(entries);
    updated.remove(key);
    flush(updated);
    entries.remove(key);
    return true;
  }

  /** Writes {@code snapshot} to the file; the in-memory entries change only once this succeeds. */
  private void flush(Map<String, Object> snapshot) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      Files.writeString(tmp, JacksonUtility.toJson(snapshot));
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new IoException("Failed to write metadata cache: " + file, e);
    }
  }

  private static Map<String, Object> load(Path file) {
    if (!Files.exists(file)) {
      log.debug("Metadata cache {} does not exist yet, starting empty", file);
      return new LinkedHashMap<>();
    }
    try {
      String content = Files.readString(file);
      if (content.isBlank()) {
        return new LinkedHashMap<>();
      }
      return JacksonUtility.getJsonMapper()
          .readValue(content, new TypeReference<LinkedHashMap<String, Object>>() {});
    } catch (IOException e) {
      throw new SerializationException("Failed to read metadata cache: " + file, e);
    }
  }
}
