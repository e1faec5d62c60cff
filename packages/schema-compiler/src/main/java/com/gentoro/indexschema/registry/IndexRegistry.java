package com.gentoro.indexschema.registry;

import com.gentoro.indexschema.cache.MetadataCache;
import com.gentoro.indexschema.exception.ConfigException;
import com.gentoro.indexschema.mapping.MappingTree;
import com.gentoro.indexschema.mapping.SchemaCompiler;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records which document class serves which index alias. The map is stored under {@link
 * MetadataCache#INDEXES} and read back by {@link SchemaCompiler#documentClassName(String)}.
 */
public class IndexRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(IndexRegistry.class);

  private final SchemaCompiler compiler;
  private final MetadataCache cache;

  public IndexRegistry(SchemaCompiler compiler, MetadataCache cache) {
    this.compiler = compiler;
    this.cache = cache;
  }

  /**
   * Registers every class carrying {@code @Index}; other classes are skipped with a warning. Entries
   * of this batch replace cached entries with the same alias or the same class, cached entries for
   * other aliases are kept.
   *
   * @return alias to class name for everything registered so far
   * @throws ConfigException when two classes of the batch claim the same alias or more than one of
   *     them is the default
   */
  public Map<String, String> register(Collection<Class<?>> documents) {
    Map<String, String> batch = new LinkedHashMap<>();
    String batchDefault = null;

    for (Class<?> document : documents) {
      if (compiler.indexAnnotation(document).isEmpty()) {
        log.warn("{} has no @Index annotation, skipping registration", document.getName());
        continue;
      }

      String alias = compiler.indexAlias(document);
      String claimed = batch.get(alias);
      if (claimed != null && !claimed.equals(document.getName())) {
        throw new ConfigException(
            "Index alias '%s' is claimed by both %s and %s"
                .formatted(alias, claimed, document.getName()));
      }
      batch.put(alias, document.getName());

      if (compiler.isDefaultIndex(document)) {
        if (batchDefault != null && !batchDefault.equals(document.getName())) {
          throw new ConfigException(
              "Only one default index is allowed, found %s and %s"
                  .formatted(batchDefault, document.getName()));
        }
        batchDefault = document.getName();
      }
      log.debug("Registered index '{}' for {}", alias, document.getName());
    }

    Map<String, String> indexes = new LinkedHashMap<>();
    for (Map.Entry<String, Object> cached : registeredEntries().entrySet()) {
      String className = String.valueOf(cached.getValue());
      if (batch.containsKey(cached.getKey()) || batch.containsValue(className)) {
        if (!className.equals(batch.get(cached.getKey()))) {
          log.info("Replacing registered index '{}' -> {}", cached.getKey(), className);
        }
        continue;
      }
      indexes.put(cached.getKey(), className);
    }
    indexes.putAll(batch);

    cache.save(MetadataCache.INDEXES, indexes);
    return indexes;
  }

  /**
   * The registered class flagged as default index or, when exactly one index is registered, that
   * one. Registered classes that can no longer be loaded are ignored.
   */
  public Optional<String> defaultIndexClass() {
    Map<String, Object> indexes = registeredEntries();
    for (Object className : indexes.values()) {
      Optional<Class<?>> document = load(String.valueOf(className));
      if (document.isPresent() && compiler.isDefaultIndex(document.get())) {
        return Optional.of(document.get().getName());
      }
    }
    if (indexes.size() == 1) {
      return Optional.of(String.valueOf(indexes.values().iterator().next()));
    }
    return Optional.empty();
  }

  private Map<String, Object> registeredEntries() {
    return MappingTree.asStringKeyed(cache.fetch(MetadataCache.INDEXES));
  }

  private static Optional<Class<?>> load(String className) {
    try {
      return Optional.of(
          Class.forName(className, false, Thread.currentThread().getContextClassLoader()));
    } catch (ClassNotFoundException e) {
      log.debug("Registered index class {} is not on the classpath", className);
      return Optional.empty();
    }
  }
}
