package com.gentoro.indexschema.mapping;

import java.lang.reflect.Field;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link PropertyCatalog} that walks the superclass chain through an {@link AnnotationReader}.
 *
 * <p>Resolved classes are memoized per catalog instance. The memo table is guarded by the
 * catalog's monitor; the lock is reentrant so the recursion into superclasses holds it throughout.
 */
public class ReflectivePropertyCatalog implements PropertyCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(ReflectivePropertyCatalog.class);

  private final AnnotationReader reader;
  private final Map<Class<?>, Map<String, Field>> resolved = new HashMap<>();

  public ReflectivePropertyCatalog(AnnotationReader reader) {
    this.reader = reader;
  }

  @Override
  public synchronized Map<String, Field> resolve(Class<?> type) {
    Map<String, Field> cached = resolved.get(type);
    if (cached != null) {
      return cached;
    }

    Map<String, Field> properties = new LinkedHashMap<>();
    for (Field field : reader.getDeclaredProperties(type)) {
      properties.putIfAbsent(field.getName(), field);
    }

    Class<?> parent = type.getSuperclass();
    if (parent != null && parent != Object.class) {
      resolve(parent).forEach(properties::putIfAbsent);
    }

    Map<String, Field> result = Collections.unmodifiableMap(properties);
    resolved.put(type, result);
    log.trace("Resolved {} properties for {}", result.size(), type.getName());
    return result;
  }

  @Override
  public synchronized void reset() {
    resolved.clear();
  }
}
