package com.gentoro.indexschema.mapping;

import java.lang.reflect.Field;
import java.util.Map;

/**
 * Resolves the properties of a class including the ones inherited from its superclasses. A
 * property declared on a subclass shadows a superclass property with the same name.
 */
public interface PropertyCatalog {

  /**
   * Returns property name to field, own properties first, then inherited ones. The result for a
   * given class is computed once; later calls return the same map.
   */
  Map<String, Field> resolve(Class<?> type);

  /** Forgets every resolved class. */
  void reset();
}
