package com.gentoro.indexschema.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Helpers over the {@code Map}/{@code List} trees that make up mappings and analysis settings. */
public final class MappingTree {

  private MappingTree() {}

  /**
   * Returns a copy of {@code tree} without null values, empty strings, empty maps and empty lists,
   * applied bottom-up so that a map left empty by pruning is removed as well. Booleans and numbers
   * are always kept.
   */
  public static Map<String, Object> prune(Map<String, ?> tree) {
    Map<String, Object> result = new LinkedHashMap<>();
    if (tree == null) {
      return result;
    }
    tree.forEach(
        (key, value) -> {
          Object pruned = pruneValue(value);
          if (pruned != null) {
            result.put(key, pruned);
          }
        });
    return result;
  }

  private static Object pruneValue(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof String s) {
      return s.isEmpty() ? null : s;
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> pruned = prune(asStringKeyed(map));
      return pruned.isEmpty() ? null : pruned;
    }
    if (value instanceof Collection<?> collection) {
      List<Object> pruned = new ArrayList<>();
      for (Object element : collection) {
        Object p = pruneValue(element);
        if (p != null) pruned.add(p);
      }
      return pruned.isEmpty() ? null : pruned;
    }
    return value;
  }

  /**
   * Walks the whole tree, parents before children, and collects the values found under {@code
   * searchKey} at any depth. A scalar value counts as one name; a list contributes its elements.
   * Names are returned once, in the order they were first seen.
   */
  public static Set<String> collectValues(String searchKey, Object tree) {
    Set<String> result = new LinkedHashSet<>();
    collect(searchKey, tree, result);
    return result;
  }

  private static void collect(String searchKey, Object node, Set<String> result) {
    if (node instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        Object value = entry.getValue();
        if (searchKey.equals(entry.getKey())) {
          if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
              if (isScalar(element)) result.add(String.valueOf(element));
            }
          } else if (isScalar(value)) {
            result.add(String.valueOf(value));
          }
        }
        collect(searchKey, value, result);
      }
    } else if (node instanceof Collection<?> collection) {
      for (Object element : collection) {
        collect(searchKey, element, result);
      }
    }
  }

  private static boolean isScalar(Object value) {
    return value instanceof String || value instanceof Number || value instanceof Boolean;
  }

  /** Views a map read from JSON or YAML as string keyed; non-map input yields an empty map. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asStringKeyed(Object value) {
    if (value instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    return Collections.emptyMap();
  }
}
