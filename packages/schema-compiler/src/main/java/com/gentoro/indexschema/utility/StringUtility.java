package com.gentoro.indexschema.utility;

import java.util.Locale;
import java.util.regex.Pattern;

public class StringUtility {

  private static final Pattern WORD_BOUNDARY =
      Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");
  private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");

  /**
   * Converts a camel-cased or space separated identifier into snake case: {@code userName} becomes
   * {@code user_name}, {@code HTMLPage} becomes {@code html_page}.
   */
  public static String snakeCase(String input) {
    if (input == null || input.isEmpty()) return input;
    String withBoundaries = WORD_BOUNDARY.matcher(input.trim()).replaceAll("_");
    return SEPARATORS
        .matcher(withBoundaries)
        .replaceAll("_")
        .replaceAll("_+", "_") // collapse repeated underscores
        .toLowerCase(Locale.ROOT);
  }
}
