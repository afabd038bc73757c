package com.gentoro.gae.engine;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** Maps generic size names onto managed engine size ids. */
public final class EngineSizes {
  public static final String DEFAULT_SIZE = "e16";

  private static final Pattern SIZE_ID = Pattern.compile("e\\d+");
  private static final Map<String, String> NAMED =
      Map.of(
          "xsmall", "e4",
          "small", "e8",
          "medium", "e16",
          "large", "e32",
          "xlarge", "e64");

  private EngineSizes() {}

  /** {@code eN} ids pass through, known names are mapped, anything else becomes {@code e16}. */
  public static String normalize(String size) {
    if (size == null || size.isBlank()) return DEFAULT_SIZE;
    String s = size.trim().toLowerCase(Locale.ROOT);
    if (SIZE_ID.matcher(s).matches()) return s;
    return NAMED.getOrDefault(s, DEFAULT_SIZE);
  }
}
