package com.gentoro.gae.utility;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class CollectionUtility {
  private CollectionUtility() {}

  /** Later maps win. Null maps are skipped; insertion order is preserved. */
  @SafeVarargs
  public static <K, V> Map<K, V> mergeMaps(Map<K, V>... maps) {
    Map<K, V> result = new LinkedHashMap<>();
    if (Objects.nonNull(maps)) {
      for (Map<K, V> map : maps) {
        if (Objects.nonNull(map)) {
          result.putAll(map);
        }
      }
    }
    return result;
  }
}
