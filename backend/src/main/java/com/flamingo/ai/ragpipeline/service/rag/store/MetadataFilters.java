package com.flamingo.ai.ragpipeline.service.rag.store;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link MetadataFilter}s from JSON-like maps such as {@code {"author": "kim", "page":
 * {"gte": 3, "lt": 10}}}. A nested map whose keys are all range operators becomes a {@link
 * MetadataFilter.Range}; any other value is an exact match.
 */
public final class MetadataFilters {

  private static final Set<String> RANGE_OPERATORS = Set.of("gt", "gte", "lt", "lte");

  private MetadataFilters() {}

  /** Matches every record. */
  public static MetadataFilter none() {
    return new MetadataFilter.AllOf(List.of());
  }

  public static boolean isEmpty(MetadataFilter filter) {
    return filter == null
        || (filter instanceof MetadataFilter.AllOf allOf && allOf.filters().isEmpty());
  }

  /**
   * Parses a filter map.
   *
   * @param filters filter map, may be null
   * @return the conjunction of all entries
   * @throws IllegalArgumentException if a range bound is not numeric
   */
  public static MetadataFilter fromMap(Map<String, ?> filters) {
    if (filters == null || filters.isEmpty()) {
      return none();
    }
    List<MetadataFilter> parts = new ArrayList<>();
    filters.forEach((key, value) -> parts.add(entryFilter(key, value)));
    return parts.size() == 1 ? parts.get(0) : new MetadataFilter.AllOf(parts);
  }

  /** Conjunction of two filters, either of which may be null or empty. */
  public static MetadataFilter and(MetadataFilter first, MetadataFilter second) {
    if (isEmpty(first)) {
      return second == null ? none() : second;
    }
    if (isEmpty(second)) {
      return first;
    }
    return new MetadataFilter.AllOf(List.of(first, second));
  }

  private static MetadataFilter entryFilter(String key, Object value) {
    if (value instanceof Map<?, ?> map && isRange(map)) {
      return new MetadataFilter.Range(
          key,
          bound(key, map, "gt"),
          bound(key, map, "gte"),
          bound(key, map, "lt"),
          bound(key, map, "lte"));
    }
    return new MetadataFilter.Exact(key, value);
  }

  private static boolean isRange(Map<?, ?> map) {
    if (map.isEmpty()) {
      return false;
    }
    for (Object operator : map.keySet()) {
      if (!RANGE_OPERATORS.contains(String.valueOf(operator).toLowerCase(Locale.ROOT))) {
        return false;
      }
    }
    return true;
  }

  private static Double bound(String key, Map<?, ?> map, String operator) {
    Object raw = null;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (operator.equalsIgnoreCase(String.valueOf(entry.getKey()))) {
        raw = entry.getValue();
      }
    }
    if (raw == null) {
      return null;
    }
    BigDecimal number = MetadataFilter.asNumber(raw);
    if (number == null) {
      throw new IllegalArgumentException(
          "Filter '" + key + "." + operator + "' must be numeric but was '" + raw + "'");
    }
    return number.doubleValue();
  }
}
