package com.flamingo.ai.ragpipeline.service.rag.store;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Predicate over chunk metadata.
 *
 * <p>Numbers compare by value across types and against numeric strings. An exact match on a key
 * holding a list matches when any element is equal; an exact match with a list value matches when
 * the metadata value is one of its elements.
 */
public interface MetadataFilter {

  boolean matches(Map<String, Object> metadata);

  /** Key equals value. */
  record Exact(String key, Object value) implements MetadataFilter {

    @Override
    public boolean matches(Map<String, Object> metadata) {
      Object actual = metadata.get(key);
      if (actual == null) {
        return false;
      }
      if (value instanceof Collection<?> accepted) {
        return accepted.stream().anyMatch(candidate -> valueMatches(actual, candidate));
      }
      return valueMatches(actual, value);
    }

    private static boolean valueMatches(Object actual, Object expected) {
      if (actual instanceof Collection<?> values) {
        return values.stream().anyMatch(element -> sameValue(element, expected));
      }
      return sameValue(actual, expected);
    }
  }

  /** Numeric range on a key; null bounds are open. */
  record Range(String key, Double gt, Double gte, Double lt, Double lte)
      implements MetadataFilter {

    @Override
    public boolean matches(Map<String, Object> metadata) {
      BigDecimal actual = asNumber(metadata.get(key));
      if (actual == null) {
        return false;
      }
      double value = actual.doubleValue();
      return (gt == null || value > gt)
          && (gte == null || value >= gte)
          && (lt == null || value < lt)
          && (lte == null || value <= lte);
    }
  }

  /** Conjunction; an empty conjunction matches everything. */
  record AllOf(List<MetadataFilter> filters) implements MetadataFilter {

    public AllOf {
      filters = List.copyOf(filters);
    }

    @Override
    public boolean matches(Map<String, Object> metadata) {
      return filters.stream().allMatch(filter -> filter.matches(metadata));
    }
  }

  static boolean sameValue(Object left, Object right) {
    if (left == null || right == null) {
      return left == right;
    }
    BigDecimal leftNumber = asNumber(left);
    BigDecimal rightNumber = asNumber(right);
    if (leftNumber != null
        && rightNumber != null
        && (left instanceof Number || right instanceof Number)) {
      return leftNumber.compareTo(rightNumber) == 0;
    }
    if (left instanceof Number || right instanceof Number) {
      return false;
    }
    return Objects.equals(left.toString(), right.toString());
  }

  static BigDecimal asNumber(Object value) {
    if (value instanceof Number number) {
      return Double.isFinite(number.doubleValue()) ? new BigDecimal(number.toString()) : null;
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return new BigDecimal(text.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}
