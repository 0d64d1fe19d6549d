package com.flamingo.ai.ragpipeline.service.rag.resolver;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over the free form {@code config} block of a configured component.
 *
 * <p>Keys are matched loosely so that {@code chunk-size}, {@code chunk_size} and {@code chunkSize}
 * address the same setting. Values bound from YAML arrive as strings, so typed accessors parse
 * them and report bad values as {@link ConfigurationException}.
 */
public final class ComponentConfig {

  private static final ComponentConfig EMPTY = new ComponentConfig("component", Map.of());

  private final String owner;
  private final Map<String, Object> values;

  private ComponentConfig(String owner, Map<String, Object> raw) {
    this.owner = owner;
    Map<String, Object> normalized = new LinkedHashMap<>();
    if (raw != null) {
      raw.forEach((key, value) -> normalized.put(canonical(key), value));
    }
    this.values = Collections.unmodifiableMap(normalized);
  }

  public static ComponentConfig of(String owner, Map<String, Object> raw) {
    return new ComponentConfig(owner, raw);
  }

  public static ComponentConfig empty() {
    return EMPTY;
  }

  public boolean has(String key) {
    return values.containsKey(canonical(key));
  }

  public Optional<Object> get(String key) {
    return Optional.ofNullable(values.get(canonical(key)));
  }

  public String getString(String key, String defaultValue) {
    return get(key).map(Object::toString).orElse(defaultValue);
  }

  public int getInt(String key, int defaultValue) {
    Object value = values.get(canonical(key));
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          owner + ": '" + key + "' must be an integer but was '" + value + "'", e);
    }
  }

  public double getDouble(String key, double defaultValue) {
    Object value = values.get(canonical(key));
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          owner + ": '" + key + "' must be a number but was '" + value + "'", e);
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    Object value = values.get(canonical(key));
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    return Boolean.parseBoolean(value.toString().trim());
  }

  /**
   * Reads a list setting. Accepts real lists, index-keyed maps (how Spring binds YAML sequences
   * nested in a map) and comma-separated strings.
   */
  public List<String> getStringList(String key) {
    Object value = values.get(canonical(key));
    if (value == null) {
      return List.of();
    }
    Collection<?> items;
    if (value instanceof Collection<?> collection) {
      items = collection;
    } else if (value instanceof Map<?, ?> map) {
      items = map.values();
    } else {
      items = List.of(value.toString().split(","));
    }
    List<String> result = new ArrayList<>();
    for (Object item : items) {
      String text = item == null ? "" : item.toString().trim();
      if (!text.isEmpty()) {
        result.add(text);
      }
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> getMap(String key) {
    Object value = values.get(canonical(key));
    if (value == null) {
      return Map.of();
    }
    if (value instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    throw new ConfigurationException(owner + ": '" + key + "' must be a mapping");
  }

  public String owner() {
    return owner;
  }

  public Map<String, Object> asMap() {
    return values;
  }

  static String canonical(String key) {
    return key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return owner + values;
  }
}
