package com.flamingo.ai.ragpipeline.service.rag.extraction;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds entities in a chunk with regular expressions: e-mail addresses, URLs, dates, monetary
 * amounts and capitalised multi-word names. Each entity type is written as a list under its own
 * key; {@code entity-types} restricts which types are extracted.
 */
public class EntityExtractor implements ChunkExtractor {

  public static final String TYPE = "EntityExtractor";

  static final Map<String, Pattern> ENTITY_PATTERNS = buildPatterns();

  private final Map<String, Pattern> patterns;
  private final int maxPerType;

  public EntityExtractor(List<String> entityTypes, int maxPerType) {
    this.maxPerType = Math.max(1, maxPerType);
    if (entityTypes == null || entityTypes.isEmpty()) {
      this.patterns = ENTITY_PATTERNS;
    } else {
      Map<String, Pattern> selected = new LinkedHashMap<>();
      for (String entityType : entityTypes) {
        Pattern pattern = ENTITY_PATTERNS.get(entityType);
        if (pattern == null) {
          throw new ConfigurationException(
              "Unknown entity type '" + entityType + "', expected one of "
                  + ENTITY_PATTERNS.keySet());
        }
        selected.put(entityType, pattern);
      }
      this.patterns = selected;
    }
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Map<String, Object> extract(ExtractionContext context) {
    Map<String, Object> entities = new LinkedHashMap<>();
    patterns.forEach(
        (key, pattern) -> {
          List<String> found = findAll(pattern, context.text());
          if (!found.isEmpty()) {
            entities.put(key, found);
          }
        });
    return entities;
  }

  private List<String> findAll(Pattern pattern, String text) {
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find() && found.size() < maxPerType) {
      found.add(matcher.group().trim());
    }
    return new ArrayList<>(found);
  }

  private static Map<String, Pattern> buildPatterns() {
    Map<String, Pattern> patterns = new LinkedHashMap<>();
    patterns.put("emails", Pattern.compile("[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+"));
    patterns.put("urls", Pattern.compile("https?://[^\\s<>\"')\\]]+"));
    patterns.put(
        "dates",
        Pattern.compile(
            "\\b(\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{2,4}|"
                + "(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.? "
                + "\\d{1,2},? \\d{4})\\b"));
    patterns.put(
        "monetary_amounts",
        Pattern.compile(
            "[$€£¥]\\s?\\d[\\d,]*(\\.\\d+)?"
                + "|\\b\\d[\\d,]*(\\.\\d+)?\\s?(USD|EUR|GBP)\\b"));
    patterns.put("proper_names", Pattern.compile("\\b[A-Z][a-z]+(\\s+[A-Z][a-z]+)+\\b"));
    return Collections.unmodifiableMap(patterns);
  }
}
