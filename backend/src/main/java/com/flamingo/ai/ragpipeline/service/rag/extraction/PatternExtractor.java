package com.flamingo.ai.ragpipeline.service.rag.extraction;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies named regular expressions from configuration. Matches of each pattern are written as a
 * list under the pattern's name; the first capturing group is used when the pattern has one.
 */
public class PatternExtractor implements ChunkExtractor {

  public static final String TYPE = "PatternExtractor";

  private final Map<String, Pattern> patterns;
  private final int maxMatches;

  public PatternExtractor(Map<String, String> namedPatterns, int maxMatches) {
    if (namedPatterns.isEmpty()) {
      throw new ConfigurationException(TYPE + " requires at least one entry under 'patterns'");
    }
    Map<String, Pattern> compiled = new LinkedHashMap<>();
    namedPatterns.forEach(
        (name, regex) -> {
          try {
            compiled.put(name, Pattern.compile(regex));
          } catch (PatternSyntaxException e) {
            throw new ConfigurationException(
                TYPE + ": pattern '" + name + "' is not a valid regular expression", e);
          }
        });
    this.patterns = compiled;
    this.maxMatches = Math.max(1, maxMatches);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Map<String, Object> extract(ExtractionContext context) {
    Map<String, Object> result = new LinkedHashMap<>();
    patterns.forEach(
        (name, pattern) -> {
          Set<String> matches = new LinkedHashSet<>();
          Matcher matcher = pattern.matcher(context.text());
          while (matcher.find() && matches.size() < maxMatches) {
            String value = matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
            if (value != null && !value.isBlank()) {
              matches.add(value.trim());
            }
          }
          if (!matches.isEmpty()) {
            result.put(name, new ArrayList<>(matches));
          }
        });
    return result;
  }
}
