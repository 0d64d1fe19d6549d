package com.flamingo.ai.ragpipeline.service.rag.extraction;

import com.flamingo.ai.ragpipeline.service.rag.TextAnalyzer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Extracts the top keywords of a chunk with a term frequency approximation.
 *
 * <p>Scores are log-normalised term frequency, boosted for long terms and damped for terms that
 * make up more than a tenth of the chunk. CJK terms qualify from two characters, other terms from
 * three.
 */
public class KeywordExtractor implements ChunkExtractor {

  public static final String TYPE = "KeywordExtractor";
  public static final String KEY = "keywords";

  private final int maxKeywords;
  private final int minFrequency;

  public KeywordExtractor(int maxKeywords, int minFrequency) {
    this.maxKeywords = Math.max(1, maxKeywords);
    this.minFrequency = Math.max(1, minFrequency);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Map<String, Object> extract(ExtractionContext context) {
    List<String> keywords = extractKeywords(context.text());
    return keywords.isEmpty() ? Map.of() : Map.of(KEY, keywords);
  }

  List<String> extractKeywords(String content) {
    List<String> tokens = TextAnalyzer.contentTokens(content);
    if (tokens.isEmpty()) {
      return List.of();
    }

    Map<String, Integer> tf = new HashMap<>();
    for (String token : tokens) {
      tf.merge(token, 1, Integer::sum);
    }

    Map<String, Double> scores = new HashMap<>();
    int totalTokens = tokens.size();
    for (Map.Entry<String, Integer> entry : tf.entrySet()) {
      String term = entry.getKey();
      int freq = entry.getValue();
      boolean cjk = isCjk(term);
      if (term.length() < (cjk ? 2 : 3) || freq < minFrequency) {
        continue;
      }
      double tfScore = 1 + Math.log(freq);
      double lengthBonus = term.length() >= (cjk ? 3 : 6) ? 1.2 : 1.0;
      double frequencyPenalty = (double) freq / totalTokens > 0.1 ? 0.5 : 1.0;
      scores.put(term, tfScore * lengthBonus * frequencyPenalty);
    }

    // Ties broken alphabetically so output is stable across runs
    return scores.entrySet().stream()
        .sorted(
            Map.Entry.<String, Double>comparingByValue()
                .reversed()
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(maxKeywords)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  private static boolean isCjk(String term) {
    return term.chars()
        .anyMatch(
            c -> Character.UnicodeBlock.of(c) == Character.UnicodeBlock.CJK_UNIFIED_IDEOGRAPHS);
  }
}
