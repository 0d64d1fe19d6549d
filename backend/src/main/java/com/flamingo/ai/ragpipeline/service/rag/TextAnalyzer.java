package com.flamingo.ai.ragpipeline.service.rag;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical helpers shared by chunking, keyword extraction, sparse scoring and the hashing
 * embedder. Tokens are lower-cased Unicode letter/number runs of at least two characters.
 */
public final class TextAnalyzer {

  // Common English stop words
  public static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even");

  private TextAnalyzer() {}

  /** Splits text into lower-cased tokens, keeping stop words. */
  public static List<String> tokenize(String text) {
    if (text == null || text.isEmpty()) {
      return new ArrayList<>();
    }
    // \p{L} = any Unicode letter, \p{N} = any Unicode number
    String[] words = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+");
    List<String> tokens = new ArrayList<>(words.length);
    for (String word : words) {
      String cleaned = word.replaceAll("^'+|'+$", "");
      if (cleaned.length() >= 2) {
        tokens.add(cleaned);
      }
    }
    return tokens;
  }

  /** Tokens without stop words, in order of appearance. */
  public static List<String> contentTokens(String text) {
    List<String> tokens = tokenize(text);
    tokens.removeIf(STOP_WORDS::contains);
    return tokens;
  }

  /** Distinct content terms in order of first appearance. */
  public static Set<String> terms(String text) {
    return new LinkedHashSet<>(contentTokens(text));
  }

  /** Jaccard similarity of two term sets; 0 when both are empty. */
  public static double jaccard(Set<String> left, Set<String> right) {
    if (left.isEmpty() && right.isEmpty()) {
      return 0.0;
    }
    int intersection = 0;
    for (String term : left) {
      if (right.contains(term)) {
        intersection++;
      }
    }
    int union = left.size() + right.size() - intersection;
    return union == 0 ? 0.0 : (double) intersection / union;
  }

  /**
   * Fraction of distinct query terms that occur in the text, in [0, 1].
   *
   * @param queryTerms distinct query terms
   * @param text candidate text
   * @return the term overlap ratio
   */
  public static double termOverlap(Set<String> queryTerms, String text) {
    if (queryTerms.isEmpty() || text == null || text.isEmpty()) {
      return 0.0;
    }
    Set<String> textTerms = new LinkedHashSet<>(tokenize(text));
    long matched = queryTerms.stream().filter(textTerms::contains).count();
    return (double) matched / queryTerms.size();
  }
}
