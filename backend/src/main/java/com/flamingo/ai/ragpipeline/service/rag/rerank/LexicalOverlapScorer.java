package com.flamingo.ai.ragpipeline.service.rag.rerank;

import com.flamingo.ai.ragpipeline.service.rag.TextAnalyzer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Local scorer without a model: the fraction of distinct query terms found in the text, plus a
 * small bonus for the Jaccard similarity of the two term sets.
 */
public class LexicalOverlapScorer implements PairwiseScorer {

  public static final String TYPE = "lexical";

  private static final double JACCARD_WEIGHT = 0.2;

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public List<Double> score(String query, List<String> texts) {
    Set<String> queryTerms = TextAnalyzer.terms(query);
    List<Double> scores = new ArrayList<>(texts.size());
    for (String text : texts) {
      double overlap = TextAnalyzer.termOverlap(queryTerms, text);
      double jaccard = TextAnalyzer.jaccard(queryTerms, TextAnalyzer.terms(text));
      scores.add((1 - JACCARD_WEIGHT) * overlap + JACCARD_WEIGHT * jaccard);
    }
    return scores;
  }
}
