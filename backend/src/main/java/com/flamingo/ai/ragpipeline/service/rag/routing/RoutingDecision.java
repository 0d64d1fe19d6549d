package com.flamingo.ai.ragpipeline.service.rag.routing;

import com.flamingo.ai.ragpipeline.service.rag.parsing.ConfiguredParser;
import java.util.List;

/**
 * Outcome of routing a file.
 *
 * @param candidates eligible parsers, primary first, then the fallback chain
 * @param mimeType MIME type detected from content, null when the extension decided
 * @param matchedBy how the candidates were found
 */
public record RoutingDecision(
    List<ConfiguredParser> candidates, String mimeType, MatchedBy matchedBy) {

  /** How candidates were selected. */
  public enum MatchedBy {
    EXTENSION,
    CONTENT
  }

  public RoutingDecision {
    candidates = List.copyOf(candidates);
  }

  public ConfiguredParser primary() {
    return candidates.get(0);
  }
}
