package com.flamingo.ai.ragpipeline.service.rag.parsing;

import java.util.List;

/**
 * Result of trying one parser of a fallback chain: either chunks or the failure reason.
 *
 * @param parserName the parser that was tried
 * @param chunks chunks produced, empty on failure
 * @param error failure cause, null on success
 */
public record ParseAttempt(String parserName, List<ParsedChunk> chunks, Exception error) {

  public static ParseAttempt success(String parserName, List<ParsedChunk> chunks) {
    return new ParseAttempt(parserName, List.copyOf(chunks), null);
  }

  public static ParseAttempt failure(String parserName, Exception error) {
    return new ParseAttempt(parserName, List.of(), error);
  }

  public boolean succeeded() {
    return error == null && !chunks.isEmpty();
  }

  public String describeFailure() {
    if (error != null) {
      return parserName + ": " + error.getMessage();
    }
    return parserName + ": produced no chunks";
  }
}
