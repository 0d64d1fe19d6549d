package com.flamingo.ai.ragpipeline.service.rag.parsing;

import java.util.Map;

/**
 * A raw chunk produced by a parser, before extraction and embedding.
 *
 * @param text the chunk text
 * @param metadata parser-local metadata such as section or page range
 */
public record ParsedChunk(String text, Map<String, Object> metadata) {

  public ParsedChunk {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static ParsedChunk of(String text) {
    return new ParsedChunk(text, Map.of());
  }
}
