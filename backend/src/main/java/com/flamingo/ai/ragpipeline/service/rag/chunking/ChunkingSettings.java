package com.flamingo.ai.ragpipeline.service.rag.chunking;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ComponentConfig;
import java.util.Locale;

/**
 * Chunk sizing of a parser, in characters.
 *
 * @param strategy the chunking strategy
 * @param chunkSize maximum chunk length
 * @param chunkOverlap characters carried over from the previous chunk, below {@code chunkSize}
 * @param semanticThreshold adjacent-sentence similarity under which {@link
 *     ChunkingStrategy#SEMANTIC} starts a new chunk
 */
public record ChunkingSettings(
    ChunkingStrategy strategy, int chunkSize, int chunkOverlap, double semanticThreshold) {

  public static final int DEFAULT_CHUNK_SIZE = 1000;
  public static final int DEFAULT_CHUNK_OVERLAP = 100;
  public static final double DEFAULT_SEMANTIC_THRESHOLD = 0.15;

  public ChunkingSettings {
    if (strategy == null) {
      throw new ConfigurationException("chunk strategy is required");
    }
    if (chunkSize <= 0) {
      throw new ConfigurationException("chunk_size must be positive but was " + chunkSize);
    }
    if (chunkOverlap < 0) {
      throw new ConfigurationException("chunk_overlap must not be negative");
    }
    if (chunkOverlap >= chunkSize) {
      throw new ConfigurationException(
          "chunk_overlap ("
              + chunkOverlap
              + ") must be strictly less than chunk_size ("
              + chunkSize
              + ")");
    }
  }

  public static ChunkingSettings defaults(ChunkingStrategy strategy) {
    return new ChunkingSettings(
        strategy, DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP, DEFAULT_SEMANTIC_THRESHOLD);
  }

  /** Reads and validates chunk settings from a parser config block. */
  public static ChunkingSettings from(ComponentConfig config, ChunkingStrategy defaultStrategy) {
    String strategyName = config.getString("chunk_strategy", defaultStrategy.name());
    ChunkingStrategy strategy;
    try {
      strategy = ChunkingStrategy.valueOf(strategyName.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(
          config.owner() + ": unknown chunk_strategy '" + strategyName + "'", e);
    }
    try {
      return new ChunkingSettings(
          strategy,
          config.getInt("chunk_size", DEFAULT_CHUNK_SIZE),
          config.getInt("chunk_overlap", DEFAULT_CHUNK_OVERLAP),
          config.getDouble("semantic_threshold", DEFAULT_SEMANTIC_THRESHOLD));
    } catch (ConfigurationException e) {
      throw new ConfigurationException(config.owner() + ": " + e.getMessage(), e);
    }
  }
}
