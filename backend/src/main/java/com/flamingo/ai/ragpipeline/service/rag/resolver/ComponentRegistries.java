package com.flamingo.ai.ragpipeline.service.rag.resolver;

import com.flamingo.ai.ragpipeline.service.rag.embedding.Embedder;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ChunkExtractor;
import com.flamingo.ai.ragpipeline.service.rag.parsing.DocumentParser;
import com.flamingo.ai.ragpipeline.service.rag.rerank.PairwiseScorer;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalStrategy;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorStore;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/** The component registries of every family, plus the default routing of each parser type. */
@Getter
public class ComponentRegistries {

  private final ComponentRegistry<DocumentParser> parsers = new ComponentRegistry<>("parser");
  private final ComponentRegistry<ChunkExtractor> extractors =
      new ComponentRegistry<>("extractor");
  private final ComponentRegistry<Embedder> embedders = new ComponentRegistry<>("embedder");
  private final ComponentRegistry<VectorStore> stores = new ComponentRegistry<>("store");
  private final ComponentRegistry<RetrievalStrategy> retrievalStrategies =
      new ComponentRegistry<>("retrieval strategy");
  private final ComponentRegistry<PairwiseScorer> scorers = new ComponentRegistry<>("scorer");

  private final Map<String, ParserDefaults> parserDefaults = new HashMap<>();

  /**
   * File extensions and MIME types a parser type handles when its configuration declares none.
   *
   * @param fileExtensions extensions without dot
   * @param mimeTypes MIME types, {@code type/*} allowed
   */
  public record ParserDefaults(Set<String> fileExtensions, Set<String> mimeTypes) {}

  public ComponentRegistries parserDefaults(String type, ParserDefaults defaults) {
    parserDefaults.put(type, defaults);
    return this;
  }

  public ParserDefaults parserDefaultsFor(String type) {
    return parserDefaults.getOrDefault(type, new ParserDefaults(Set.of(), Set.of()));
  }
}
