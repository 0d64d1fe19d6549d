package com.flamingo.ai.ragpipeline.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Embedder} backed by a LangChain4j {@link EmbeddingModel}. Registered as {@code
 * OpenAIEmbedder} and {@code OllamaEmbedder}; the two differ only in the model they wrap.
 */
@Slf4j
public class LangChain4jEmbedder implements Embedder {

  private final String type;
  private final EmbeddingModel embeddingModel;
  private final int dimension;
  private final int batchSize;
  private final int maxChars;

  public LangChain4jEmbedder(
      String type, EmbeddingModel embeddingModel, int dimension, int batchSize, int maxChars) {
    this.type = type;
    this.embeddingModel = embeddingModel;
    this.dimension = dimension;
    this.batchSize = Math.max(1, batchSize);
    this.maxChars = maxChars;
  }

  @Override
  public String type() {
    return type;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public int batchSize() {
    return batchSize;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), i)));
    }
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<float[]> vectors = new ArrayList<>(segments.size());
    for (Embedding embedding : response.content()) {
      vectors.add(embedding.vector());
    }
    return vectors;
  }

  private String truncate(String text, int position) {
    if (maxChars <= 0 || text.length() <= maxChars) {
      return text;
    }
    log.warn(
        "Text {} too long for {}, truncating from {} chars to {} chars",
        position,
        type,
        text.length(),
        maxChars);
    return text.substring(0, maxChars);
  }
}
