package com.flamingo.ai.ragpipeline.service.rag.rerank;

import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the {@code /rerank} endpoint of Hugging Face Text Embeddings Inference. */
@Slf4j
public class TeiRerankerClient {

  private final WebClient webClient;
  private final Duration readTimeout;
  private final boolean rawScores;
  private final boolean truncate;

  public TeiRerankerClient(
      String baseUrl, Duration readTimeout, boolean rawScores, boolean truncate) {
    this.readTimeout = readTimeout;
    this.rawScores = rawScores;
    this.truncate = truncate;
    this.webClient =
        WebClient.builder()
            .baseUrl(baseUrl)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("TEI reranker client initialized: baseUrl={}", baseUrl);
  }

  /**
   * Scores texts against a query.
   *
   * @param query the search query
   * @param texts the candidate texts
   * @return index and score per text, ordered by score descending
   */
  public List<RerankResult> rerank(String query, List<String> texts) {
    var request = new TeiRerankRequest(query, texts, rawScores, truncate);
    return webClient
        .post()
        .uri("/rerank")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(request)
        .retrieve()
        .bodyToFlux(RerankResult.class)
        .collectList()
        .timeout(readTimeout)
        .block();
  }

  record TeiRerankRequest(String query, List<String> texts, boolean raw_scores, boolean truncate) {}

  /** TEI rerank response element. */
  public record RerankResult(int index, double score) {}
}
