package com.flamingo.ai.ragpipeline.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkingSettings;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkingStrategy;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextChunker;
import com.flamingo.ai.ragpipeline.service.rag.embedding.HashingEmbedder;
import com.flamingo.ai.ragpipeline.service.rag.embedding.LangChain4jEmbedder;
import com.flamingo.ai.ragpipeline.service.rag.extraction.EntityExtractor;
import com.flamingo.ai.ragpipeline.service.rag.extraction.HeadingExtractor;
import com.flamingo.ai.ragpipeline.service.rag.extraction.KeywordExtractor;
import com.flamingo.ai.ragpipeline.service.rag.extraction.PatternExtractor;
import com.flamingo.ai.ragpipeline.service.rag.extraction.StatisticsExtractor;
import com.flamingo.ai.ragpipeline.service.rag.parsing.MarkdownParser;
import com.flamingo.ai.ragpipeline.service.rag.parsing.PdfParser;
import com.flamingo.ai.ragpipeline.service.rag.parsing.TextParser;
import com.flamingo.ai.ragpipeline.service.rag.parsing.TikaParser;
import com.flamingo.ai.ragpipeline.service.rag.rerank.LexicalOverlapScorer;
import com.flamingo.ai.ragpipeline.service.rag.rerank.TeiCrossEncoderScorer;
import com.flamingo.ai.ragpipeline.service.rag.rerank.TeiRerankerClient;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ComponentConfig;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ComponentRegistries;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ComponentRegistries.ParserDefaults;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.FilteredRetrieval;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.HybridRetrieval;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RerankedRetrieval;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.SemanticRetrieval;
import com.flamingo.ai.ragpipeline.service.rag.store.ElasticsearchStore;
import com.flamingo.ai.ragpipeline.service.rag.store.InMemoryStore;
import com.flamingo.ai.ragpipeline.service.rag.store.MetadataFilters;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the built-in component types under the names used in {@code rag.*} configuration.
 */
@Configuration
public class ComponentRegistrationConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String openAiBaseUrl;

  @Value("${langchain4j.ollama.base-url:http://localhost:11434}")
  private String ollamaBaseUrl;

  @Bean
  public ComponentRegistries componentRegistries(
      ObjectProvider<ElasticsearchClient> elasticsearchClient,
      CircuitBreakerRegistry circuitBreakerRegistry,
      MeterRegistry meterRegistry) {
    ComponentRegistries registries = new ComponentRegistries();
    registerParsers(registries);
    registerExtractors(registries);
    registerEmbedders(registries);
    registerStores(registries, elasticsearchClient, meterRegistry);
    registerScorers(registries, circuitBreakerRegistry);
    registerRetrievalStrategies(registries, meterRegistry);
    return registries;
  }

  private void registerParsers(ComponentRegistries registries) {
    registries
        .getParsers()
        .register(
            TextParser.TYPE,
            (name, config) ->
                new TextParser(
                    chunker(config, ChunkingStrategy.PARAGRAPHS),
                    charset(config),
                    config.getInt("block_chars", 64 * 1024)))
        .register(
            MarkdownParser.TYPE,
            (name, config) -> new MarkdownParser(chunker(config, ChunkingStrategy.PARAGRAPHS)))
        .register(
            PdfParser.TYPE,
            (name, config) ->
                new PdfParser(
                    chunker(config, ChunkingStrategy.PARAGRAPHS),
                    config.getInt("pages_per_window", 20)))
        .register(
            TikaParser.TYPE,
            (name, config) ->
                new TikaParser(
                    chunker(config, ChunkingStrategy.PARAGRAPHS),
                    config.getInt("max_characters", 10_000_000)));

    registries
        .parserDefaults(
            TextParser.TYPE,
            new ParserDefaults(
                Set.of("txt", "text", "log", "csv", "tsv"),
                Set.of("text/plain", "text/csv", "text/tab-separated-values")))
        .parserDefaults(
            MarkdownParser.TYPE,
            new ParserDefaults(
                Set.of("md", "markdown"), Set.of("text/markdown", "text/x-markdown")))
        .parserDefaults(
            PdfParser.TYPE, new ParserDefaults(Set.of("pdf"), Set.of("application/pdf")))
        .parserDefaults(
            TikaParser.TYPE,
            new ParserDefaults(
                Set.of("docx", "doc", "xlsx", "xls", "pptx", "html", "htm", "rtf", "epub", "odt"),
                Set.of(
                    "application/vnd.openxmlformats-officedocument.*",
                    "application/msword",
                    "application/vnd.ms-excel",
                    "application/vnd.oasis.opendocument.text",
                    "application/rtf",
                    "application/epub+zip",
                    "application/pdf",
                    "text/html",
                    "text/*")));
  }

  private void registerExtractors(ComponentRegistries registries) {
    registries
        .getExtractors()
        .register(
            KeywordExtractor.TYPE,
            (name, config) ->
                new KeywordExtractor(
                    config.getInt("max_keywords", 10), config.getInt("min_frequency", 1)))
        .register(
            HeadingExtractor.TYPE,
            (name, config) -> new HeadingExtractor(config.getInt("max_headings", 10)))
        .register(
            StatisticsExtractor.TYPE,
            (name, config) -> new StatisticsExtractor(config.getInt("words_per_minute", 200)))
        .register(
            EntityExtractor.TYPE,
            (name, config) ->
                new EntityExtractor(
                    config.getStringList("entity_types"), config.getInt("max_per_type", 20)))
        .register(
            PatternExtractor.TYPE,
            (name, config) ->
                new PatternExtractor(patterns(config), config.getInt("max_matches", 20)));
  }

  private void registerEmbedders(ComponentRegistries registries) {
    registries
        .getEmbedders()
        .register(
            "OpenAIEmbedder",
            (name, config) -> {
              String apiKey = config.getString("api_key", openAiApiKey);
              if (apiKey == null || apiKey.isBlank()) {
                throw new ConfigurationException(
                    name + ": OpenAI API key is required. Set the OPENAI_API_KEY variable.");
              }
              int dimension = config.getInt("dimension", 1536);
              OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
                  OpenAiEmbeddingModel.builder()
                      .apiKey(apiKey)
                      .modelName(config.getString("model", "text-embedding-3-small"))
                      .dimensions(dimension)
                      .timeout(Duration.ofSeconds(config.getInt("timeout_seconds", 30)));
              String baseUrl = config.getString("base_url", openAiBaseUrl);
              if (baseUrl != null && !baseUrl.isBlank()) {
                builder.baseUrl(baseUrl);
              }
              return new LangChain4jEmbedder(
                  "OpenAIEmbedder",
                  builder.build(),
                  dimension,
                  config.getInt("batch_size", 16),
                  config.getInt("max_chars", 5000));
            })
        .register(
            "OllamaEmbedder",
            (name, config) ->
                new LangChain4jEmbedder(
                    "OllamaEmbedder",
                    OllamaEmbeddingModel.builder()
                        .baseUrl(config.getString("base_url", ollamaBaseUrl))
                        .modelName(config.getString("model", "nomic-embed-text"))
                        .timeout(Duration.ofSeconds(config.getInt("timeout_seconds", 60)))
                        .build(),
                    config.getInt("dimension", 768),
                    config.getInt("batch_size", 16),
                    config.getInt("max_chars", 0)))
        .register(
            HashingEmbedder.TYPE,
            (name, config) ->
                new HashingEmbedder(
                    config.getInt("dimension", 384), config.getInt("batch_size", 64)));
  }

  private void registerStores(
      ComponentRegistries registries,
      ObjectProvider<ElasticsearchClient> elasticsearchClient,
      MeterRegistry meterRegistry) {
    registries
        .getStores()
        .register(
            InMemoryStore.TYPE,
            (name, config) -> new InMemoryStore(name, config.getInt("dimension", 0)))
        .register(
            ElasticsearchStore.TYPE,
            (name, config) -> {
              ElasticsearchClient client = elasticsearchClient.getIfAvailable();
              if (client == null) {
                throw new ConfigurationException(
                    name + ": no Elasticsearch client is available for " + ElasticsearchStore.TYPE);
              }
              String index = config.getString("index", "rag-" + name).toLowerCase(Locale.ROOT);
              ElasticsearchStore store =
                  new ElasticsearchStore(
                      client, meterRegistry, index, config.getInt("dimension", 0));
              store.initIndex();
              return store;
            });
  }

  private void registerScorers(
      ComponentRegistries registries, CircuitBreakerRegistry circuitBreakerRegistry) {
    registries
        .getScorers()
        .register(
            TeiCrossEncoderScorer.TYPE,
            (name, config) ->
                new TeiCrossEncoderScorer(
                    new TeiRerankerClient(
                        config.getString("base_url", "http://localhost:8081"),
                        Duration.ofMillis(config.getInt("read_timeout_ms", 5000)),
                        config.getBoolean("raw_scores", false),
                        config.getBoolean("truncate", true)),
                    circuitBreakerRegistry.circuitBreaker(TeiCrossEncoderScorer.TYPE)))
        .register(LexicalOverlapScorer.TYPE, (name, config) -> new LexicalOverlapScorer());
  }

  private void registerRetrievalStrategies(
      ComponentRegistries registries, MeterRegistry meterRegistry) {
    registries
        .getRetrievalStrategies()
        .register(SemanticRetrieval.TYPE, (name, config) -> new SemanticRetrieval(name))
        .register(
            HybridRetrieval.TYPE,
            (name, config) ->
                new HybridRetrieval(
                    name,
                    config.getDouble("dense_weight", HybridRetrieval.DEFAULT_DENSE_WEIGHT),
                    config.getDouble("sparse_weight", HybridRetrieval.DEFAULT_SPARSE_WEIGHT),
                    config.getInt("candidate_multiplier", 3)))
        .register(
            FilteredRetrieval.TYPE,
            (name, config) ->
                new FilteredRetrieval(
                    name,
                    MetadataFilters.fromMap(config.getMap("filters")),
                    config.getInt("fallback_multiplier", 1)))
        .register(
            RerankedRetrieval.TYPE,
            (name, config) -> {
              String scorerType = config.getString("reranker", LexicalOverlapScorer.TYPE);
              return new RerankedRetrieval(
                  name,
                  registries.getScorers().create(scorerType, name, config),
                  config.getInt(
                      "candidate_multiplier", RerankedRetrieval.DEFAULT_CANDIDATE_MULTIPLIER),
                  config.has("relevance_threshold")
                      ? config.getDouble("relevance_threshold", 0.0)
                      : null,
                  meterRegistry);
            });
  }

  private static TextChunker chunker(ComponentConfig config, ChunkingStrategy defaultStrategy) {
    return new TextChunker(ChunkingSettings.from(config, defaultStrategy));
  }

  private static Charset charset(ComponentConfig config) {
    String encoding = config.getString("encoding", "UTF-8");
    try {
      return Charset.forName(encoding);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      throw new ConfigurationException(config.owner() + ": unknown encoding '" + encoding + "'", e);
    }
  }

  private static Map<String, String> patterns(ComponentConfig config) {
    Map<String, String> patterns = new LinkedHashMap<>();
    config.getMap("patterns").forEach((key, value) -> patterns.put(key, String.valueOf(value)));
    return patterns;
  }
}
