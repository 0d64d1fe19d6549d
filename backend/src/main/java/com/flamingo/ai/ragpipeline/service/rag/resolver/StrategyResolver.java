package com.flamingo.ai.ragpipeline.service.rag.resolver;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.exception.DatabaseNotFoundException;
import com.flamingo.ai.ragpipeline.service.rag.embedding.Embedder;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingExecutor;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ChunkExtractor;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ExtractorPipeline;
import com.flamingo.ai.ragpipeline.service.rag.extraction.MetadataMergePolicy;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ConfiguredParser;
import com.flamingo.ai.ragpipeline.service.rag.parsing.DocumentParser;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ComponentRegistries.ParserDefaults;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalStrategy;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.SemanticRetrieval;
import com.flamingo.ai.ragpipeline.service.rag.routing.DirectoryRoute;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorStore;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.nio.file.FileSystems;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.PatternSyntaxException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns {@code rag.*} configuration into live pipelines.
 *
 * <p>Databases are resolved once and shared, so every processing strategy writing to a database
 * uses the same store instance. Pipelines are cached per (strategy, database) pair. All validation
 * happens here, before any file is read.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StrategyResolver {

  static final String IMPLICIT_STRATEGY_NAME = "semantic";
  private static final String DIMENSION = "dimension";
  private static final String EMBEDDING_DIMENSION = "embedding_dimension";

  private final RagConfig ragConfig;
  private final ComponentRegistries registries;
  private final RetryRegistry retryRegistry;
  private final CircuitBreakerRegistry circuitBreakerRegistry;
  private final MeterRegistry meterRegistry;

  private final Map<String, ResolvedDatabase> databases = new ConcurrentHashMap<>();
  private final Map<String, ResolvedPipeline> pipelines = new ConcurrentHashMap<>();

  /**
   * Resolves the write path of a processing strategy against a database.
   *
   * @throws ConfigurationException if either name is unknown or any component is misconfigured
   */
  public ResolvedPipeline resolvePipeline(String strategyName, String databaseName) {
    RagConfig.ProcessingStrategy strategy =
        findStrategy(strategyName)
            .orElseThrow(
                () ->
                    new ConfigurationException(
                        "Unknown data processing strategy '"
                            + strategyName
                            + "'. Available: "
                            + processingStrategyNames()));
    if (findDatabase(databaseName).isEmpty()) {
      throw new ConfigurationException(
          "Unknown database '" + databaseName + "'. Available: " + databaseNames());
    }
    return pipelines.computeIfAbsent(
        strategyName + "::" + databaseName,
        key -> buildPipeline(strategy, resolveDatabase(databaseName)));
  }

  /**
   * Resolves a database with its embedder, store and retrieval strategies.
   *
   * @throws DatabaseNotFoundException if the database is not configured
   * @throws ConfigurationException if the database is misconfigured
   */
  public ResolvedDatabase resolveDatabase(String databaseName) {
    RagConfig.Database database =
        findDatabase(databaseName).orElseThrow(() -> new DatabaseNotFoundException(databaseName));
    return databases.computeIfAbsent(databaseName, key -> buildDatabase(database));
  }

  public List<String> databaseNames() {
    return ragConfig.getDatabases().stream().map(RagConfig.Database::getName).toList();
  }

  public List<String> processingStrategyNames() {
    return ragConfig.getDataProcessingStrategies().stream()
        .map(RagConfig.ProcessingStrategy::getName)
        .toList();
  }

  /** Drops every cached pipeline and database; the next call rebuilds them from configuration. */
  public void evict() {
    pipelines.clear();
    databases.clear();
    log.info("Evicted resolved pipelines and databases");
  }

  @PreDestroy
  public void shutdown() {
    for (ResolvedDatabase database : databases.values()) {
      try {
        database.store().close();
      } catch (RuntimeException e) {
        log.warn("Failed to close store of database '{}': {}", database.name(), e.getMessage());
      }
    }
    evict();
  }

  private ResolvedPipeline buildPipeline(
      RagConfig.ProcessingStrategy strategy, ResolvedDatabase database) {
    String strategyName = strategy.getName();
    List<ConfiguredParser> parsers = buildParsers(strategy);
    List<DirectoryRoute> rules = buildDirectoryRules(strategy, parsers);

    List<ChunkExtractor> extractors = new ArrayList<>();
    for (RagConfig.Component component : strategy.getExtractors()) {
      String type = requireType(component.getType(), strategyName + " extractor");
      ComponentConfig config = ComponentConfig.of(strategyName + "." + type, component.getConfig());
      extractors.add(registries.getExtractors().create(type, type, config));
    }
    MetadataMergePolicy mergePolicy =
        strategy.getMetadataMergePolicy() != null
            ? strategy.getMetadataMergePolicy()
            : MetadataMergePolicy.LAST_WRITE_WINS;

    log.info(
        "Resolved pipeline '{}' -> '{}': parsers={}, extractors={}, merge policy={}",
        strategyName,
        database.name(),
        parsers.stream().map(ConfiguredParser::name).toList(),
        extractors.stream().map(ChunkExtractor::type).toList(),
        mergePolicy);
    return new ResolvedPipeline(
        strategyName, parsers, rules, new ExtractorPipeline(extractors, mergePolicy), database);
  }

  private List<ConfiguredParser> buildParsers(RagConfig.ProcessingStrategy strategy) {
    String strategyName = strategy.getName();
    if (strategy.getParsers().isEmpty()) {
      throw new ConfigurationException(
          "Data processing strategy '" + strategyName + "' declares no parsers");
    }
    List<ConfiguredParser> parsers = new ArrayList<>();
    int order = 0;
    for (RagConfig.Parser parser : strategy.getParsers()) {
      String type = requireType(parser.getType(), strategyName + " parser");
      String name =
          parser.getName() == null || parser.getName().isBlank() ? type : parser.getName();
      ComponentConfig config = ComponentConfig.of(strategyName + "." + name, parser.getConfig());
      DocumentParser instance = registries.getParsers().create(type, name, config);

      ParserDefaults defaults = registries.parserDefaultsFor(type);
      Set<String> extensions =
          parser.getFileExtensions().isEmpty()
              ? defaults.fileExtensions()
              : new LinkedHashSet<>(parser.getFileExtensions());
      Set<String> mimeTypes =
          parser.getMimeTypes().isEmpty()
              ? defaults.mimeTypes()
              : new LinkedHashSet<>(parser.getMimeTypes());
      for (String pattern : parser.getFileIncludePatterns()) {
        validateGlob(pattern, strategyName + "." + name + " file-include-patterns");
      }
      parsers.add(
          new ConfiguredParser(
              name,
              instance,
              parser.getPriority(),
              order++,
              extensions,
              mimeTypes,
              parser.getFileIncludePatterns()));
    }
    return parsers;
  }

  private List<DirectoryRoute> buildDirectoryRules(
      RagConfig.ProcessingStrategy strategy, List<ConfiguredParser> parsers) {
    List<DirectoryRoute> rules = new ArrayList<>();
    for (RagConfig.DirectoryRule rule : strategy.getDirectoryRules()) {
      String owner = strategy.getName() + " directory rule '" + rule.getPathPattern() + "'";
      if (rule.getPathPattern() == null || rule.getPathPattern().isBlank()) {
        throw new ConfigurationException(strategy.getName() + ": directory rule without path");
      }
      validateGlob(rule.getPathPattern(), owner);
      if (!rule.isSkip() && rule.getParsers().isEmpty()) {
        throw new ConfigurationException(owner + ": names no parsers and does not skip");
      }
      for (String reference : rule.getParsers()) {
        if (parsers.stream().noneMatch(parser -> parser.isNamed(reference))) {
          throw new ConfigurationException(
              owner + ": references unknown parser '" + reference + "'");
        }
      }
      rules.add(new DirectoryRoute(rule.getPathPattern(), rule.getParsers(), rule.isSkip()));
    }
    return rules;
  }

  private ResolvedDatabase buildDatabase(RagConfig.Database database) {
    String name = database.getName();
    RagConfig.Component embedding = database.getEmbeddingStrategy();
    String embedderType = requireType(embedding.getType(), name + " embedding-strategy");
    ComponentConfig embedderConfig = ComponentConfig.of(name + ".embedding", embedding.getConfig());
    Embedder embedder = registries.getEmbedders().create(embedderType, name, embedderConfig);
    EmbeddingExecutor executor =
        new EmbeddingExecutor(
            name, embedder, retryRegistry, circuitBreakerRegistry, meterRegistry);

    VectorStore store = buildStore(database, embedder.dimension());
    try {
      Map<String, RetrievalStrategy> strategies = buildRetrievalStrategies(database, embedder);
      String defaultStrategy = defaultStrategy(database, strategies);
      log.info(
          "Resolved database '{}': store={}, embedder={} ({} dims), strategies={}, default={}",
          name,
          store.type(),
          embedder.type(),
          embedder.dimension(),
          strategies.keySet(),
          defaultStrategy);
      return new ResolvedDatabase(name, executor, store, strategies, defaultStrategy);
    } catch (RuntimeException e) {
      store.close();
      throw e;
    }
  }

  private VectorStore buildStore(RagConfig.Database database, int embedderDimension) {
    String name = database.getName();
    RagConfig.Component storeConfig = database.getStore();
    String type = requireType(storeConfig.getType(), name + " store");
    ComponentConfig config = ComponentConfig.of(name + ".store", storeConfig.getConfig());
    if (config.has(DIMENSION) && config.getInt(DIMENSION, 0) != embedderDimension) {
      throw new ConfigurationException(
          String.format(
              "Database '%s': store dimension %d does not match embedder dimension %d",
              name, config.getInt(DIMENSION, 0), embedderDimension));
    }
    Map<String, Object> values = new LinkedHashMap<>(config.asMap());
    values.put(DIMENSION, embedderDimension);
    VectorStore store =
        registries.getStores().create(type, name, ComponentConfig.of(name + ".store", values));
    if (store.dimension() != embedderDimension) {
      store.close();
      throw new ConfigurationException(
          String.format(
              "Database '%s': store dimension %d does not match embedder dimension %d",
              name, store.dimension(), embedderDimension));
    }
    return store;
  }

  private Map<String, RetrievalStrategy> buildRetrievalStrategies(
      RagConfig.Database database, Embedder embedder) {
    String name = database.getName();
    Map<String, RetrievalStrategy> strategies = new LinkedHashMap<>();
    if (database.getRetrievalStrategies().isEmpty()) {
      strategies.put(IMPLICIT_STRATEGY_NAME, new SemanticRetrieval(IMPLICIT_STRATEGY_NAME));
      return strategies;
    }
    Set<String> seen = new HashSet<>();
    for (RagConfig.RetrievalStrategy strategy : database.getRetrievalStrategies()) {
      String type = requireType(strategy.getType(), name + " retrieval strategy");
      String strategyName =
          strategy.getName() == null || strategy.getName().isBlank() ? type : strategy.getName();
      if (!seen.add(strategyName)) {
        throw new ConfigurationException(
            "Database '" + name + "': duplicate retrieval strategy '" + strategyName + "'");
      }
      ComponentConfig config =
          ComponentConfig.of(name + "." + strategyName, strategy.getConfig());
      if (config.has(EMBEDDING_DIMENSION)
          && config.getInt(EMBEDDING_DIMENSION, 0) != embedder.dimension()) {
        throw new ConfigurationException(
            String.format(
                "Retrieval strategy '%s' expects %d dimensions but database '%s' embeds with %d",
                strategyName, config.getInt(EMBEDDING_DIMENSION, 0), name, embedder.dimension()));
      }
      strategies.put(
          strategyName, registries.getRetrievalStrategies().create(type, strategyName, config));
    }
    return strategies;
  }

  private static String defaultStrategy(
      RagConfig.Database database, Map<String, RetrievalStrategy> strategies) {
    String configured = database.getDefaultRetrievalStrategy();
    if (configured != null && !configured.isBlank()) {
      if (!strategies.containsKey(configured)) {
        throw new ConfigurationException(
            String.format(
                "Database '%s': default retrieval strategy '%s' is not configured. Available: %s",
                database.getName(), configured, strategies.keySet()));
      }
      return configured;
    }
    return strategies.values().stream()
        .filter(strategy -> !strategy.isReranker())
        .map(RetrievalStrategy::name)
        .findFirst()
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "Database '"
                        + database.getName()
                        + "': every retrieval strategy is a reranker, set"
                        + " default-retrieval-strategy explicitly"));
  }

  private Optional<RagConfig.ProcessingStrategy> findStrategy(String strategyName) {
    return ragConfig.getDataProcessingStrategies().stream()
        .filter(strategy -> Objects.equals(strategy.getName(), strategyName))
        .findFirst();
  }

  private Optional<RagConfig.Database> findDatabase(String databaseName) {
    return ragConfig.getDatabases().stream()
        .filter(database -> Objects.equals(database.getName(), databaseName))
        .findFirst();
  }

  private static String requireType(String type, String owner) {
    if (type == null || type.isBlank()) {
      throw new ConfigurationException(owner + ": type is required");
    }
    return type;
  }

  private static void validateGlob(String pattern, String owner) {
    try {
      FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    } catch (PatternSyntaxException e) {
      throw new ConfigurationException(owner + ": invalid glob '" + pattern + "'", e);
    }
  }
}
