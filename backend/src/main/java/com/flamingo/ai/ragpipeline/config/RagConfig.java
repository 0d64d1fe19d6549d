package com.flamingo.ai.ragpipeline.config;

import com.flamingo.ai.ragpipeline.service.rag.extraction.MetadataMergePolicy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Declarative configuration of the RAG pipeline: vector databases, data processing strategies and
 * the ingestion runtime.
 *
 * <p>Component blocks carry a {@code type} resolved through the component registries and a free
 * form {@code config} map interpreted by the component factory.
 */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private List<Database> databases = new ArrayList<>();
  private List<ProcessingStrategy> dataProcessingStrategies = new ArrayList<>();
  private Ingestion ingestion = new Ingestion();
  private Retrieval retrieval = new Retrieval();
  private Storage storage = new Storage();

  /** Type name plus component specific settings. */
  @Getter
  @Setter
  public static class Component {
    private String type;
    private Map<String, Object> config = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class Database {
    private String name;
    private Component store = new Component();
    private Component embeddingStrategy = new Component();
    private List<RetrievalStrategy> retrievalStrategies = new ArrayList<>();
    private String defaultRetrievalStrategy;
  }

  @Getter
  @Setter
  public static class RetrievalStrategy {
    private String name;
    private String type;
    private Map<String, Object> config = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class ProcessingStrategy {
    private String name;
    private String description;
    private List<DirectoryRule> directoryRules = new ArrayList<>();
    private List<Parser> parsers = new ArrayList<>();
    private List<Component> extractors = new ArrayList<>();

    /** How metadata written by later extractors interacts with keys set earlier. */
    private MetadataMergePolicy metadataMergePolicy = MetadataMergePolicy.LAST_WRITE_WINS;
  }

  /** Routes files under a path glob to a subset of the strategy's parsers. */
  @Getter
  @Setter
  public static class DirectoryRule {
    private String pathPattern;
    private List<String> parsers = new ArrayList<>();
    private boolean skip;
  }

  @Getter
  @Setter
  public static class Parser {
    private String type;

    /** Optional alias used by directory rules; defaults to the type. */
    private String name;

    private int priority = 50;
    private List<String> fileExtensions = new ArrayList<>();
    private List<String> mimeTypes = new ArrayList<>();
    private List<String> fileIncludePatterns = new ArrayList<>();
    private Map<String, Object> config = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int maxConcurrentFiles = 4;
    private int taskPoolSize = 2;
    private int taskQueueCapacity = 100;
    private int retainedTasks = 500;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 5;
    private int maxTopK = 100;
  }

  @Getter
  @Setter
  public static class Storage {
    private String rawDir = "./data/raw";
  }
}
