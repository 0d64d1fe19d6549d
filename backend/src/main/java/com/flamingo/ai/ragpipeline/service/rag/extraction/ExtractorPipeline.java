package com.flamingo.ai.ragpipeline.service.rag.extraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the extractors of a processing strategy over a chunk in declared order.
 *
 * <p>Output is merged according to the strategy's {@link MetadataMergePolicy}. Reserved engine
 * keys are never replaced. An extractor that throws is recorded as an {@link ExtractionError} and
 * the chunk keeps the metadata gathered before it.
 */
@Slf4j
public class ExtractorPipeline {

  private final List<ChunkExtractor> extractors;
  private final MetadataMergePolicy mergePolicy;

  public ExtractorPipeline(List<ChunkExtractor> extractors, MetadataMergePolicy mergePolicy) {
    this.extractors = List.copyOf(extractors);
    this.mergePolicy = mergePolicy == null ? MetadataMergePolicy.LAST_WRITE_WINS : mergePolicy;
  }

  public static ExtractorPipeline empty() {
    return new ExtractorPipeline(List.of(), MetadataMergePolicy.LAST_WRITE_WINS);
  }

  public List<ChunkExtractor> getExtractors() {
    return extractors;
  }

  public MetadataMergePolicy getMergePolicy() {
    return mergePolicy;
  }

  /**
   * Enriches one chunk.
   *
   * @param fileName source file name
   * @param chunkIndex index of the chunk
   * @param text chunk text
   * @param baseMetadata metadata from the parser and the engine
   * @return merged metadata and any errors raised on the way
   */
  public Result enrich(
      String fileName, int chunkIndex, String text, Map<String, Object> baseMetadata) {
    Map<String, Object> metadata = new LinkedHashMap<>(baseMetadata);
    List<ExtractionError> errors = new ArrayList<>();

    for (ChunkExtractor extractor : extractors) {
      Map<String, Object> extracted;
      try {
        extracted =
            extractor.extract(new ExtractionContext(fileName, chunkIndex, text, metadata));
      } catch (RuntimeException e) {
        log.warn(
            "Extractor {} failed on chunk {} of {}: {}",
            extractor.type(),
            chunkIndex,
            fileName,
            e.getMessage());
        errors.add(new ExtractionError(chunkIndex, extractor.type(), describe(e)));
        continue;
      }
      if (extracted != null) {
        merge(metadata, extracted, extractor.type(), chunkIndex, errors);
      }
    }
    return new Result(metadata, errors);
  }

  private void merge(
      Map<String, Object> metadata,
      Map<String, Object> extracted,
      String extractorType,
      int chunkIndex,
      List<ExtractionError> errors) {
    for (Map.Entry<String, Object> entry : extracted.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (ChunkMetadataKeys.isReserved(key)) {
        log.debug("Extractor {} tried to write reserved key '{}'", extractorType, key);
        continue;
      }
      Object existing = metadata.get(key);
      if (existing == null) {
        metadata.put(key, value);
        continue;
      }
      switch (mergePolicy) {
        case LAST_WRITE_WINS -> metadata.put(key, value);
        case KEEP_FIRST -> {
          // earlier value stays
        }
        case REJECT_CONFLICTS -> {
          if (!Objects.equals(existing, value)) {
            String message =
                "Conflicting value for '" + key + "': kept " + existing + ", rejected " + value;
            errors.add(new ExtractionError(chunkIndex, extractorType, message));
          }
        }
      }
    }
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  /**
   * Enrichment outcome of a chunk.
   *
   * @param metadata merged metadata
   * @param errors errors raised by extractors, in order
   */
  public record Result(Map<String, Object> metadata, List<ExtractionError> errors) {

    public Result {
      errors = List.copyOf(errors);
    }
  }
}
