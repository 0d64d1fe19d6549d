package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.exception.EmbeddingException;
import com.flamingo.ai.ragpipeline.exception.FormatUnsupportedException;
import com.flamingo.ai.ragpipeline.exception.ParseException;
import com.flamingo.ai.ragpipeline.exception.StoreException;
import com.flamingo.ai.ragpipeline.service.hash.ContentHasher;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingResult;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ChunkMetadataKeys;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ExtractionError;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ExtractorPipeline;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ParsedChunk;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ParserChain;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ParserInput;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedPipeline;
import com.flamingo.ai.ragpipeline.service.rag.routing.FormatRouter;
import com.flamingo.ai.ragpipeline.service.rag.routing.RoutingDecision;
import com.flamingo.ai.ragpipeline.service.rag.store.UpsertResult;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorRecord;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorStore;
import io.micrometer.core.annotation.Timed;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests a single file: route, parse with fallbacks, enrich, embed, store.
 *
 * <p>Never throws for problems that belong to the file itself; those become the {@link
 * FileOutcome}. Chunks whose embedding failed are left out and counted, the rest of the file is
 * still stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FileIngestionService {

  private final FormatRouter formatRouter;
  private final ParserChain parserChain;
  private final ContentHasher contentHasher;

  @Timed(value = "ingestion.file", description = "Time to ingest one file")
  public FileOutcome ingest(IngestionFile file, ResolvedPipeline pipeline, String datasetName) {
    VectorStore store = pipeline.store();
    if (store.containsDocument(file.contentHash())) {
      log.info("Skipping {}: document {} already stored", file.fileName(), file.contentHash());
      return FileOutcome.duplicate(file);
    }

    ParserInput input =
        new ParserInput(file.path(), file.fileName(), file.mimeType(), file.sizeBytes());
    RoutingDecision decision;
    try {
      decision = formatRouter.route(input, pipeline.parsers(), pipeline.directoryRules());
    } catch (FormatUnsupportedException e) {
      log.warn("Skipping {}: {}", file.fileName(), e.getMessage());
      return FileOutcome.unsupported(file, e.getMessage());
    } catch (ParseException e) {
      log.warn("Failed to read {}: {}", file.fileName(), e.getMessage());
      return FileOutcome.failed(file, null, e.getMessage());
    }

    String parser = null;
    try {
      ParserInput routed =
          decision.mimeType() != null
              ? new ParserInput(file.path(), file.fileName(), decision.mimeType(), file.sizeBytes())
              : input;
      ParserChain.Result parsed = parserChain.parse(routed, decision.candidates());
      parser = parsed.parserName();
      return store(file, pipeline, datasetName, parser, parsed.chunks());
    } catch (ParseException e) {
      log.warn("Failed to parse {}: {}", file.fileName(), e.getMessage());
      return FileOutcome.failed(file, parser, e.getMessage());
    } catch (EmbeddingException e) {
      log.error("Failed to embed {}: {}", file.fileName(), e.getMessage(), e);
      return FileOutcome.failed(file, parser, e.getMessage());
    } catch (StoreException e) {
      log.error("Failed to store {}: {}", file.fileName(), e.getMessage(), e);
      return FileOutcome.failed(file, parser, e.getMessage());
    } catch (ConfigurationException e) {
      log.error("Configuration error while ingesting {}: {}", file.fileName(), e.getMessage());
      return FileOutcome.failed(file, parser, e.getMessage());
    }
  }

  private FileOutcome store(
      IngestionFile file,
      ResolvedPipeline pipeline,
      String datasetName,
      String parser,
      List<ParsedChunk> chunks) {
    VectorStore store = pipeline.store();
    if (chunks.isEmpty()) {
      log.info("{} has no content, registering it without chunks", file.fileName());
      UpsertResult result = store.upsertDocument(file.contentHash(), List.of());
      return result == UpsertResult.ALREADY_PRESENT
          ? FileOutcome.duplicate(file)
          : FileOutcome.processed(file, parser, 0, 0, List.of());
    }

    String ingestedAt = Instant.now().toString();
    ExtractorPipeline extractors = pipeline.extractors();
    List<ExtractionError> extractionErrors = new ArrayList<>();
    List<Map<String, Object>> metadata = new ArrayList<>(chunks.size());
    List<String> texts = new ArrayList<>(chunks.size());
    for (int index = 0; index < chunks.size(); index++) {
      ParsedChunk chunk = chunks.get(index);
      Map<String, Object> base = new LinkedHashMap<>(chunk.metadata());
      base.put(ChunkMetadataKeys.DOCUMENT_HASH, file.contentHash());
      base.put(ChunkMetadataKeys.CHUNK_INDEX, index);
      base.put(ChunkMetadataKeys.TOTAL_CHUNKS, chunks.size());
      base.put(ChunkMetadataKeys.CHUNK_HASH, contentHasher.hashText(chunk.text()));
      base.put(ChunkMetadataKeys.FILENAME, file.fileName());
      base.put(ChunkMetadataKeys.PARSER, parser);
      base.put(ChunkMetadataKeys.DATASET, datasetName);
      base.put(ChunkMetadataKeys.INGESTED_AT, ingestedAt);

      ExtractorPipeline.Result enriched =
          extractors.enrich(file.fileName(), index, chunk.text(), base);
      extractionErrors.addAll(enriched.errors());
      metadata.add(enriched.metadata());
      texts.add(chunk.text());
    }

    EmbeddingResult embeddings = pipeline.embedder().embedAll(texts);
    List<VectorRecord> records = new ArrayList<>(chunks.size());
    for (int index = 0; index < chunks.size(); index++) {
      if (embeddings.isFailed(index)) {
        log.warn(
            "Dropping chunk {} of {}: {}",
            index,
            file.fileName(),
            embeddings.failures().get(index));
        continue;
      }
      Map<String, Object> chunkMetadata = metadata.get(index);
      records.add(
          new VectorRecord(
              contentHasher.chunkId(file.contentHash(), index),
              file.contentHash(),
              index,
              texts.get(index),
              (String) chunkMetadata.get(ChunkMetadataKeys.CHUNK_HASH),
              chunkMetadata,
              embeddings.vectors().get(index)));
    }

    if (records.isEmpty()) {
      return new FileOutcome(
          file.fileName(),
          file.contentHash(),
          FileStatus.FAILED,
          parser,
          chunks.size(),
          0,
          chunks.size(),
          extractionErrors,
          "Embedding failed for every chunk");
    }

    UpsertResult result = store.upsertDocument(file.contentHash(), records);
    if (result == UpsertResult.ALREADY_PRESENT) {
      log.info("{} was stored concurrently, reporting it as duplicate", file.fileName());
      return FileOutcome.duplicate(file);
    }
    log.info(
        "Ingested {} with {}: {} of {} chunks stored",
        file.fileName(),
        parser,
        records.size(),
        chunks.size());
    return FileOutcome.processed(file, parser, chunks.size(), records.size(), extractionErrors);
  }
}
