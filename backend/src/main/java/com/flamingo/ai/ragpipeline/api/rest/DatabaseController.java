package com.flamingo.ai.ragpipeline.api.rest;

import com.flamingo.ai.ragpipeline.api.dto.request.QueryRequest;
import com.flamingo.ai.ragpipeline.api.dto.response.DatabaseResponse;
import com.flamingo.ai.ragpipeline.api.dto.response.DatabaseStatsResponse;
import com.flamingo.ai.ragpipeline.api.dto.response.DocumentChunksResponse;
import com.flamingo.ai.ragpipeline.api.dto.response.DocumentListResponse;
import com.flamingo.ai.ragpipeline.api.dto.response.QueryResultResponse;
import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.service.database.DatabaseInspectionService;
import com.flamingo.ai.ragpipeline.service.query.QueryCommand;
import com.flamingo.ai.ragpipeline.service.query.QueryService;
import com.flamingo.ai.ragpipeline.service.rag.resolver.StrategyResolver;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for configured databases and retrieval queries. */
@RestController
@RequestMapping("/api/databases")
@RequiredArgsConstructor
public class DatabaseController {

  private final RagConfig ragConfig;
  private final StrategyResolver strategyResolver;
  private final QueryService queryService;
  private final DatabaseInspectionService inspectionService;

  /** Lists the configured databases as declared, without connecting to their backends. */
  @GetMapping
  public ResponseEntity<List<DatabaseResponse>> listDatabases() {
    return ResponseEntity.ok(
        ragConfig.getDatabases().stream().map(DatabaseResponse::fromConfig).toList());
  }

  /** Resolves a database, validating its configuration. */
  @GetMapping("/{database}")
  public ResponseEntity<DatabaseResponse> getDatabase(@PathVariable String database) {
    return ResponseEntity.ok(
        DatabaseResponse.fromResolved(strategyResolver.resolveDatabase(database)));
  }

  /** Counts the vectors and documents a database holds. */
  @GetMapping("/{database}/stats")
  public ResponseEntity<DatabaseStatsResponse> getStats(@PathVariable String database) {
    return ResponseEntity.ok(DatabaseStatsResponse.from(inspectionService.stats(database)));
  }

  /** Lists stored documents, ordered by file name. */
  @GetMapping("/{database}/documents")
  public ResponseEntity<DocumentListResponse> listDocuments(
      @PathVariable String database,
      @RequestParam(value = "limit", defaultValue = "100") int limit,
      @RequestParam(value = "offset", defaultValue = "0") int offset) {
    return ResponseEntity.ok(
        DocumentListResponse.from(inspectionService.listDocuments(database, limit, offset)));
  }

  /** Previews the first chunks of a stored document. */
  @GetMapping("/{database}/documents/{documentHash}/chunks")
  public ResponseEntity<DocumentChunksResponse> getDocumentChunks(
      @PathVariable String database,
      @PathVariable String documentHash,
      @RequestParam(value = "limit", defaultValue = "20") int limit) {
    return ResponseEntity.ok(
        DocumentChunksResponse.from(
            inspectionService.documentChunks(database, documentHash, limit)));
  }

  /** Runs a retrieval query. No match is a 200 with an empty result list. */
  @PostMapping("/{database}/query")
  public ResponseEntity<QueryResultResponse> query(
      @PathVariable String database, @Valid @RequestBody QueryRequest request) {
    QueryCommand command =
        new QueryCommand(
            request.getQuery(),
            request.getRetrievalStrategy(),
            request.getTopK(),
            request.getFilters(),
            request.getScoreThreshold());
    return ResponseEntity.ok(QueryResultResponse.from(queryService.query(database, command)));
  }
}
