package com.flamingo.ai.ragpipeline.api.rest;

import com.flamingo.ai.ragpipeline.api.dto.request.CreateDatasetRequest;
import com.flamingo.ai.ragpipeline.api.dto.response.DatasetDocumentResponse;
import com.flamingo.ai.ragpipeline.api.dto.response.DatasetResponse;
import com.flamingo.ai.ragpipeline.api.dto.response.TaskResponse;
import com.flamingo.ai.ragpipeline.api.dto.response.UploadResponse;
import com.flamingo.ai.ragpipeline.domain.entity.Dataset;
import com.flamingo.ai.ragpipeline.service.dataset.DatasetService;
import com.flamingo.ai.ragpipeline.service.dataset.UploadResult;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTask;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for the dataset lifecycle. */
@RestController
@RequestMapping("/api/datasets")
@RequiredArgsConstructor
public class DatasetController {

  private final DatasetService datasetService;

  /** Creates a dataset bound to a processing strategy and a database. */
  @PostMapping
  public ResponseEntity<DatasetResponse> createDataset(
      @Valid @RequestBody CreateDatasetRequest request) {
    Dataset dataset =
        datasetService.createDataset(
            request.getName(),
            request.getDescription(),
            request.getProcessingStrategy(),
            request.getDatabase());
    return ResponseEntity.status(HttpStatus.CREATED).body(DatasetResponse.fromEntity(dataset));
  }

  @GetMapping
  public ResponseEntity<List<DatasetResponse>> listDatasets() {
    return ResponseEntity.ok(
        datasetService.listDatasets().stream().map(DatasetResponse::fromEntity).toList());
  }

  @GetMapping("/{name}")
  public ResponseEntity<DatasetResponse> getDataset(@PathVariable String name) {
    return ResponseEntity.ok(DatasetResponse.fromEntity(datasetService.getDataset(name)));
  }

  @GetMapping("/{name}/documents")
  public ResponseEntity<List<DatasetDocumentResponse>> getDocuments(@PathVariable String name) {
    return ResponseEntity.ok(
        datasetService.getDocuments(name).stream()
            .map(DatasetDocumentResponse::fromEntity)
            .toList());
  }

  /**
   * Uploads files. The original file name of each part may carry a relative directory path, which
   * directory routing rules match against. With {@code process=true} ingestion starts right away.
   */
  @PostMapping(value = "/{name}/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> uploadFiles(
      @PathVariable String name,
      @RequestParam("files") List<MultipartFile> files,
      @RequestParam(value = "process", defaultValue = "false") boolean process) {
    List<UploadResult> results = datasetService.uploadFiles(name, files);
    String taskId = process ? datasetService.processDataset(name, false).getId() : null;
    UploadResponse response =
        UploadResponse.builder()
            .files(results.stream().map(UploadResponse.FileEntry::from).toList())
            .taskId(taskId)
            .build();
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  /** Starts ingestion of the dataset's pending and failed documents. */
  @PostMapping("/{name}/process")
  public ResponseEntity<TaskResponse> processDataset(
      @PathVariable String name,
      @RequestParam(value = "all", defaultValue = "false") boolean includeIngested) {
    IngestionTask task = datasetService.processDataset(name, includeIngested);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(TaskResponse.from(task));
  }

  @GetMapping("/{name}/tasks")
  public ResponseEntity<List<TaskResponse>> getTasks(@PathVariable String name) {
    return ResponseEntity.ok(
        datasetService.getTasks(name).stream().map(TaskResponse::from).toList());
  }

  @DeleteMapping("/{name}")
  public ResponseEntity<Void> deleteDataset(@PathVariable String name) {
    datasetService.deleteDataset(name);
    return ResponseEntity.noContent().build();
  }
}
