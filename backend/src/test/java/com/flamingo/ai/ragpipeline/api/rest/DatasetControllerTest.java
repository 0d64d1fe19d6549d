package com.flamingo.ai.ragpipeline.api.rest;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.ragpipeline.api.dto.request.CreateDatasetRequest;
import com.flamingo.ai.ragpipeline.domain.entity.Dataset;
import com.flamingo.ai.ragpipeline.exception.ApiError;
import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.exception.DatasetNotFoundException;
import com.flamingo.ai.ragpipeline.exception.GlobalExceptionHandler;
import com.flamingo.ai.ragpipeline.service.dataset.DatasetService;
import com.flamingo.ai.ragpipeline.service.dataset.UploadResult;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionJob;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTask;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("DatasetController Tests")
class DatasetControllerTest {

  @Mock private DatasetService datasetService;

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new DatasetController(datasetService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static Dataset dataset() {
    return Dataset.builder()
        .id(UUID.randomUUID())
        .name("docs")
        .processingStrategy("universal")
        .databaseName("main_database")
        .build();
  }

  @Test
  @DisplayName("should create a dataset and return 201")
  void shouldCreateDataset() throws Exception {
    when(datasetService.createDataset("docs", null, "universal", "main_database"))
        .thenReturn(dataset());
    CreateDatasetRequest request =
        CreateDatasetRequest.builder()
            .name("docs")
            .processingStrategy("universal")
            .database("main_database")
            .build();

    mockMvc
        .perform(
            post("/api/datasets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.name").value("docs"))
        .andExpect(jsonPath("$.database").value("main_database"));
  }

  @Test
  @DisplayName("should reject an invalid dataset name with 400")
  void shouldRejectInvalidName() throws Exception {
    CreateDatasetRequest request =
        CreateDatasetRequest.builder()
            .name("../docs")
            .processingStrategy("universal")
            .database("main_database")
            .build();

    mockMvc
        .perform(
            post("/api/datasets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    verifyNoInteractions(datasetService);
  }

  @Test
  @DisplayName("should report an invalid pipeline with 422")
  void shouldReportConfigurationError() throws Exception {
    when(datasetService.createDataset("docs", null, "nope", "main_database"))
        .thenThrow(new ConfigurationException("Unknown data processing strategy 'nope'"));
    CreateDatasetRequest request =
        CreateDatasetRequest.builder()
            .name("docs")
            .processingStrategy("nope")
            .database("main_database")
            .build();

    mockMvc
        .perform(
            post("/api/datasets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value(ApiError.CONFIGURATION_ERROR));
  }

  @Test
  @DisplayName("should return 404 for an unknown dataset")
  void shouldReturnNotFound() throws Exception {
    when(datasetService.getDataset("missing")).thenThrow(new DatasetNotFoundException("missing"));

    mockMvc
        .perform(get("/api/datasets/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.DATASET_NOT_FOUND));
  }

  @Test
  @DisplayName("should upload files and start processing on request")
  void shouldUploadAndProcess() throws Exception {
    when(datasetService.uploadFiles(eq("docs"), anyList()))
        .thenReturn(List.of(new UploadResult("guides/a.txt", "abc", false, false)));
    IngestionTask task =
        new IngestionTask("t1", new IngestionJob("docs", "universal", "main_database", List.of()));
    when(datasetService.processDataset("docs", false)).thenReturn(task);

    mockMvc
        .perform(
            multipart("/api/datasets/docs/files")
                .file(
                    new MockMultipartFile(
                        "files", "guides/a.txt", "text/plain", "hello".getBytes()))
                .param("process", "true"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.taskId").value("t1"))
        .andExpect(jsonPath("$.files[0].filename").value("guides/a.txt"));
  }

  @Test
  @DisplayName("should accept a processing request with 202")
  void shouldStartProcessing() throws Exception {
    IngestionTask task =
        new IngestionTask("t2", new IngestionJob("docs", "universal", "main_database", List.of()));
    when(datasetService.processDataset("docs", true)).thenReturn(task);

    mockMvc
        .perform(post("/api/datasets/docs/process").param("all", "true"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.taskId").value("t2"))
        .andExpect(jsonPath("$.state").value("PENDING"));
  }

  @Test
  @DisplayName("should delete a dataset with 204")
  void shouldDeleteDataset() throws Exception {
    mockMvc.perform(delete("/api/datasets/docs")).andExpect(status().isNoContent());

    verify(datasetService).deleteDataset("docs");
  }
}
