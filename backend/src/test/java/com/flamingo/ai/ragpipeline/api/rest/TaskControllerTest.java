package com.flamingo.ai.ragpipeline.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.ragpipeline.exception.ApiError;
import com.flamingo.ai.ragpipeline.exception.GlobalExceptionHandler;
import com.flamingo.ai.ragpipeline.exception.TaskNotFoundException;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionFile;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionJob;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTask;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTaskOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskController Tests")
class TaskControllerTest {

  @Mock private IngestionTaskOrchestrator orchestrator;

  private MockMvc mockMvc;
  private IngestionTask task;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new TaskController(orchestrator))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    IngestionFile file = new IngestionFile("a.txt", "h", Path.of("a.txt"), null, 1, null);
    task = new IngestionTask("t1", new IngestionJob("docs", "universal", "db", List.of(file)));
  }

  @Test
  @DisplayName("should return the task status")
  void shouldReturnTask() throws Exception {
    when(orchestrator.getTask("t1")).thenReturn(task);

    mockMvc
        .perform(get("/api/tasks/t1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.taskId").value("t1"))
        .andExpect(jsonPath("$.state").value("PENDING"))
        .andExpect(jsonPath("$.totalFiles").value(1));
  }

  @Test
  @DisplayName("should mark the task as cancel requested")
  void shouldCancelTask() throws Exception {
    when(orchestrator.cancel("t1"))
        .thenAnswer(
            invocation -> {
              task.requestCancel();
              return task;
            });

    mockMvc
        .perform(post("/api/tasks/t1/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelRequested").value(true));
  }

  @Test
  @DisplayName("should return 404 for an unknown task")
  void shouldReturnNotFound() throws Exception {
    when(orchestrator.getTask("missing")).thenThrow(new TaskNotFoundException("missing"));

    mockMvc
        .perform(get("/api/tasks/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.TASK_NOT_FOUND));
  }
}
