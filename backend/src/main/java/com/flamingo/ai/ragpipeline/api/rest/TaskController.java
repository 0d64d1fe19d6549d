package com.flamingo.ai.ragpipeline.api.rest;

import com.flamingo.ai.ragpipeline.api.dto.response.TaskResponse;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTaskOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for ingestion task status and cancellation. */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

  private final IngestionTaskOrchestrator orchestrator;

  @GetMapping("/{taskId}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable String taskId) {
    return ResponseEntity.ok(TaskResponse.from(orchestrator.getTask(taskId)));
  }

  /** Requests cancellation; files already in flight still complete. */
  @PostMapping("/{taskId}/cancel")
  public ResponseEntity<TaskResponse> cancelTask(@PathVariable String taskId) {
    return ResponseEntity.ok(TaskResponse.from(orchestrator.cancel(taskId)));
  }
}
