package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-process registry of ingestion tasks. Running tasks are always kept; finished tasks beyond
 * {@code rag.ingestion.retained-tasks} are evicted oldest first.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionTaskStore {

  private final RagConfig ragConfig;
  private final Map<String, IngestionTask> tasks = new ConcurrentHashMap<>();

  public void save(IngestionTask task) {
    tasks.put(task.getId(), task);
    evictFinished();
  }

  public Optional<IngestionTask> find(String taskId) {
    return Optional.ofNullable(tasks.get(taskId));
  }

  /** Tasks of a dataset, newest first. */
  public List<IngestionTask> findByDataset(String datasetName) {
    return tasks.values().stream()
        .filter(task -> task.getJob().datasetName().equals(datasetName))
        .sorted(Comparator.comparing(IngestionTask::getSubmittedAt).reversed())
        .toList();
  }

  public int size() {
    return tasks.size();
  }

  synchronized void evictFinished() {
    int retained = ragConfig.getIngestion().getRetainedTasks();
    List<IngestionTask> finished =
        tasks.values().stream()
            .filter(task -> task.getState().isTerminal())
            .sorted(Comparator.comparing(IngestionTask::getSubmittedAt))
            .toList();
    int excess = finished.size() - retained;
    for (int i = 0; i < excess; i++) {
      tasks.remove(finished.get(i).getId());
    }
    if (excess > 0) {
      log.debug("Evicted {} finished ingestion tasks", excess);
    }
  }
}
