package com.flamingo.ai.ragpipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pools of the ingestion runtime. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs ingestion tasks; one thread drives the files of one task. */
  @Bean(name = "ingestionTaskExecutor")
  public ThreadPoolTaskExecutor ingestionTaskExecutor(RagConfig ragConfig) {
    RagConfig.Ingestion ingestion = ragConfig.getIngestion();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(ingestion.getTaskPoolSize());
    executor.setMaxPoolSize(ingestion.getTaskPoolSize());
    executor.setQueueCapacity(ingestion.getTaskQueueCapacity());
    executor.setThreadNamePrefix("ingest-task-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  /** Processes single files; concurrency is further bounded by a semaphore. */
  @Bean(name = "fileProcessingExecutor")
  public ThreadPoolTaskExecutor fileProcessingExecutor(RagConfig ragConfig) {
    int workers = Math.max(1, ragConfig.getIngestion().getMaxConcurrentFiles());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers * 2);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("ingest-file-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
