package com.flamingo.ai.ragpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the RAG pipeline service. */
@SpringBootApplication
public class RagPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(RagPipelineApplication.class, args);
  }
}
