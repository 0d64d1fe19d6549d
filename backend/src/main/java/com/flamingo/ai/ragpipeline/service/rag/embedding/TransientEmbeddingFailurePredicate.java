package com.flamingo.ai.ragpipeline.service.rag.embedding;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.exception.EmbeddingException;
import dev.langchain4j.exception.NonRetriableException;
import java.util.function.Predicate;

/**
 * Decides whether an embedding failure is worth retrying.
 *
 * <p>Rejected input (LangChain4j {@link NonRetriableException}, {@link IllegalArgumentException})
 * and configuration errors are permanent; everything else, including I/O errors, timeouts, rate
 * limits and an open circuit, is transient. {@link EmbeddingException} carries its own flag.
 */
public class TransientEmbeddingFailurePredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    if (throwable instanceof EmbeddingException embeddingException) {
      return embeddingException.isTransientFailure();
    }
    return !(throwable instanceof NonRetriableException
        || throwable instanceof IllegalArgumentException
        || throwable instanceof ConfigurationException);
  }
}
