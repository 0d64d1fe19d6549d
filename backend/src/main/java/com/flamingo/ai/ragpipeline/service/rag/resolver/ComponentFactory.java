package com.flamingo.ai.ragpipeline.service.rag.resolver;

/**
 * Creates a configured component instance.
 *
 * @param <T> component family
 */
@FunctionalInterface
public interface ComponentFactory<T> {

  /**
   * Creates an instance.
   *
   * @param name configured name of the instance, used in logs and error messages
   * @param config the instance's {@code config} block
   * @return a new instance
   */
  T create(String name, ComponentConfig config);
}
