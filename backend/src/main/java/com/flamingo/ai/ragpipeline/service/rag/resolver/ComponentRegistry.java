package com.flamingo.ai.ragpipeline.service.rag.resolver;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps component type names, as written in configuration, to factories of one component family.
 *
 * @param <T> component family
 */
@Slf4j
public class ComponentRegistry<T> {

  private final String family;
  private final Map<String, ComponentFactory<T>> factories = new LinkedHashMap<>();

  public ComponentRegistry(String family) {
    this.family = family;
  }

  public String getFamily() {
    return family;
  }

  /**
   * Registers a type.
   *
   * @throws IllegalStateException if the type is already registered
   */
  public synchronized ComponentRegistry<T> register(String type, ComponentFactory<T> factory) {
    if (factories.containsKey(type)) {
      throw new IllegalStateException(family + " type '" + type + "' is already registered");
    }
    factories.put(type, factory);
    log.debug("Registered {} type {}", family, type);
    return this;
  }

  public synchronized boolean contains(String type) {
    return type != null && factories.containsKey(type);
  }

  public synchronized Set<String> types() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(factories.keySet()));
  }

  /**
   * Creates an instance of a registered type.
   *
   * @throws ConfigurationException if the type is unknown or its configuration is rejected
   */
  public T create(String type, String name, ComponentConfig config) {
    ComponentFactory<T> factory;
    synchronized (this) {
      factory = type == null ? null : factories.get(type);
    }
    if (factory == null) {
      throw new ConfigurationException(
          String.format(
              "Unknown %s type '%s' for '%s'. Known types: %s", family, type, name, types()));
    }
    try {
      return factory.create(name, config);
    } catch (ConfigurationException e) {
      throw e;
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new ConfigurationException(
          "Invalid configuration for " + family + " '" + name + "': " + e.getMessage(), e);
    }
  }
}
