package com.flamingo.ai.ragpipeline.service.rag.resolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ComponentRegistry Tests")
class ComponentRegistryTest {

  private ComponentRegistry<String> registry;

  @BeforeEach
  void setUp() {
    registry =
        new ComponentRegistry<String>("widget")
            .register("Echo", (name, config) -> name + ":" + config.getString("value", "none"))
            .register(
                "Strict",
                (name, config) -> {
                  throw new IllegalArgumentException("value is required");
                });
  }

  @Test
  @DisplayName("should create a registered type with its config")
  void shouldCreateRegisteredType() {
    String created =
        registry.create("Echo", "first", ComponentConfig.of("first", Map.of("value", "x")));

    assertThat(created).isEqualTo("first:x");
    assertThat(registry.contains("Echo")).isTrue();
    assertThat(registry.types()).containsExactly("Echo", "Strict");
  }

  @Test
  @DisplayName("should list known types when the type is unknown")
  void shouldRejectUnknownType() {
    assertThatThrownBy(() -> registry.create("Missing", "second", ComponentConfig.empty()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessage("Unknown widget type 'Missing' for 'second'. Known types: [Echo, Strict]");
  }

  @Test
  @DisplayName("should wrap factory argument errors as configuration errors")
  void shouldWrapFactoryErrors() {
    assertThatThrownBy(() -> registry.create("Strict", "third", ComponentConfig.empty()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("third")
        .hasMessageContaining("value is required");
  }

  @Test
  @DisplayName("should refuse to register a type twice")
  void shouldRejectDuplicateRegistration() {
    assertThatThrownBy(() -> registry.register("Echo", (name, config) -> "again"))
        .isInstanceOf(IllegalStateException.class);
  }
}
