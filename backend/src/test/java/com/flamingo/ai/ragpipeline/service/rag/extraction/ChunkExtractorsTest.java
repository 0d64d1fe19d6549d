package com.flamingo.ai.ragpipeline.service.rag.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Chunk extractor Tests")
class ChunkExtractorsTest {

  private static ExtractionContext context(String text) {
    return new ExtractionContext("doc.txt", 0, text, Map.of());
  }

  @Nested
  @DisplayName("KeywordExtractor")
  class Keywords {

    @Test
    @DisplayName("should rank repeated content words first and ignore stop words")
    void shouldRankRepeatedTerms() {
      String text =
          "Kubernetes clusters schedule containers. Kubernetes nodes run the containers.";

      Map<String, Object> result = new KeywordExtractor(2, 1).extract(context(text));

      assertThat(result).containsEntry(KeywordExtractor.KEY, List.of("containers", "kubernetes"));
    }

    @Test
    @DisplayName("should return nothing for text without content words")
    void shouldReturnNothingForStopWords() {
      assertThat(new KeywordExtractor(5, 1).extract(context("the and of to"))).isEmpty();
    }
  }

  @Nested
  @DisplayName("HeadingExtractor")
  class Headings {

    @Test
    @DisplayName("should find markdown and upper case headings")
    void shouldFindHeadings() {
      String text = "# Overview\nSome text\n\nINTRODUCTION SECTION\nmore text";

      Map<String, Object> result = new HeadingExtractor(10).extract(context(text));

      assertThat(result)
          .containsEntry(HeadingExtractor.KEY, List.of("Overview", "INTRODUCTION SECTION"));
    }
  }

  @Nested
  @DisplayName("StatisticsExtractor")
  class Statistics {

    @Test
    @DisplayName("should count words, sentences and reading time")
    void shouldComputeStatistics() {
      Map<String, Object> stats =
          new StatisticsExtractor(100).extract(context("One two three. Four five!"));

      assertThat(stats)
          .containsEntry("word_count", 5)
          .containsEntry("sentence_count", 2L)
          .containsEntry("avg_word_length", 3.8)
          .containsEntry("reading_time_minutes", 0.05)
          .containsEntry("char_count", 25);
    }
  }

  @Nested
  @DisplayName("EntityExtractor")
  class Entities {

    @Test
    @DisplayName("should extract emails, urls, dates and amounts")
    void shouldExtractEntities() {
      String text =
          "Contact jane@example.com or visit https://example.com/docs on 2024-03-15 for $1,200.50.";

      Map<String, Object> result = new EntityExtractor(null, 20).extract(context(text));

      assertThat(result)
          .containsEntry("emails", List.of("jane@example.com"))
          .containsEntry("urls", List.of("https://example.com/docs"))
          .containsEntry("dates", List.of("2024-03-15"))
          .containsEntry("monetary_amounts", List.of("$1,200.50"))
          .doesNotContainKey("proper_names");
    }

    @Test
    @DisplayName("should only run the selected entity types")
    void shouldRestrictEntityTypes() {
      Map<String, Object> result =
          new EntityExtractor(List.of("emails"), 20)
              .extract(context("mail a@b.io on 2024-01-01"));

      assertThat(result).containsOnlyKeys("emails");
    }

    @Test
    @DisplayName("should reject unknown entity types")
    void shouldRejectUnknownType() {
      assertThatThrownBy(() -> new EntityExtractor(List.of("phone_numbers"), 5))
          .isInstanceOf(ConfigurationException.class)
          .hasMessageContaining("phone_numbers");
    }
  }

  @Nested
  @DisplayName("PatternExtractor")
  class Patterns {

    @Test
    @DisplayName("should collect distinct first group matches per pattern")
    void shouldCollectMatches() {
      Map<String, String> patterns = new LinkedHashMap<>();
      patterns.put("ticket", "TICKET-(\\d+)");
      patterns.put("version", "v\\d+\\.\\d+");

      Map<String, Object> result =
          new PatternExtractor(patterns, 10)
              .extract(context("See TICKET-42, TICKET-7 and TICKET-42 since v1.2"));

      assertThat(result)
          .containsEntry("ticket", List.of("42", "7"))
          .containsEntry("version", List.of("v1.2"));
    }

    @Test
    @DisplayName("should reject an invalid regular expression or an empty pattern set")
    void shouldRejectBadConfiguration() {
      assertThatThrownBy(() -> new PatternExtractor(Map.of("broken", "(["), 10))
          .isInstanceOf(ConfigurationException.class)
          .hasMessageContaining("broken");
      assertThatThrownBy(() -> new PatternExtractor(Map.of(), 10))
          .isInstanceOf(ConfigurationException.class);
    }
  }
}
