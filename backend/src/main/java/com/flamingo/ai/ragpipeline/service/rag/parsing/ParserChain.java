package com.flamingo.ai.ragpipeline.service.rag.parsing;

import com.flamingo.ai.ragpipeline.exception.ParseException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs an ordered list of candidate parsers, stopping at the first one that yields chunks.
 *
 * <p>A candidate that throws, or returns no chunks for a file with content, hands over to the
 * next one. A blank file yields an empty successful result without consulting fallbacks.
 */
@Component
@Slf4j
public class ParserChain {

  /**
   * Result of running the chain.
   *
   * @param parserName the parser whose chunks were kept, null for a blank file
   * @param chunks the chunks in document order
   * @param attempts every attempt in the order they were made
   */
  public record Result(String parserName, List<ParsedChunk> chunks, List<ParseAttempt> attempts) {}

  /**
   * Parses a file with the first candidate that succeeds.
   *
   * @param input the file
   * @param candidates candidate parsers, primary first
   * @return the chunks of the successful parser
   * @throws ParseException if every candidate failed
   */
  public Result parse(ParserInput input, List<ConfiguredParser> candidates) {
    if (isBlank(input)) {
      log.debug("{} is empty, nothing to parse", input.fileName());
      return new Result(null, List.of(), List.of());
    }

    List<ParseAttempt> attempts = new ArrayList<>();
    for (ConfiguredParser candidate : candidates) {
      ParseAttempt attempt = attempt(candidate, input);
      attempts.add(attempt);
      if (attempt.succeeded()) {
        if (attempts.size() > 1) {
          log.info(
              "Parsed {} with fallback parser {} after {} failed attempt(s)",
              input.fileName(),
              candidate.name(),
              attempts.size() - 1);
        }
        return new Result(candidate.name(), attempt.chunks(), attempts);
      }
      log.warn(
          "Parser {} could not handle {}: {}",
          candidate.name(),
          input.fileName(),
          attempt.describeFailure());
    }

    ParseAttempt last = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    String message =
        last == null
            ? "No parser candidates for " + input.fileName()
            : "All parsers failed for "
                + input.fileName()
                + ", last error "
                + last.describeFailure();
    throw new ParseException(
        input.fileName(),
        attempts.stream().map(ParseAttempt::parserName).toList(),
        message,
        last == null ? null : last.error());
  }

  private ParseAttempt attempt(ConfiguredParser candidate, ParserInput input) {
    try {
      return ParseAttempt.success(candidate.name(), candidate.parser().parse(input));
    } catch (IOException | RuntimeException e) {
      return ParseAttempt.failure(candidate.name(), e);
    }
  }

  private boolean isBlank(ParserInput input) {
    if (input.isEmpty()) {
      return true;
    }
    // Stops at the first non-whitespace byte, so only blank files are read to the end
    try (InputStream in = new BufferedInputStream(Files.newInputStream(input.path()))) {
      int b;
      while ((b = in.read()) != -1) {
        if (!Character.isWhitespace(b)) {
          return false;
        }
      }
      return true;
    } catch (IOException e) {
      throw new ParseException(input.fileName(), "Cannot read " + input.fileName(), e);
    }
  }
}
