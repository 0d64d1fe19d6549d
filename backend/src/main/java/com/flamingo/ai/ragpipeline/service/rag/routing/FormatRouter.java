package com.flamingo.ai.ragpipeline.service.rag.routing;

import com.flamingo.ai.ragpipeline.exception.FormatUnsupportedException;
import com.flamingo.ai.ragpipeline.exception.ParseException;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ConfiguredParser;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ParserInput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses the parsers eligible for a file within a processing strategy.
 *
 * <p>Directory rules and include patterns narrow the parser set first. The file extension is
 * matched next; when the extension is missing, generic or unknown to every parser the content is
 * sniffed and matched against the declared MIME types. Candidates come back ordered by priority,
 * the first being the primary parser and the rest its fallback chain.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FormatRouter {

  static final Set<String> GENERIC_EXTENSIONS = Set.of("", "bin", "dat", "tmp");

  private static final Comparator<ConfiguredParser> BY_PRIORITY =
      Comparator.comparingInt(ConfiguredParser::priority)
          .reversed()
          .thenComparingInt(ConfiguredParser::declarationOrder);

  private final ContentSniffer contentSniffer;

  /**
   * Routes a file.
   *
   * @param file the file to route; {@code fileName} may contain a relative directory path
   * @param parsers the parsers of the processing strategy in declaration order
   * @param directoryRules directory rules of the processing strategy
   * @return the ordered candidates
   * @throws FormatUnsupportedException if a rule skips the file or no parser accepts it
   */
  public RoutingDecision route(
      ParserInput file, List<ConfiguredParser> parsers, List<DirectoryRoute> directoryRules) {
    String fileName = normalize(file.fileName());
    List<ConfiguredParser> eligible = applyDirectoryRules(fileName, parsers, directoryRules);
    eligible.removeIf(parser -> !parser.includes(fileName));

    String extension = extensionOf(fileName);
    if (!GENERIC_EXTENSIONS.contains(extension)) {
      List<ConfiguredParser> byExtension =
          eligible.stream().filter(parser -> parser.acceptsExtension(extension)).toList();
      if (!byExtension.isEmpty()) {
        return decision(fileName, byExtension, null, RoutingDecision.MatchedBy.EXTENSION);
      }
    }

    String mimeType = sniff(file);
    List<ConfiguredParser> byContent =
        eligible.stream().filter(parser -> parser.acceptsMimeType(mimeType)).toList();
    if (byContent.isEmpty()) {
      log.debug("No parser accepts {} (extension '{}', sniffed {})", fileName, extension, mimeType);
      throw new FormatUnsupportedException(file.fileName(), mimeType);
    }
    return decision(fileName, byContent, mimeType, RoutingDecision.MatchedBy.CONTENT);
  }

  private List<ConfiguredParser> applyDirectoryRules(
      String fileName, List<ConfiguredParser> parsers, List<DirectoryRoute> directoryRules) {
    for (DirectoryRoute rule : directoryRules) {
      if (!rule.matches(fileName)) {
        continue;
      }
      if (rule.skip()) {
        log.debug("{} skipped by directory rule {}", fileName, rule.pathPattern());
        throw new FormatUnsupportedException(fileName, null);
      }
      List<ConfiguredParser> allowed = new ArrayList<>();
      for (ConfiguredParser parser : parsers) {
        if (rule.parsers().stream().anyMatch(parser::isNamed)) {
          allowed.add(parser);
        }
      }
      return allowed;
    }
    return new ArrayList<>(parsers);
  }

  private String sniff(ParserInput file) {
    try {
      return contentSniffer.detect(file.path());
    } catch (IOException e) {
      throw new ParseException(file.fileName(), "Cannot read " + file.fileName(), e);
    }
  }

  private RoutingDecision decision(
      String fileName,
      List<ConfiguredParser> candidates,
      String mimeType,
      RoutingDecision.MatchedBy matchedBy) {
    List<ConfiguredParser> ordered = candidates.stream().sorted(BY_PRIORITY).toList();
    log.debug(
        "Routed {} by {} to {}",
        fileName,
        matchedBy,
        ordered.stream().map(ConfiguredParser::name).toList());
    return new RoutingDecision(ordered, mimeType, matchedBy);
  }

  static String extensionOf(String fileName) {
    int slash = fileName.lastIndexOf('/');
    String baseName = fileName.substring(slash + 1);
    int dot = baseName.lastIndexOf('.');
    if (dot <= 0 || dot == baseName.length() - 1) {
      return "";
    }
    return baseName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String normalize(String fileName) {
    String normalized = fileName.replace('\\', '/');
    while (normalized.startsWith("./")) {
      normalized = normalized.substring(2);
    }
    return normalized;
  }
}
