package com.flamingo.ai.ragpipeline.service.rag.parsing;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A parser instance together with the routing attributes of its processing strategy entry.
 *
 * @param name alias referenced by directory rules
 * @param parser the parser implementation
 * @param priority higher priorities are tried first
 * @param declarationOrder position in the strategy, breaks priority ties
 * @param fileExtensions lower-case extensions without dot
 * @param mimeTypes lower-case MIME types; entries ending in {@code /*} match a whole family
 * @param fileIncludePatterns glob patterns a file name must match, empty for no restriction
 */
public record ConfiguredParser(
    String name,
    DocumentParser parser,
    int priority,
    int declarationOrder,
    Set<String> fileExtensions,
    Set<String> mimeTypes,
    List<String> fileIncludePatterns) {

  public ConfiguredParser {
    fileExtensions =
        fileExtensions.stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\*?\\.", ""))
            .collect(Collectors.toUnmodifiableSet());
    mimeTypes =
        mimeTypes.stream()
            .map(mime -> mime.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    fileIncludePatterns = List.copyOf(fileIncludePatterns);
  }

  public String type() {
    return parser.type();
  }

  public boolean acceptsExtension(String extension) {
    return extension != null && fileExtensions.contains(extension.toLowerCase(Locale.ROOT));
  }

  public boolean acceptsMimeType(String mimeType) {
    if (mimeType == null) {
      return false;
    }
    String normalized = mimeType.toLowerCase(Locale.ROOT);
    for (String accepted : mimeTypes) {
      if (accepted.equals(normalized)
          || (accepted.endsWith("/*")
              && normalized.startsWith(accepted.substring(0, accepted.length() - 1)))) {
        return true;
      }
    }
    return false;
  }

  /** True if no include pattern is declared or the file name (or its base name) matches one. */
  public boolean includes(String fileName) {
    if (fileIncludePatterns.isEmpty()) {
      return true;
    }
    Path path = Path.of(fileName);
    Path baseName = path.getFileName();
    for (String pattern : fileIncludePatterns) {
      PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
      if (matcher.matches(path) || (baseName != null && matcher.matches(baseName))) {
        return true;
      }
    }
    return false;
  }

  /** True if this entry is referenced by the given name or type. */
  public boolean isNamed(String reference) {
    return name.equalsIgnoreCase(reference) || type().equalsIgnoreCase(reference);
  }
}
