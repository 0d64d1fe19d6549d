package com.flamingo.ai.ragpipeline.service.rag.routing;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Directory routing rule of a processing strategy: files whose relative path matches {@code
 * pathPattern} may only use the listed parsers, or are skipped entirely.
 *
 * @param pathPattern glob over the relative file path, e.g. {@code reports/**}
 * @param parsers parser names or types allowed for matching files
 * @param skip whether matching files are excluded from ingestion
 */
public record DirectoryRoute(String pathPattern, List<String> parsers, boolean skip) {

  public DirectoryRoute {
    parsers = List.copyOf(parsers);
  }

  public boolean matches(String fileName) {
    PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pathPattern);
    return matcher.matches(Path.of(fileName));
  }
}
