package com.flamingo.ai.ragpipeline.service.rag.routing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.springframework.stereotype.Component;

/**
 * Detects a file's MIME type from its bytes, ignoring the file name.
 *
 * <p>Magic-byte and container detection come from Apache Tika. Plain text results are refined
 * with lightweight heuristics on the first {@value #SNIFF_BYTES} bytes to recognise HTML,
 * Markdown and delimited text.
 */
@Component
@Slf4j
public class ContentSniffer {

  static final int SNIFF_BYTES = 8192;

  static final String OCTET_STREAM = "application/octet-stream";

  private static final String DOCX =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
  private static final String XLSX =
      "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

  private static final List<Pattern> MARKDOWN_PATTERNS =
      List.of(
          Pattern.compile("^#{1,6}\\s+\\S", Pattern.MULTILINE),
          Pattern.compile("\\*\\*[^*\\n]+\\*\\*"),
          Pattern.compile("\\[[^\\]\\n]+\\]\\([^)\\n]+\\)"),
          Pattern.compile("^\\s*[-*+]\\s+\\S", Pattern.MULTILINE),
          Pattern.compile("^\\s*\\d+\\.\\s+\\S", Pattern.MULTILINE),
          Pattern.compile("^```", Pattern.MULTILINE),
          Pattern.compile("^>\\s", Pattern.MULTILINE));

  private static final int MARKDOWN_MIN_PATTERNS = 3;

  private final Tika tika = new Tika();

  /**
   * Detects the MIME type of a file from content only.
   *
   * @param file the file
   * @return a MIME type without parameters, {@code application/octet-stream} when unknown
   * @throws IOException if the file cannot be read
   */
  public String detect(Path file) throws IOException {
    String detected;
    try (TikaInputStream stream = TikaInputStream.get(file)) {
      detected = tika.getDetector().detect(stream, new Metadata()).getBaseType().toString();
    }
    byte[] prefix = readPrefix(file);
    String refined = refine(detected, prefix);
    log.debug("Sniffed {} as {} (tika: {})", file.getFileName(), refined, detected);
    return refined;
  }

  String refine(String detected, byte[] prefix) {
    if (startsWith(prefix, "%PDF")) {
      return "application/pdf";
    }
    if (startsWith(prefix, "PK\u0003\u0004")
        && ("application/zip".equals(detected) || OCTET_STREAM.equals(detected))) {
      String entries = new String(prefix, StandardCharsets.ISO_8859_1);
      if (entries.contains("word/")) {
        return DOCX;
      }
      if (entries.contains("xl/")) {
        return XLSX;
      }
      return detected;
    }
    if (!detected.startsWith("text/") && !OCTET_STREAM.equals(detected)) {
      return detected;
    }
    String text = decodeUtf8(prefix);
    if (text == null) {
      return detected;
    }
    String lower = text.stripLeading().toLowerCase(Locale.ROOT);
    if (lower.startsWith("<!doctype html") || lower.contains("<html")) {
      return "text/html";
    }
    if (looksLikeMarkdown(text)) {
      return "text/markdown";
    }
    if (looksDelimited(text)) {
      return "text/csv";
    }
    return "text/plain";
  }

  private boolean looksLikeMarkdown(String text) {
    int matches = 0;
    for (Pattern pattern : MARKDOWN_PATTERNS) {
      if (pattern.matcher(text).find()) {
        matches++;
      }
    }
    return matches >= MARKDOWN_MIN_PATTERNS;
  }

  private boolean looksDelimited(String text) {
    String[] lines = text.split("\\R");
    if (lines.length < 2) {
      return false;
    }
    for (char delimiter : new char[] {',', ';', '\t'}) {
      long count = text.chars().filter(c -> c == delimiter).count();
      if (count > 2L * lines.length) {
        return true;
      }
    }
    return false;
  }

  private static byte[] readPrefix(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return in.readNBytes(SNIFF_BYTES);
    }
  }

  private static boolean startsWith(byte[] bytes, String magic) {
    byte[] expected = magic.getBytes(StandardCharsets.ISO_8859_1);
    if (bytes.length < expected.length) {
      return false;
    }
    for (int i = 0; i < expected.length; i++) {
      if (bytes[i] != expected[i]) {
        return false;
      }
    }
    return true;
  }

  /** Decodes the prefix as UTF-8, tolerating a multi-byte sequence cut at the end. */
  private static String decodeUtf8(byte[] prefix) {
    int length = prefix.length;
    for (int trim = 0; trim < 4 && length - trim > 0; trim++) {
      try {
        return StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(prefix, 0, length - trim))
            .toString();
      } catch (CharacterCodingException e) {
        if (prefix.length < SNIFF_BYTES) {
          return null;
        }
      }
    }
    return null;
  }
}
