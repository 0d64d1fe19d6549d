package com.flamingo.ai.ragpipeline.service.rag.parsing;

import java.io.IOException;
import java.util.List;

/**
 * Interface for format specific document parsers.
 *
 * <p>Implementations turn a file into its chunks in document order. The chunk position in the
 * returned list becomes the chunk index, so implementations must never reorder content.
 */
public interface DocumentParser {

  /**
   * Returns the registry type name of this parser, e.g. {@code PdfParser}.
   *
   * @return the parser type
   */
  String type();

  /**
   * Parses a file into ordered chunks.
   *
   * @param input the file to parse
   * @return chunks in document order; empty when the file holds no extractable text
   * @throws IOException if the file cannot be read
   */
  List<ParsedChunk> parse(ParserInput input) throws IOException;
}
