package com.flamingo.ai.ragpipeline.service.rag.parsing;

import com.flamingo.ai.ragpipeline.service.rag.chunking.TextChunker;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextSpan;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link DocumentParser} for plain text, logs and delimited text.
 *
 * <p>The file is read line by line and chunked in blocks of roughly {@code blockChars} characters
 * that end on a blank line, so memory use stays bounded for very large files. Undecodable bytes
 * fail the parse, which lets the router fall back to a binary-aware parser.
 */
@Slf4j
public class TextParser implements DocumentParser {

  public static final String TYPE = "TextParser";

  private final TextChunker chunker;
  private final Charset charset;
  private final int blockChars;

  public TextParser(TextChunker chunker, Charset charset, int blockChars) {
    this.chunker = chunker;
    this.charset = charset;
    this.blockChars = Math.max(blockChars, chunker.getSettings().chunkSize() * 4);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public List<ParsedChunk> parse(ParserInput input) throws IOException {
    CharsetDecoder decoder =
        charset
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

    List<ParsedChunk> chunks = new ArrayList<>();
    int lineNumber = 0;
    int blockStartLine = 1;
    StringBuilder block = new StringBuilder();

    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(input.openStream(), decoder))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        block.append(line).append('\n');
        if (block.length() >= blockChars && line.isBlank()) {
          flush(block, blockStartLine, lineNumber, chunks);
          blockStartLine = lineNumber + 1;
        }
      }
    }
    flush(block, blockStartLine, lineNumber, chunks);

    log.debug(
        "TextParser produced {} chunks from {} lines of {}",
        chunks.size(),
        lineNumber,
        input.fileName());
    return chunks;
  }

  private void flush(StringBuilder block, int startLine, int endLine, List<ParsedChunk> chunks) {
    if (block.length() == 0) {
      return;
    }
    for (TextSpan span : chunker.chunk(block.toString())) {
      Map<String, Object> metadata = new HashMap<>();
      metadata.put("line_start", startLine);
      metadata.put("line_end", endLine);
      if (span.section() != null) {
        metadata.put("section", span.section());
      }
      chunks.add(new ParsedChunk(span.text(), metadata));
    }
    block.setLength(0);
  }
}
