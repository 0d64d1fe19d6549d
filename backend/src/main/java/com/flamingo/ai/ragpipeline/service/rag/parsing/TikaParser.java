package com.flamingo.ai.ragpipeline.service.rag.parsing;

import com.flamingo.ai.ragpipeline.exception.ParseException;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextChunker;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextSpan;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.xml.sax.SAXException;

/**
 * Universal {@link DocumentParser} backed by Apache Tika's {@link AutoDetectParser}.
 *
 * <p>Handles office documents, HTML, RTF, EPUB and whatever else Tika recognises. Usually
 * configured as the lowest priority fallback behind format specific parsers. Extracted text is
 * capped at {@code maxCharacters}; a document hitting the cap is chunked up to the cap.
 */
@Slf4j
public class TikaParser implements DocumentParser {

  public static final String TYPE = "TikaParser";

  private final AutoDetectParser parser = new AutoDetectParser();
  private final TextChunker chunker;
  private final int maxCharacters;

  public TikaParser(TextChunker chunker, int maxCharacters) {
    this.chunker = chunker;
    this.maxCharacters = maxCharacters;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public List<ParsedChunk> parse(ParserInput input) throws IOException {
    BodyContentHandler handler = new BodyContentHandler(maxCharacters);
    Metadata tikaMetadata = new Metadata();
    tikaMetadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, input.fileName());

    try (InputStream stream = input.openStream()) {
      parser.parse(stream, handler, tikaMetadata, new ParseContext());
    } catch (SAXException e) {
      if (!WriteLimitReachedException.isWriteLimitReached(e)) {
        throw new ParseException(input.fileName(), "Tika failed to read content", e);
      }
      log.warn(
          "Tika write limit of {} characters reached for {}, chunking truncated text",
          maxCharacters,
          input.fileName());
    } catch (TikaException e) {
      throw new ParseException(
          input.fileName(), "Tika failed to parse " + input.fileName() + ": " + e.getMessage(), e);
    }

    String contentType = tikaMetadata.get(Metadata.CONTENT_TYPE);
    String title = tikaMetadata.get(TikaCoreProperties.TITLE);

    List<ParsedChunk> chunks = new ArrayList<>();
    for (TextSpan span : chunker.chunk(handler.toString())) {
      Map<String, Object> metadata = new HashMap<>();
      if (contentType != null) {
        metadata.put("content_type", contentType);
      }
      if (title != null && !title.isBlank()) {
        metadata.put("document_title", title.trim());
      }
      if (span.section() != null) {
        metadata.put("section", span.section());
      }
      chunks.add(new ParsedChunk(span.text(), metadata));
    }
    log.debug(
        "TikaParser produced {} chunks from {} ({})", chunks.size(), input.fileName(), contentType);
    return chunks;
  }
}
