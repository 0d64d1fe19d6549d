package com.flamingo.ai.ragpipeline.service.rag.parsing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A file handed to a parser. Parsers read from {@link #path()} so that large files can be
 * streamed instead of buffered.
 *
 * @param path location of the raw bytes
 * @param fileName original (possibly directory-qualified) file name
 * @param mimeType MIME type detected by the router, may be null
 * @param sizeBytes file size in bytes
 */
public record ParserInput(Path path, String fileName, String mimeType, long sizeBytes) {

  public InputStream openStream() throws IOException {
    return Files.newInputStream(path);
  }

  public boolean isEmpty() {
    return sizeBytes == 0;
  }
}
