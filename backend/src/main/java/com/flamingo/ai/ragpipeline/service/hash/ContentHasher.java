package com.flamingo.ai.ragpipeline.service.hash;

import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/**
 * Computes the content identifiers used for deduplication.
 *
 * <p>Document hashes are SHA-256 over the raw file bytes, streamed from disk. Chunk hashes are
 * SHA-256 over the UTF-8 chunk text. Both are lower-case hex strings.
 */
@Component
public class ContentHasher {

  /** Number of document hash characters used as chunk id prefix. */
  public static final int CHUNK_ID_PREFIX_LENGTH = 16;

  public String hashFile(Path file) throws IOException {
    return Files.asByteSource(file.toFile()).hash(Hashing.sha256()).toString();
  }

  public String hashBytes(byte[] bytes) {
    return Hashing.sha256().hashBytes(bytes).toString();
  }

  public String hashText(String text) {
    return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
  }

  /**
   * Builds the stable id of a chunk, e.g. {@code 3f9a0c1d2e4b5a69_0007}.
   *
   * @param documentHash the SHA-256 hex of the source document
   * @param chunkIndex the position of the chunk within the document
   * @return the chunk id
   */
  public String chunkId(String documentHash, int chunkIndex) {
    String prefix =
        documentHash.length() > CHUNK_ID_PREFIX_LENGTH
            ? documentHash.substring(0, CHUNK_ID_PREFIX_LENGTH)
            : documentHash;
    return String.format("%s_%04d", prefix, chunkIndex);
  }
}
