package com.flamingo.ai.ragpipeline.service.dataset;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.service.hash.ContentHasher;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Content-addressed store for uploaded bytes under {@code rag.storage.raw-dir}. A file lives at
 * {@code <raw-dir>/<first two hash chars>/<hash>}, so identical uploads share one copy.
 */
@Component
@Slf4j
public class RawFileStorage {

  private final Path rootDir;
  private final ContentHasher contentHasher;

  public RawFileStorage(RagConfig ragConfig, ContentHasher contentHasher) {
    this.rootDir = Path.of(ragConfig.getStorage().getRawDir()).toAbsolutePath().normalize();
    this.contentHasher = contentHasher;
  }

  /**
   * A stored upload.
   *
   * @param contentHash SHA-256 of the bytes
   * @param path location of the bytes
   * @param sizeBytes size of the file
   */
  public record StoredFile(String contentHash, Path path, long sizeBytes) {}

  /** Streams the content to disk, hashes it and moves it to its content address. */
  public StoredFile store(InputStream content) throws IOException {
    Path incoming = rootDir.resolve("incoming");
    Files.createDirectories(incoming);
    Path temp = Files.createTempFile(incoming, "upload-", ".tmp");
    try {
      Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
      String hash = contentHasher.hashFile(temp);
      long size = Files.size(temp);
      Path target = resolve(hash);
      if (Files.exists(target)) {
        log.debug("Content {} already stored", hash);
      } else {
        Files.createDirectories(target.getParent());
        try {
          Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileAlreadyExistsException e) {
          log.debug("Content {} was stored by a concurrent upload", hash);
        }
      }
      return new StoredFile(hash, target, size);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  public Path resolve(String contentHash) {
    return rootDir.resolve(contentHash.substring(0, 2)).resolve(contentHash);
  }

  public boolean exists(String contentHash) {
    return Files.exists(resolve(contentHash));
  }

  /** Deletes stored content; returns whether it existed. */
  public boolean delete(String contentHash) throws IOException {
    return Files.deleteIfExists(resolve(contentHash));
  }
}
