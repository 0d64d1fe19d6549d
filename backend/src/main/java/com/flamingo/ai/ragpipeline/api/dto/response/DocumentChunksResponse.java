package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.service.database.DocumentChunks;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorRecord;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO previewing the chunks of a stored document. Vectors are left out. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunksResponse {

  private String database;
  private String documentHash;
  private int totalChunks;
  private List<Chunk> chunks;

  /** One chunk in document order. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Chunk {
    private String id;
    private int chunkIndex;
    private String text;
    private Map<String, Object> metadata;

    public static Chunk from(VectorRecord record) {
      return Chunk.builder()
          .id(record.id())
          .chunkIndex(record.chunkIndex())
          .text(record.text())
          .metadata(record.metadata())
          .build();
    }
  }

  public static DocumentChunksResponse from(DocumentChunks chunks) {
    return DocumentChunksResponse.builder()
        .database(chunks.database())
        .documentHash(chunks.documentHash())
        .totalChunks(chunks.totalChunks())
        .chunks(chunks.chunks().stream().map(Chunk::from).toList())
        .build();
  }
}
