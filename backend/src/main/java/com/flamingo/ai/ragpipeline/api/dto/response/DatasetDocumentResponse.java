package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.domain.entity.DatasetDocument;
import com.flamingo.ai.ragpipeline.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a dataset document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetDocumentResponse {

  private UUID id;
  private String fileName;
  private String contentHash;
  private String mimeType;
  private Long fileSize;
  private DocumentStatus status;
  private Integer chunkCount;
  private String processingError;
  private LocalDateTime uploadedAt;
  private LocalDateTime ingestedAt;

  public static DatasetDocumentResponse fromEntity(DatasetDocument document) {
    return DatasetDocumentResponse.builder()
        .id(document.getId())
        .fileName(document.getFileName())
        .contentHash(document.getContentHash())
        .mimeType(document.getMimeType())
        .fileSize(document.getFileSize())
        .status(document.getStatus())
        .chunkCount(document.getChunkCount())
        .processingError(document.getProcessingError())
        .uploadedAt(document.getUploadedAt())
        .ingestedAt(document.getIngestedAt())
        .build();
  }
}
