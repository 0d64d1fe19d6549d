package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.service.dataset.UploadResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a multi-file upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

  private List<FileEntry> files;

  /** Task started for the upload when processing was requested, otherwise null. */
  private String taskId;

  /** One uploaded file. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class FileEntry {
    private String filename;
    private String contentHash;
    private boolean processed;
    private boolean skipped;

    public static FileEntry from(UploadResult result) {
      return FileEntry.builder()
          .filename(result.fileName())
          .contentHash(result.contentHash())
          .processed(result.processed())
          .skipped(result.skipped())
          .build();
    }
  }
}
