package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.service.database.DocumentPage;
import com.flamingo.ai.ragpipeline.service.database.DocumentSummary;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one page of the documents stored in a database. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentListResponse {

  private String database;
  private List<Document> documents;
  private int totalCount;
  private int limit;
  private int offset;

  /** A stored document. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Document {
    private String id;
    private String filename;
    private int chunkCount;
    private long sizeBytes;
    private String parserUsed;
    private String dateIngested;
    private List<String> datasets;

    public static Document from(DocumentSummary summary) {
      return Document.builder()
          .id(summary.id())
          .filename(summary.filename())
          .chunkCount(summary.chunkCount())
          .sizeBytes(summary.sizeBytes())
          .parserUsed(summary.parserUsed())
          .dateIngested(summary.dateIngested())
          .datasets(summary.datasets())
          .build();
    }
  }

  public static DocumentListResponse from(DocumentPage page) {
    return DocumentListResponse.builder()
        .database(page.database())
        .documents(page.documents().stream().map(Document::from).toList())
        .totalCount(page.totalCount())
        .limit(page.limit())
        .offset(page.offset())
        .build();
  }
}
