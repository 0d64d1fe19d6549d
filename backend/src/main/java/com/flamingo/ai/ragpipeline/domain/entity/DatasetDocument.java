package com.flamingo.ai.ragpipeline.domain.entity;

import com.flamingo.ai.ragpipeline.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** An uploaded file of a dataset, identified by its content hash. */
@Entity
@Table(
    name = "dataset_documents",
    uniqueConstraints = @UniqueConstraint(columnNames = {"dataset_id", "content_hash"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatasetDocument {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "dataset_id", nullable = false)
  private Dataset dataset;

  /** Relative path as uploaded; directory rules match against it. */
  @Column(nullable = false)
  private String fileName;

  @Column(name = "content_hash", nullable = false, length = 64)
  private String contentHash;

  private String mimeType;

  private Long fileSize;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  private Integer chunkCount;

  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  private LocalDateTime ingestedAt;

  @PrePersist
  protected void onCreate() {
    uploadedAt = LocalDateTime.now();
  }

  public void startProcessing() {
    this.status = DocumentStatus.PROCESSING;
  }

  /** Marks the document as stored with the given number of chunks. */
  public void markIngested(int chunkCount) {
    this.status = DocumentStatus.INGESTED;
    this.chunkCount = chunkCount;
    this.processingError = null;
    this.ingestedAt = LocalDateTime.now();
  }

  public void markFailed(String errorMessage) {
    this.status = DocumentStatus.FAILED;
    this.processingError = errorMessage;
  }
}
