package com.flamingo.ai.ragpipeline.domain.entity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A named collection of documents ingested with one processing strategy into one database. */
@Entity
@Table(name = "datasets")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Dataset {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true)
  private String name;

  @Column(columnDefinition = "TEXT")
  private String description;

  /** Name of the data processing strategy under {@code rag.data-processing-strategies}. */
  @Column(nullable = false)
  private String processingStrategy;

  /** Name of the target database under {@code rag.databases}. */
  @Column(nullable = false)
  private String databaseName;

  @OneToMany(mappedBy = "dataset", cascade = CascadeType.ALL, orphanRemoval = true)
  @Builder.Default
  private List<DatasetDocument> documents = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  /** Adds a document to this dataset. */
  public void addDocument(DatasetDocument document) {
    documents.add(document);
    document.setDataset(this);
  }
}
