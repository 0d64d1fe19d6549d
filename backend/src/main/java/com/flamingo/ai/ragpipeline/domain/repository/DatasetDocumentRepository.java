package com.flamingo.ai.ragpipeline.domain.repository;

import com.flamingo.ai.ragpipeline.domain.entity.DatasetDocument;
import com.flamingo.ai.ragpipeline.domain.enums.DocumentStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for DatasetDocument entities. */
@Repository
public interface DatasetDocumentRepository extends JpaRepository<DatasetDocument, UUID> {

  List<DatasetDocument> findByDatasetIdOrderByUploadedAtAsc(UUID datasetId);

  Optional<DatasetDocument> findByDatasetIdAndContentHash(UUID datasetId, String contentHash);

  List<DatasetDocument> findByDatasetIdAndStatusIn(
      UUID datasetId, Collection<DocumentStatus> statuses);

  long countByDatasetId(UUID datasetId);

  long countByDatasetIdAndStatus(UUID datasetId, DocumentStatus status);

  /** Counts the datasets other than the given one that reference the same content. */
  @Query(
      "SELECT COUNT(d) FROM DatasetDocument d "
          + "WHERE d.contentHash = :contentHash AND d.dataset.id <> :datasetId")
  long countOtherReferences(
      @Param("contentHash") String contentHash, @Param("datasetId") UUID datasetId);

  /** Counts references to the content from datasets writing into the given database. */
  @Query(
      "SELECT COUNT(d) FROM DatasetDocument d WHERE d.contentHash = :contentHash "
          + "AND d.dataset.databaseName = :databaseName AND d.dataset.id <> :datasetId")
  long countOtherReferencesInDatabase(
      @Param("contentHash") String contentHash,
      @Param("databaseName") String databaseName,
      @Param("datasetId") UUID datasetId);

  /** Dataset documents carrying any of the given contents in datasets of the given database. */
  @Query(
      "SELECT d FROM DatasetDocument d JOIN FETCH d.dataset ds "
          + "WHERE ds.databaseName = :databaseName AND d.contentHash IN :contentHashes")
  List<DatasetDocument> findInDatabaseByContentHashes(
      @Param("databaseName") String databaseName,
      @Param("contentHashes") Collection<String> contentHashes);
}
