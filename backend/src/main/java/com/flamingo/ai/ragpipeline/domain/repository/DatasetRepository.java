package com.flamingo.ai.ragpipeline.domain.repository;

import com.flamingo.ai.ragpipeline.domain.entity.Dataset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Dataset entities. */
@Repository
public interface DatasetRepository extends JpaRepository<Dataset, UUID> {

  Optional<Dataset> findByName(String name);

  boolean existsByName(String name);

  List<Dataset> findAllByOrderByCreatedAtDesc();

  /** Finds the datasets that write into a database. */
  List<Dataset> findByDatabaseName(String databaseName);
}
