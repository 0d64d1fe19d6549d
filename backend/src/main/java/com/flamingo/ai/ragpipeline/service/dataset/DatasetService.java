package com.flamingo.ai.ragpipeline.service.dataset;

import com.flamingo.ai.ragpipeline.domain.entity.Dataset;
import com.flamingo.ai.ragpipeline.domain.entity.DatasetDocument;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTask;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for dataset lifecycle: create, upload, process, delete. */
public interface DatasetService {

  /**
   * Creates a dataset bound to a processing strategy and a database.
   *
   * @throws com.flamingo.ai.ragpipeline.exception.DatasetAlreadyExistsException if the name is
   *     taken
   * @throws com.flamingo.ai.ragpipeline.exception.ConfigurationException if the strategy or the
   *     database cannot be resolved
   */
  Dataset createDataset(
      String name, String description, String processingStrategy, String databaseName);

  List<Dataset> listDatasets();

  /**
   * Gets a dataset by name.
   *
   * @throws com.flamingo.ai.ragpipeline.exception.DatasetNotFoundException if not found
   */
  Dataset getDataset(String name);

  List<DatasetDocument> getDocuments(String name);

  /**
   * Stores uploaded files. Content already present in the dataset is reported as skipped.
   *
   * @param name dataset name
   * @param files uploaded files; original file names may carry a relative directory path
   * @return one result per file, in upload order
   */
  List<UploadResult> uploadFiles(String name, List<MultipartFile> files);

  /**
   * Starts ingestion of the dataset's documents.
   *
   * @param name dataset name
   * @param includeIngested whether already ingested documents are submitted again
   * @return the task handle
   */
  IngestionTask processDataset(String name, boolean includeIngested);

  /** Ingestion tasks of a dataset still held by the task store, newest first. */
  List<IngestionTask> getTasks(String name);

  /**
   * Deletes a dataset, its document rows and the vectors no other dataset of the same database
   * still references. Unfinished ingestion tasks of the dataset are cancelled first.
   *
   * @throws com.flamingo.ai.ragpipeline.exception.DatasetBusyException if a task was already
   *     running; the dataset is kept and the delete can be retried once the task finishes
   */
  void deleteDataset(String name);
}
