package com.flamingo.ai.pageindex.service.document;

import com.flamingo.ai.pageindex.service.index.DocumentIndex;
import com.flamingo.ai.pageindex.service.index.model.ChildRef;
import com.flamingo.ai.pageindex.service.index.model.DocumentTree;
import com.flamingo.ai.pageindex.service.index.model.NodeResult;
import java.nio.file.Path;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/**
 * Service interface for building, holding and querying document indexes.
 *
 * <p>Every index is registered under its document ID for the lifetime of the retrieval session.
 * Indexes are independent of each other; re-indexing a document ID replaces the previous index.
 */
public interface DocumentIndexService {

  /**
   * Builds and registers an index from raw text.
   *
   * @param docId the document ID
   * @param content the document text
   * @return the registered index
   * @throws com.flamingo.ai.pageindex.exception.EmptyDocumentException if the text has no headings
   *     and empty documents are rejected
   */
  DocumentIndex indexDocument(String docId, String content);

  /**
   * Reads a UTF-8 file and indexes its contents.
   *
   * @param docId the document ID
   * @param path the file to read
   * @return the registered index
   * @throws com.flamingo.ai.pageindex.exception.DocumentProcessingException if the file cannot be
   *     read
   */
  DocumentIndex indexFile(String docId, Path path);

  /**
   * Indexes an uploaded file. The original file name is used when {@code docId} is blank.
   *
   * @param docId the document ID, optional
   * @param file the uploaded file
   * @return the registered index
   */
  DocumentIndex indexUpload(String docId, MultipartFile file);

  /**
   * Restores and registers an index from its JSON projection.
   *
   * @param json output of {@link DocumentIndex#toJson()}
   * @return the registered index
   */
  DocumentIndex importJson(String json);

  /**
   * Gets a registered index.
   *
   * @param docId the document ID
   * @return the index
   * @throws com.flamingo.ai.pageindex.exception.DocumentNotFoundException if not registered
   */
  DocumentIndex getIndex(String docId);

  /** Gets all registered indexes ordered by document ID. */
  List<DocumentIndex> getAllIndexes();

  String getOutline(String docId);

  List<String> getNodeIds(String docId);

  NodeResult getNode(String docId, String nodeId);

  NodeResult getNodeWithChildren(String docId, String nodeId);

  List<ChildRef> getChildren(String docId, String nodeId);

  DocumentTree exportTree(String docId);

  /**
   * Removes a registered index.
   *
   * @param docId the document ID
   * @throws com.flamingo.ai.pageindex.exception.DocumentNotFoundException if not registered
   */
  void removeIndex(String docId);

  /** Number of registered indexes. */
  int count();

  /** Number of addressable sections summed over every registered index. */
  int totalSections();
}
