package com.flamingo.ai.pageindex.service.document;

import com.flamingo.ai.pageindex.config.PageIndexConfig;
import com.flamingo.ai.pageindex.exception.DocumentNotFoundException;
import com.flamingo.ai.pageindex.exception.DocumentProcessingException;
import com.flamingo.ai.pageindex.exception.EmptyDocumentException;
import com.flamingo.ai.pageindex.service.index.DocumentIndex;
import com.flamingo.ai.pageindex.service.index.HeadingTreeBuilder;
import com.flamingo.ai.pageindex.service.index.model.ChildRef;
import com.flamingo.ai.pageindex.service.index.model.DocumentTree;
import com.flamingo.ai.pageindex.service.index.model.NodeResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** In-memory implementation of the DocumentIndexService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIndexServiceImpl implements DocumentIndexService {

  private final HeadingTreeBuilder treeBuilder;
  private final PageIndexConfig config;
  private final MeterRegistry meterRegistry;

  private final Map<String, DocumentIndex> indexes = new ConcurrentHashMap<>();

  @Override
  @Timed(value = "pageindex.index", description = "Time to build a document index")
  public DocumentIndex indexDocument(String docId, String content) {
    DocumentIndex index = treeBuilder.build(docId, content);
    return register(index);
  }

  @Override
  @Timed(value = "pageindex.indexFile", description = "Time to read and index a file")
  public DocumentIndex indexFile(String docId, Path path) {
    String content;
    try {
      content = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to read document {} from {}: {}", docId, path, e.getMessage());
      throw new DocumentProcessingException(
          docId, "Failed to read " + path + ": " + e.getMessage(), e);
    }
    return indexDocument(docId, content);
  }

  @Override
  @Timed(value = "pageindex.indexUpload", description = "Time to index an uploaded file")
  public DocumentIndex indexUpload(String docId, MultipartFile file) {
    String effectiveId =
        docId != null && !docId.isBlank() ? docId : file.getOriginalFilename();
    if (effectiveId == null || effectiveId.isBlank()) {
      throw new IllegalArgumentException("Document ID is required when the file has no name");
    }

    long maxSize = config.getUpload().getMaxFileSizeBytes();
    if (file.getSize() > maxSize) {
      throw new DocumentProcessingException(
          effectiveId,
          String.format("File size %d exceeds limit of %d bytes", file.getSize(), maxSize),
          "Document is too large");
    }

    String content;
    try {
      content = new String(file.getBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to read uploaded document {}: {}", effectiveId, e.getMessage());
      throw new DocumentProcessingException(
          effectiveId, "Failed to read upload: " + e.getMessage(), e);
    }
    return indexDocument(effectiveId, content);
  }

  @Override
  @Timed(value = "pageindex.import", description = "Time to restore an index from JSON")
  public DocumentIndex importJson(String json) {
    return register(DocumentIndex.fromJson(json));
  }

  @Override
  public DocumentIndex getIndex(String docId) {
    DocumentIndex index = docId == null ? null : indexes.get(docId);
    if (index == null) {
      throw new DocumentNotFoundException(docId);
    }
    return index;
  }

  @Override
  public List<DocumentIndex> getAllIndexes() {
    return indexes.values().stream()
        .sorted(Comparator.comparing(DocumentIndex::getDocId))
        .toList();
  }

  @Override
  public String getOutline(String docId) {
    return getIndex(docId).outline(config.getOutline().getIndentWidth());
  }

  @Override
  public List<String> getNodeIds(String docId) {
    return getIndex(docId).nodeIds();
  }

  @Override
  @Timed(value = "pageindex.getNode", description = "Time to look up a section")
  public NodeResult getNode(String docId, String nodeId) {
    return getIndex(docId).getNode(nodeId);
  }

  @Override
  @Timed(value = "pageindex.getNodeWithChildren", description = "Time to merge a subtree")
  public NodeResult getNodeWithChildren(String docId, String nodeId) {
    return getIndex(docId).getNodeWithChildren(nodeId);
  }

  @Override
  public List<ChildRef> getChildren(String docId, String nodeId) {
    return getIndex(docId).getChildren(nodeId);
  }

  @Override
  public DocumentTree exportTree(String docId) {
    return getIndex(docId).toTree();
  }

  @Override
  public void removeIndex(String docId) {
    if (docId == null || indexes.remove(docId) == null) {
      throw new DocumentNotFoundException(docId);
    }
    meterRegistry.counter("pageindex.documents.removed").increment();
    log.info("Removed index for document {}", docId);
  }

  @Override
  public int count() {
    return indexes.size();
  }

  @Override
  public int totalSections() {
    return indexes.values().stream().mapToInt(DocumentIndex::size).sum();
  }

  private DocumentIndex register(DocumentIndex index) {
    if (index.isEmpty() && config.isRejectEmptyDocuments()) {
      throw new EmptyDocumentException(index.getDocId());
    }
    DocumentIndex previous = indexes.put(index.getDocId(), index);
    meterRegistry.counter("pageindex.documents.indexed").increment();
    log.info(
        "{} index for document {} ({} sections)",
        previous == null ? "Registered" : "Replaced",
        index.getDocId(),
        index.size());
    return index;
  }
}
