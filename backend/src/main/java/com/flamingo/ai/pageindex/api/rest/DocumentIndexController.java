package com.flamingo.ai.pageindex.api.rest;

import com.flamingo.ai.pageindex.api.dto.request.IndexDocumentRequest;
import com.flamingo.ai.pageindex.api.dto.response.DocumentIndexResponse;
import com.flamingo.ai.pageindex.service.document.DocumentIndexService;
import com.flamingo.ai.pageindex.service.index.DocumentIndex;
import com.flamingo.ai.pageindex.service.index.model.ChildRef;
import com.flamingo.ai.pageindex.service.index.model.DocumentTree;
import com.flamingo.ai.pageindex.service.index.model.NodeResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for building and navigating document indexes. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentIndexController {

  private final DocumentIndexService documentIndexService;

  /** Indexes a document from raw Markdown text. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentIndexResponse> indexDocument(
      @Valid @RequestBody IndexDocumentRequest request) {
    DocumentIndex index =
        documentIndexService.indexDocument(request.getDocId(), request.getContent());
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentIndexResponse.fromIndex(index));
  }

  /** Indexes an uploaded Markdown file. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentIndexResponse> uploadDocument(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "docId", required = false) String docId) {
    DocumentIndex index = documentIndexService.indexUpload(docId, file);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentIndexResponse.fromIndex(index));
  }

  /** Restores an index from its JSON projection. */
  @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentIndexResponse> importIndex(@RequestBody String json) {
    DocumentIndex index = documentIndexService.importJson(json);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentIndexResponse.fromIndex(index));
  }

  /** Lists all registered indexes. */
  @GetMapping
  public ResponseEntity<List<DocumentIndexResponse>> getAllDocuments() {
    List<DocumentIndexResponse> responses =
        documentIndexService.getAllIndexes().stream()
            .map(DocumentIndexResponse::fromIndex)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets a registered index summary. */
  @GetMapping("/{docId}")
  public ResponseEntity<DocumentIndexResponse> getDocument(@PathVariable String docId) {
    return ResponseEntity.ok(DocumentIndexResponse.fromIndex(documentIndexService.getIndex(docId)));
  }

  /** Gets the indented outline of a document. */
  @GetMapping(value = "/{docId}/outline", produces = "text/plain;charset=UTF-8")
  public ResponseEntity<String> getOutline(@PathVariable String docId) {
    return ResponseEntity.ok(documentIndexService.getOutline(docId));
  }

  /** Lists every node identifier in outline order. */
  @GetMapping("/{docId}/nodes")
  public ResponseEntity<List<String>> getNodeIds(@PathVariable String docId) {
    return ResponseEntity.ok(documentIndexService.getNodeIds(docId));
  }

  /** Gets one section, optionally with the text of all its descendants merged in. */
  @GetMapping("/{docId}/nodes/{nodeId}")
  public ResponseEntity<NodeResult> getNode(
      @PathVariable String docId,
      @PathVariable String nodeId,
      @RequestParam(value = "withChildren", defaultValue = "false") boolean withChildren) {
    NodeResult result =
        withChildren
            ? documentIndexService.getNodeWithChildren(docId, nodeId)
            : documentIndexService.getNode(docId, nodeId);
    return ResponseEntity.ok(result);
  }

  /** Lists the direct children of a section. */
  @GetMapping("/{docId}/nodes/{nodeId}/children")
  public ResponseEntity<List<ChildRef>> getChildren(
      @PathVariable String docId, @PathVariable String nodeId) {
    return ResponseEntity.ok(documentIndexService.getChildren(docId, nodeId));
  }

  /** Gets the full tree projection. */
  @GetMapping("/{docId}/tree")
  public ResponseEntity<DocumentTree> getTree(@PathVariable String docId) {
    return ResponseEntity.ok(documentIndexService.exportTree(docId));
  }

  /** Removes a registered index. */
  @DeleteMapping("/{docId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable String docId) {
    documentIndexService.removeIndex(docId);
    return ResponseEntity.noContent().build();
  }
}
