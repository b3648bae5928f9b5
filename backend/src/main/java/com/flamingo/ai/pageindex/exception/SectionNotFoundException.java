package com.flamingo.ai.pageindex.exception;

/**
 * Exception thrown when a node identifier does not match any section of a document index.
 *
 * <p>Identifiers are matched exactly; there is no prefix or fuzzy resolution.
 */
public class SectionNotFoundException extends RuntimeException {

  private final String documentId;
  private final String nodeId;

  public SectionNotFoundException(String documentId, String nodeId) {
    super(String.format("Section %s not found in document %s", nodeId, documentId));
    this.documentId = documentId;
    this.nodeId = nodeId;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getNodeId() {
    return nodeId;
  }
}
