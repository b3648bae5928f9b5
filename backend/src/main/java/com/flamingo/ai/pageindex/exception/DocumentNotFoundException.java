package com.flamingo.ai.pageindex.exception;

/** Exception thrown when no index is registered under a document ID. */
public class DocumentNotFoundException extends RuntimeException {

  private final String documentId;

  public DocumentNotFoundException(String documentId) {
    super("Document not found: " + documentId);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
