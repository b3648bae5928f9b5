package com.flamingo.ai.pageindex.exception;

/** Exception thrown in strict mode when a document contains no heading lines. */
public class EmptyDocumentException extends RuntimeException {

  private final String documentId;

  public EmptyDocumentException(String documentId) {
    super("Document contains no headings: " + documentId);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
