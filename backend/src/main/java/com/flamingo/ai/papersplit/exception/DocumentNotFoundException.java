package com.flamingo.ai.papersplit.exception;

/** Exception thrown when a source document or its analysis artifact does not exist in storage. */
public class DocumentNotFoundException extends RuntimeException {

  private final String documentName;

  public DocumentNotFoundException(String documentName) {
    super("Document not found: " + documentName);
    this.documentName = documentName;
  }

  public DocumentNotFoundException(String documentName, String message) {
    super(message);
    this.documentName = documentName;
  }

  public String getDocumentName() {
    return documentName;
  }
}
