package com.flamingo.ai.papersplit.exception;

/**
 * Exception thrown when a single document cannot be analyzed or split as a whole, e.g. the source
 * PDF is corrupt or the persisted analysis cannot be read. Failures of individual chapters or pages
 * never surface as this exception.
 */
public class DocumentProcessingException extends RuntimeException {

  /** Pipeline phase in which the document failed. */
  public enum Stage {
    ANALYZE("Failed to analyze document"),
    SPLIT("Failed to split document"),
    STORAGE("Failed to read or write document storage");

    private final String userMessage;

    Stage(String userMessage) {
      this.userMessage = userMessage;
    }
  }

  private final String documentName;
  private final Stage stage;

  public DocumentProcessingException(String documentName, Stage stage, String message) {
    super(message);
    this.documentName = documentName;
    this.stage = stage;
  }

  public DocumentProcessingException(
      String documentName, Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.documentName = documentName;
    this.stage = stage;
  }

  public String getDocumentName() {
    return documentName;
  }

  public Stage getStage() {
    return stage;
  }

  public String getUserMessage() {
    return stage.userMessage + ": " + documentName;
  }
}
