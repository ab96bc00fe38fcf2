package com.flamingo.ai.docstructure.exception;

/** Exception thrown when the parsed-tree provider cannot produce an element tree. */
public class ParsedTreeException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public ParsedTreeException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to read document structure";
  }

  public ParsedTreeException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to read document structure";
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
