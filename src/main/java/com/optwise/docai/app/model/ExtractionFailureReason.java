package com.optwise.docai.app.model;

/** Why the OCR stage could not produce usable text. Messages are safe to show to the user. */
public enum ExtractionFailureReason {
  DOCUMENT_NOT_FOUND("Document not found or cannot be accessed. Please try uploading again."),
  UNSUPPORTED_DOCUMENT("Document type not supported. Please upload a PDF file."),
  SERVICE_ERROR("Text extraction failed. Please try a different file or contact support."),
  TEXT_TOO_SHORT("Could not extract enough text. Please upload a clear, readable PDF.");

  private final String userMessage;

  ExtractionFailureReason(String userMessage) {
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
