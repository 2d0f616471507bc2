package com.optwise.docai.app.exception;

/** The storage key does not follow {@code userId/documentId/fileName}. */
public class InvalidDocumentKeyException extends DocumentProcessingException {

  public InvalidDocumentKeyException(String key) {
    super("INVALID_S3_KEY", "Invalid S3 key format: " + key);
  }
}
