package com.optwise.docai.app.exception;

import com.optwise.docai.app.model.ExtractionFailureReason;

/** OCR stage failure: the object was unreadable, the service failed, or too little text came back. */
public class TextExtractionException extends DocumentProcessingException {

  private final ExtractionFailureReason reason;

  public TextExtractionException(ExtractionFailureReason reason, String message) {
    super("EXTRACTION_" + reason.name(), message);
    this.reason = reason;
  }

  public TextExtractionException(ExtractionFailureReason reason, String message, Throwable cause) {
    super("EXTRACTION_" + reason.name(), message, cause);
    this.reason = reason;
  }

  public ExtractionFailureReason getReason() {
    return reason;
  }
}
