package com.optwise.docai.app.exception;

/**
 * Base type for failures raised while processing a document.
 *
 * <p>{@code code} is a stable machine-readable identifier used in API error bodies; the message
 * is safe to show to end users unless stated otherwise by a subclass.
 */
public class DocumentProcessingException extends RuntimeException {

  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  private final String code;

  public DocumentProcessingException(String code, String message) {
    super(message);
    this.code = code;
  }

  public DocumentProcessingException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
