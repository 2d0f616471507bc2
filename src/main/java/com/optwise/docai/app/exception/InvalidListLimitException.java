package com.optwise.docai.app.exception;

public class InvalidListLimitException extends DocumentProcessingException {

  public InvalidListLimitException(int min, int max) {
    super("INVALID_LIMIT", "Limit must be between " + min + " and " + max);
  }
}
