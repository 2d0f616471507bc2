package com.optwise.docai.app.exception;

/** A required external-service setting is missing. Raised at startup and fatal. */
public class MissingConfigurationException extends IllegalStateException {

  public MissingConfigurationException(String property) {
    super(property + " must be configured");
  }
}
