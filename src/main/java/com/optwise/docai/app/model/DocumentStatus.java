package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Lifecycle status stored on the document record. */
public enum DocumentStatus {
  UPLOADING("uploading"),
  PROCESSING("processing"),
  SUCCESS("success"),
  NEEDS_VERIFICATION("needs_verification"),
  FAILED("failed");

  private final String code;

  DocumentStatus(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  public static Optional<DocumentStatus> fromCode(String code) {
    return Arrays.stream(values()).filter(s -> s.code.equals(code)).findFirst();
  }
}
