package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Pipeline stage recorded alongside the status. */
public enum ProcessingStage {
  TEXT_EXTRACTION("text_extraction"),
  AI_STRUCTURING("ai_structuring"),
  VALIDATION("validation"),
  COMPLETE("complete"),
  ERROR("error");

  private final String code;

  ProcessingStage(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }
}
