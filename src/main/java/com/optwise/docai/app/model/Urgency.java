package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Urgency {
  NONE,
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  @JsonValue
  public String code() {
    return name().toLowerCase();
  }
}
