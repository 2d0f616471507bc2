package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/** A highlighted notice on the timeline; {@code action} is null for informational notices. */
@Value
public class TimelineWarning {

  public enum Severity {
    CRITICAL,
    HIGH,
    INFO;

    @JsonValue
    public String code() {
      return name().toLowerCase();
    }
  }

  Severity severity;

  String message;

  String action;
}
