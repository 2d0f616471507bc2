package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

/**
 * One finding of the field validator. Issues are data, not exceptions: they travel with the
 * processing outcome to the status record and the API.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationIssue {

  public enum Severity {
    CRITICAL,
    WARNING;

    @JsonValue
    public String code() {
      return name().toLowerCase();
    }
  }

  I20Field field;

  Severity severity;

  String message;

  /** Hint shown to the user; optional. */
  String suggestion;

  /** The offending extracted value; optional. */
  String value;

  public boolean isCritical() {
    return severity == Severity.CRITICAL;
  }

  public boolean isWarning() {
    return severity == Severity.WARNING;
  }
}
