package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where "today" falls relative to the OPT application window and grace period. */
public enum TimelineStatus {
  FAR_BEFORE_WINDOW("far_before_window", "Planning Phase"),
  BEFORE_WINDOW("before_window", "Preparation Phase"),
  IN_WINDOW("in_window", "Application Window Open"),
  IN_WINDOW_URGENT("in_window_urgent", "Deadline Approaching"),
  IN_WINDOW_CRITICAL("in_window_critical", "URGENT - Apply Now"),
  GRACE_PERIOD("grace_period", "Grace Period"),
  EXPIRED("expired", "Grace Period Ended"),
  ERROR("error", "Unknown Status");

  private final String code;
  private final String displayLabel;

  TimelineStatus(String code, String displayLabel) {
    this.code = code;
    this.displayLabel = displayLabel;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  public String getDisplayLabel() {
    return displayLabel;
  }

  public boolean isInWindow() {
    return this == IN_WINDOW || this == IN_WINDOW_URGENT || this == IN_WINDOW_CRITICAL;
  }
}
