package com.optwise.docai.app.model;

/** Why the AI structuring stage failed. Messages are safe to show to the user. */
public enum StructuringFailureReason {
  /** The model call kept failing (transport error, timeout) until retries ran out. */
  AI_UNAVAILABLE("AI processing failed. Please try again or contact support."),
  /** The call succeeded but the body was not a JSON object. */
  UNPARSEABLE_RESPONSE("AI response could not be parsed. Please try again.");

  private final String userMessage;

  StructuringFailureReason(String userMessage) {
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
