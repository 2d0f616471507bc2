package com.optwise.docai.app.exception;

import com.optwise.docai.app.model.StructuringFailureReason;

/** AI structuring failure: retries exhausted on the model call, or an unparseable response. */
public class FieldStructuringException extends DocumentProcessingException {

  private final StructuringFailureReason reason;

  public FieldStructuringException(StructuringFailureReason reason, Throwable cause) {
    super("STRUCTURING_" + reason.name(), reason.getUserMessage(), cause);
    this.reason = reason;
  }

  public StructuringFailureReason getReason() {
    return reason;
  }
}
