package com.optwise.docai.app.service;

import com.optwise.docai.app.model.DocumentStatusUpdate;

/** Receives status reports from the pipeline; persistence is up to the implementation. */
public interface DocumentStatusSink {

  /**
   * Records the current status of a document. Implementations may throw; the pipeline logs and
   * tolerates sink failures.
   */
  void update(DocumentStatusUpdate update);
}
