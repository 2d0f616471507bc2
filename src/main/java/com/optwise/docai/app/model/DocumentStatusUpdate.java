package com.optwise.docai.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * One write to the status sink. Only {@code userId}, {@code documentId} and {@code status} are
 * mandatory; everything else is written only when non-null.
 */
@Value
@Builder
public class DocumentStatusUpdate {

  String userId;

  String documentId;

  DocumentStatus status;

  ProcessingStage stage;

  I20Fields data;

  OptTimeline timeline;

  String error;

  List<ValidationIssue> validationIssues;
}
