package com.optwise.docai.app.model;

import java.util.List;
import java.util.Optional;
import lombok.Value;

/**
 * Terminal result of one document-processing invocation.
 *
 * <p>The set of outcomes is closed. Callers branch on {@link #getKind()} with a {@code switch}
 * expression so that adding an outcome breaks every place that has to handle it.
 *
 * <ul>
 *   <li>{@link ExtractionFailed} - OCR could not produce usable text
 *   <li>{@link StructuringFailed} - the AI step failed or returned garbage
 *   <li>{@link ValidationFailed} - at least one critical validation issue
 *   <li>{@link NeedsVerification} - only warnings; a human should confirm the data
 *   <li>{@link Success} - clean extraction, optionally with an OPT timeline attached
 * </ul>
 */
public sealed interface ProcessingOutcome {

  enum Kind {
    EXTRACTION_FAILED,
    STRUCTURING_FAILED,
    VALIDATION_FAILED,
    NEEDS_VERIFICATION,
    SUCCESS
  }

  Kind getKind();

  /** User-safe description of the outcome; null for {@link Success}. */
  String getMessage();

  default List<ValidationIssue> getIssues() {
    return List.of();
  }

  default Optional<I20Fields> extractedFields() {
    return Optional.empty();
  }

  @Value
  final class ExtractionFailed implements ProcessingOutcome {
    ExtractionFailureReason reason;
    String message;

    @Override
    public Kind getKind() {
      return Kind.EXTRACTION_FAILED;
    }
  }

  @Value
  final class StructuringFailed implements ProcessingOutcome {
    StructuringFailureReason reason;
    String message;

    @Override
    public Kind getKind() {
      return Kind.STRUCTURING_FAILED;
    }
  }

  @Value
  final class ValidationFailed implements ProcessingOutcome {
    I20Fields fields;
    List<ValidationIssue> issues;
    String message;

    public ValidationFailed(I20Fields fields, List<ValidationIssue> issues, String message) {
      this.fields = fields;
      this.issues = List.copyOf(issues);
      this.message = message;
    }

    @Override
    public Kind getKind() {
      return Kind.VALIDATION_FAILED;
    }

    @Override
    public Optional<I20Fields> extractedFields() {
      return Optional.of(fields);
    }
  }

  @Value
  final class NeedsVerification implements ProcessingOutcome {
    public static final String MESSAGE = "Data extracted but needs verification";

    I20Fields fields;
    List<ValidationIssue> issues;

    public NeedsVerification(I20Fields fields, List<ValidationIssue> issues) {
      this.fields = fields;
      this.issues = List.copyOf(issues);
    }

    @Override
    public Kind getKind() {
      return Kind.NEEDS_VERIFICATION;
    }

    @Override
    public String getMessage() {
      return MESSAGE;
    }

    @Override
    public Optional<I20Fields> extractedFields() {
      return Optional.of(fields);
    }
  }

  @Value
  final class Success implements ProcessingOutcome {
    I20Fields fields;

    /** Best-effort; absent when the end date could not be turned into a timeline. */
    OptTimeline timeline;

    public Optional<OptTimeline> timeline() {
      return Optional.ofNullable(timeline);
    }

    @Override
    public Kind getKind() {
      return Kind.SUCCESS;
    }

    @Override
    public String getMessage() {
      return null;
    }

    @Override
    public Optional<I20Fields> extractedFields() {
      return Optional.of(fields);
    }
  }
}
