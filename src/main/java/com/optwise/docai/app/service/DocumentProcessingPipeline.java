package com.optwise.docai.app.service;

import com.optwise.docai.app.exception.DocumentProcessingException;
import com.optwise.docai.app.exception.FieldStructuringException;
import com.optwise.docai.app.exception.TextExtractionException;
import com.optwise.docai.app.model.DocumentRef;
import com.optwise.docai.app.model.DocumentStatus;
import com.optwise.docai.app.model.DocumentStatusUpdate;
import com.optwise.docai.app.model.ExtractedField;
import com.optwise.docai.app.model.I20Fields;
import com.optwise.docai.app.model.OptTimeline;
import com.optwise.docai.app.model.ProcessingOutcome;
import com.optwise.docai.app.model.ProcessingOutcome.ExtractionFailed;
import com.optwise.docai.app.model.ProcessingOutcome.NeedsVerification;
import com.optwise.docai.app.model.ProcessingOutcome.StructuringFailed;
import com.optwise.docai.app.model.ProcessingOutcome.Success;
import com.optwise.docai.app.model.ProcessingOutcome.ValidationFailed;
import com.optwise.docai.app.model.ProcessingStage;
import com.optwise.docai.app.model.ValidationIssue;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.ThreadContext;

/**
 * DocumentProcessingPipeline
 *
 * <ol>
 *   <li>Report {@code processing} / {@code text_extraction} to the status sink.
 *   <li>OCR the S3 object via {@link TextExtractionService}.
 *   <li>Structure the raw text into I-20 fields via {@link FieldStructuringService}.
 *   <li>Validate the fields with {@link I20FieldValidator} and pick the terminal outcome.
 *   <li>On success, attach the OPT timeline (best effort).
 *   <li>Report the terminal outcome to the status sink.
 * </ol>
 *
 * One forward pass per invocation; nothing is retried here. The instance holds no per-document
 * state and is shared across invocations.
 */
@Log4j2
public class DocumentProcessingPipeline {

  static final String CRITICAL_PREFIX = "Critical fields missing or invalid: ";
  static final String GENERIC_FAILURE = "Processing failed";

  private final TextExtractionService textExtraction;
  private final FieldStructuringService structuring;
  private final I20FieldValidator validator;
  private final OptTimelineCalculator timelineCalculator;
  private final DocumentStatusSink statusSink;
  private final boolean exposeErrorDetails;

  public DocumentProcessingPipeline(
      TextExtractionService textExtraction,
      FieldStructuringService structuring,
      I20FieldValidator validator,
      OptTimelineCalculator timelineCalculator,
      DocumentStatusSink statusSink,
      boolean exposeErrorDetails) {
    this.textExtraction = Objects.requireNonNull(textExtraction);
    this.structuring = Objects.requireNonNull(structuring);
    this.validator = Objects.requireNonNull(validator);
    this.timelineCalculator = Objects.requireNonNull(timelineCalculator);
    this.statusSink = Objects.requireNonNull(statusSink);
    this.exposeErrorDetails = exposeErrorDetails;
  }

  /**
   * Runs one document end to end and returns its terminal outcome.
   *
   * @throws DocumentProcessingException with code {@code INTERNAL_ERROR} for failures that are not
   *     part of the outcome model; a {@code failed} status is still reported first
   */
  public ProcessingOutcome process(DocumentRef ref) {
    String corrId = UUID.randomUUID().toString();
    ThreadContext.put("corrId", corrId);
    ThreadContext.put("docId", ref.getDocumentId());
    long t0 = System.nanoTime();

    log.info(
        "pipeline.start corrId={} userId={} docId={} s3={}",
        corrId,
        ref.getUserId(),
        ref.getDocumentId(),
        ref.s3Uri());

    try {
      report(
          DocumentStatusUpdate.builder()
              .userId(ref.getUserId())
              .documentId(ref.getDocumentId())
              .status(DocumentStatus.PROCESSING)
              .stage(ProcessingStage.TEXT_EXTRACTION)
              .build());

      ProcessingOutcome outcome = run(ref);
      report(terminalUpdate(ref, outcome));

      log.info(
          "pipeline.done docId={} outcome={} issues={} durationMs={}",
          ref.getDocumentId(),
          outcome.getKind(),
          outcome.getIssues().size(),
          (System.nanoTime() - t0) / 1_000_000);
      return outcome;

    } catch (RuntimeException e) {
      log.error(
          "pipeline.error docId={} durationMs={} type={} msg={}",
          ref.getDocumentId(),
          (System.nanoTime() - t0) / 1_000_000,
          e.getClass().getSimpleName(),
          e.getMessage(),
          e);
      report(
          DocumentStatusUpdate.builder()
              .userId(ref.getUserId())
              .documentId(ref.getDocumentId())
              .status(DocumentStatus.FAILED)
              .stage(ProcessingStage.ERROR)
              .error(exposeErrorDetails ? GENERIC_FAILURE + ": " + e.getMessage() : GENERIC_FAILURE)
              .build());
      throw new DocumentProcessingException(
          DocumentProcessingException.INTERNAL_ERROR, GENERIC_FAILURE, e);
    } finally {
      ThreadContext.remove("corrId");
      ThreadContext.remove("docId");
    }
  }

  private ProcessingOutcome run(DocumentRef ref) {
    String rawText;
    try {
      rawText = textExtraction.extract(ref.getBucket(), ref.getKey());
    } catch (TextExtractionException e) {
      log.warn("pipeline.extraction.failed docId={} reason={}", ref.getDocumentId(), e.getReason());
      return new ExtractionFailed(e.getReason(), e.getMessage());
    }

    I20Fields fields;
    try {
      fields = structuring.structure(rawText);
    } catch (FieldStructuringException e) {
      log.warn("pipeline.structuring.failed docId={} reason={}", ref.getDocumentId(), e.getReason());
      return new StructuringFailed(e.getReason(), e.getMessage());
    }

    List<ValidationIssue> issues = validator.validate(fields);

    List<ValidationIssue> critical =
        issues.stream().filter(ValidationIssue::isCritical).collect(Collectors.toList());
    if (!critical.isEmpty()) {
      String failing =
          critical.stream()
              .map(i -> i.getField().getJsonName())
              .distinct()
              .collect(Collectors.joining(", "));
      return new ValidationFailed(fields, issues, CRITICAL_PREFIX + failing);
    }
    if (issues.stream().anyMatch(ValidationIssue::isWarning)) {
      return new NeedsVerification(fields, issues);
    }
    return new Success(fields, timelineFor(ref, fields).orElse(null));
  }

  /** Best effort: a missing or unusable end date only means no timeline. */
  private Optional<OptTimeline> timelineFor(DocumentRef ref, I20Fields fields) {
    Optional<String> endDate = fields.programEndDate().map(ExtractedField::getValue);
    if (endDate.isEmpty()) return Optional.empty();
    try {
      OptTimeline timeline = timelineCalculator.calculate(endDate.get());
      if (timeline.isError()) {
        log.warn("pipeline.timeline.error docId={} msg={}", ref.getDocumentId(), timeline.getError());
        return Optional.empty();
      }
      log.info("pipeline.timeline docId={} status={}", ref.getDocumentId(), timeline.getStatus());
      return Optional.of(timeline);
    } catch (RuntimeException e) {
      log.error("pipeline.timeline.failed docId={} msg={}", ref.getDocumentId(), e.getMessage(), e);
      return Optional.empty();
    }
  }

  private static DocumentStatusUpdate terminalUpdate(DocumentRef ref, ProcessingOutcome outcome) {
    DocumentStatusUpdate.DocumentStatusUpdateBuilder b =
        DocumentStatusUpdate.builder().userId(ref.getUserId()).documentId(ref.getDocumentId());

    return switch (outcome.getKind()) {
      case EXTRACTION_FAILED -> b.status(DocumentStatus.FAILED)
          .stage(ProcessingStage.TEXT_EXTRACTION)
          .error(outcome.getMessage())
          .build();
      case STRUCTURING_FAILED -> b.status(DocumentStatus.FAILED)
          .stage(ProcessingStage.AI_STRUCTURING)
          .error(outcome.getMessage())
          .build();
      case VALIDATION_FAILED -> b.status(DocumentStatus.FAILED)
          .stage(ProcessingStage.VALIDATION)
          .error(outcome.getMessage())
          .validationIssues(outcome.getIssues())
          .build();
      case NEEDS_VERIFICATION -> b.status(DocumentStatus.NEEDS_VERIFICATION)
          .stage(ProcessingStage.VALIDATION)
          .data(((NeedsVerification) outcome).getFields())
          .validationIssues(outcome.getIssues())
          .build();
      case SUCCESS -> b.status(DocumentStatus.SUCCESS)
          .stage(ProcessingStage.COMPLETE)
          .data(((Success) outcome).getFields())
          .timeline(((Success) outcome).timeline().orElse(null))
          .validationIssues(List.of())
          .build();
    };
  }

  private void report(DocumentStatusUpdate update) {
    try {
      statusSink.update(update);
    } catch (RuntimeException e) {
      // status writes never change the outcome
      log.error(
          "pipeline.status.write-failed docId={} status={} msg={}",
          update.getDocumentId(),
          update.getStatus(),
          e.getMessage(),
          e);
    }
  }
}
