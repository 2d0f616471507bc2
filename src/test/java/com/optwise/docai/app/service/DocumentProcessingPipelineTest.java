package com.optwise.docai.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.optwise.docai.app.exception.DocumentProcessingException;
import com.optwise.docai.app.exception.FieldStructuringException;
import com.optwise.docai.app.exception.TextExtractionException;
import com.optwise.docai.app.model.DocumentRef;
import com.optwise.docai.app.model.DocumentStatus;
import com.optwise.docai.app.model.DocumentStatusUpdate;
import com.optwise.docai.app.model.ExtractionFailureReason;
import com.optwise.docai.app.model.I20Field;
import com.optwise.docai.app.model.I20Fields;
import com.optwise.docai.app.model.ProcessingOutcome;
import com.optwise.docai.app.model.ProcessingOutcome.Kind;
import com.optwise.docai.app.model.ProcessingStage;
import com.optwise.docai.app.model.StructuringFailureReason;
import com.optwise.docai.app.model.TimelineStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentProcessingPipelineTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-11-01T12:00:00Z"), ZoneOffset.UTC);

  private static final DocumentRef REF =
      DocumentRef.builder()
          .bucket("i20-documents")
          .key("user-1/doc-1/i20.pdf")
          .userId("user-1")
          .documentId("doc-1")
          .fileName("i20.pdf")
          .build();

  private static final String RAW_TEXT = "CERTIFICATE OF ELIGIBILITY FOR NONIMMIGRANT STUDENT STATUS";

  @Mock private TextExtractionService textExtraction;
  @Mock private FieldStructuringService structuring;
  @Mock private DocumentStatusSink sink;

  private DocumentProcessingPipeline pipeline;

  @BeforeEach
  void setUp() {
    pipeline = pipeline(new OptTimelineCalculator(CLOCK));
  }

  private DocumentProcessingPipeline pipeline(OptTimelineCalculator calculator) {
    return new DocumentProcessingPipeline(
        textExtraction,
        structuring,
        new I20FieldValidator(CLOCK, 0.75),
        calculator,
        sink,
        false);
  }

  private static I20Fields.Builder validFields() {
    return I20Fields.builder()
        .put(I20Field.FULL_NAME, "Priya Raman", 0.95)
        .put(I20Field.SEVIS_ID, "N0012345678", 0.95)
        .put(I20Field.PROGRAM_END_DATE, "2026-05-15", 0.9)
        .put(I20Field.SCHOOL_NAME, "Northeastern University", 0.9);
  }

  private List<DocumentStatusUpdate> sinkUpdates(int expected) {
    ArgumentCaptor<DocumentStatusUpdate> captor = ArgumentCaptor.forClass(DocumentStatusUpdate.class);
    verify(sink, times(expected)).update(captor.capture());
    return captor.getAllValues();
  }

  @Test
  void successReportsProcessingThenCompleteWithTimeline() {
    I20Fields fields = validFields().build();
    when(textExtraction.extract("i20-documents", "user-1/doc-1/i20.pdf")).thenReturn(RAW_TEXT);
    when(structuring.structure(RAW_TEXT)).thenReturn(fields);

    ProcessingOutcome outcome = pipeline.process(REF);

    assertThat(outcome.getKind()).isEqualTo(Kind.SUCCESS);
    assertThat(outcome.getIssues()).isEmpty();
    ProcessingOutcome.Success success = (ProcessingOutcome.Success) outcome;
    assertThat(success.getFields()).isEqualTo(fields);
    assertThat(success.timeline()).hasValueSatisfying(
        t -> assertThat(t.getStatus()).isEqualTo(TimelineStatus.BEFORE_WINDOW));

    List<DocumentStatusUpdate> updates = sinkUpdates(2);
    assertThat(updates.get(0).getStatus()).isEqualTo(DocumentStatus.PROCESSING);
    assertThat(updates.get(0).getStage()).isEqualTo(ProcessingStage.TEXT_EXTRACTION);
    assertThat(updates.get(0).getUserId()).isEqualTo("user-1");
    assertThat(updates.get(1).getStatus()).isEqualTo(DocumentStatus.SUCCESS);
    assertThat(updates.get(1).getStage()).isEqualTo(ProcessingStage.COMPLETE);
    assertThat(updates.get(1).getData()).isEqualTo(fields);
    assertThat(updates.get(1).getTimeline()).isNotNull();
    assertThat(updates.get(1).getValidationIssues()).isEmpty();
    assertThat(updates.get(1).getError()).isNull();
  }

  @Test
  void extractionFailureSkipsLaterStages() {
    when(textExtraction.extract(anyString(), anyString()))
        .thenThrow(
            new TextExtractionException(
                ExtractionFailureReason.TEXT_TOO_SHORT,
                "Could not extract enough text (12 chars). Please upload a clear, readable PDF."));

    ProcessingOutcome outcome = pipeline.process(REF);

    assertThat(outcome.getKind()).isEqualTo(Kind.EXTRACTION_FAILED);
    assertThat(((ProcessingOutcome.ExtractionFailed) outcome).getReason())
        .isEqualTo(ExtractionFailureReason.TEXT_TOO_SHORT);
    verifyNoInteractions(structuring);

    DocumentStatusUpdate terminal = sinkUpdates(2).get(1);
    assertThat(terminal.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(terminal.getStage()).isEqualTo(ProcessingStage.TEXT_EXTRACTION);
    assertThat(terminal.getError())
        .isEqualTo("Could not extract enough text (12 chars). Please upload a clear, readable PDF.");
  }

  @Test
  void structuringFailureIsReportedAtAiStage() {
    when(textExtraction.extract(anyString(), anyString())).thenReturn(RAW_TEXT);
    when(structuring.structure(RAW_TEXT))
        .thenThrow(
            new FieldStructuringException(StructuringFailureReason.UNPARSEABLE_RESPONSE, null));

    ProcessingOutcome outcome = pipeline.process(REF);

    assertThat(outcome.getKind()).isEqualTo(Kind.STRUCTURING_FAILED);
    DocumentStatusUpdate terminal = sinkUpdates(2).get(1);
    assertThat(terminal.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(terminal.getStage()).isEqualTo(ProcessingStage.AI_STRUCTURING);
    assertThat(terminal.getError()).isEqualTo("AI response could not be parsed. Please try again.");
  }

  @Test
  void criticalIssuesFailValidationAndNameTheFields() {
    I20Fields fields =
        I20Fields.builder()
            .put(I20Field.FULL_NAME, "Priya Raman", 0.95)
            .put(I20Field.PROGRAM_END_DATE, "2026-05-15", 0.9)
            .put(I20Field.SCHOOL_NAME, "NU", 0.9)
            .build();
    when(textExtraction.extract(anyString(), anyString())).thenReturn(RAW_TEXT);
    when(structuring.structure(RAW_TEXT)).thenReturn(fields);

    ProcessingOutcome outcome = pipeline.process(REF);

    assertThat(outcome.getKind()).isEqualTo(Kind.VALIDATION_FAILED);
    assertThat(outcome.getMessage())
        .isEqualTo("Critical fields missing or invalid: sevis_id, school_name");
    assertThat(outcome.extractedFields()).contains(fields);

    DocumentStatusUpdate terminal = sinkUpdates(2).get(1);
    assertThat(terminal.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(terminal.getStage()).isEqualTo(ProcessingStage.VALIDATION);
    assertThat(terminal.getError()).isEqualTo(outcome.getMessage());
    assertThat(terminal.getValidationIssues()).hasSize(2);
    assertThat(terminal.getData()).isNull();
  }

  @Test
  void unparseableEndDateFailsValidationWithoutTimeline() {
    I20Fields fields = validFields().put(I20Field.PROGRAM_END_DATE, "not-a-date", 0.9).build();
    when(textExtraction.extract(anyString(), anyString())).thenReturn(RAW_TEXT);
    when(structuring.structure(RAW_TEXT)).thenReturn(fields);

    ProcessingOutcome outcome = pipeline.process(REF);

    assertThat(outcome.getKind()).isEqualTo(Kind.VALIDATION_FAILED);
    assertThat(outcome.getMessage())
        .isEqualTo("Critical fields missing or invalid: program_end_date");
    assertThat(outcome.getIssues())
        .singleElement()
        .satisfies(
            i -> {
              assertThat(i.getField()).isEqualTo(I20Field.PROGRAM_END_DATE);
              assertThat(i.isCritical()).isTrue();
              assertThat(i.getValue()).isEqualTo("not-a-date");
            });

    DocumentStatusUpdate terminal = sinkUpdates(2).get(1);
    assertThat(terminal.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(terminal.getStage()).isEqualTo(ProcessingStage.VALIDATION);
    assertThat(terminal.getTimeline()).isNull();
  }

  @Test
  void warningsOnlyNeedVerification() {
    I20Fields fields = validFields().put(I20Field.FULL_NAME, "Priya Raman", 0.6).build();
    when(textExtraction.extract(anyString(), anyString())).thenReturn(RAW_TEXT);
    when(structuring.structure(RAW_TEXT)).thenReturn(fields);

    ProcessingOutcome outcome = pipeline.process(REF);

    assertThat(outcome.getKind()).isEqualTo(Kind.NEEDS_VERIFICATION);
    assertThat(outcome.getIssues()).singleElement().matches(i -> i.isWarning());

    DocumentStatusUpdate terminal = sinkUpdates(2).get(1);
    assertThat(terminal.getStatus()).isEqualTo(DocumentStatus.NEEDS_VERIFICATION);
    assertThat(terminal.getStage()).isEqualTo(ProcessingStage.VALIDATION);
    assertThat(terminal.getData()).isEqualTo(fields);
    assertThat(terminal.getValidationIssues()).hasSize(1);
    assertThat(terminal.getTimeline()).isNull();
  }

  @Test
  void sinkFailuresDoNotChangeTheOutcome() {
    when(textExtraction.extract(anyString(), anyString())).thenReturn(RAW_TEXT);
    when(structuring.structure(RAW_TEXT)).thenReturn(validFields().build());
    doThrow(new IllegalStateException("throttled")).when(sink).update(any());

    ProcessingOutcome outcome = pipeline.process(REF);

    assertThat(outcome.getKind()).isEqualTo(Kind.SUCCESS);
    verify(sink, times(2)).update(any());
  }

  @Test
  void timelineFailureStillSucceedsWithoutTimeline() {
    OptTimelineCalculator broken = mock(OptTimelineCalculator.class);
    when(broken.calculate(anyString())).thenThrow(new IllegalStateException("boom"));
    when(textExtraction.extract(anyString(), anyString())).thenReturn(RAW_TEXT);
    when(structuring.structure(RAW_TEXT)).thenReturn(validFields().build());

    ProcessingOutcome outcome = pipeline(broken).process(REF);

    assertThat(outcome.getKind()).isEqualTo(Kind.SUCCESS);
    assertThat(((ProcessingOutcome.Success) outcome).timeline()).isEmpty();
    assertThat(sinkUpdates(2).get(1).getTimeline()).isNull();
  }

  @Test
  void unexpectedErrorReportsFailedAndRethrows() {
    when(textExtraction.extract(anyString(), anyString())).thenReturn(RAW_TEXT);
    when(structuring.structure(RAW_TEXT)).thenThrow(new IllegalStateException("prompt missing"));

    assertThatThrownBy(() -> pipeline.process(REF))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("Processing failed")
        .hasCauseInstanceOf(IllegalStateException.class)
        .extracting(e -> ((DocumentProcessingException) e).getCode())
        .isEqualTo(DocumentProcessingException.INTERNAL_ERROR);

    DocumentStatusUpdate terminal = sinkUpdates(2).get(1);
    assertThat(terminal.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(terminal.getStage()).isEqualTo(ProcessingStage.ERROR);
    assertThat(terminal.getError()).isEqualTo("Processing failed");
    assertThat(ThreadContext.get("corrId")).isNull();
  }
}
