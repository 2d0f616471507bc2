package com.optwise.docai.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optwise.docai.app.exception.TextExtractionException;
import com.optwise.docai.app.model.ExtractionFailureReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentRequest;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentResponse;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.FeatureType;
import software.amazon.awssdk.services.textract.model.InvalidS3ObjectException;
import software.amazon.awssdk.services.textract.model.UnsupportedDocumentException;

@ExtendWith(MockitoExtension.class)
class TextExtractionServiceTest {

  private static final String LINE_1 = "U.S. Department of Homeland Security Certificate of Eligibility";
  private static final String LINE_2 = "SEVIS ID: N0012345678 Student: RAMAN, PRIYA Program End Date 05/15/2026";

  @Mock private TextractClient textract;

  private TextExtractionService service;

  @BeforeEach
  void setUp() {
    service = new TextExtractionService(textract, 100);
  }

  @Test
  void joinsLineBlocksInServiceOrder() {
    when(textract.analyzeDocument(any(AnalyzeDocumentRequest.class)))
        .thenReturn(
            AnalyzeDocumentResponse.builder()
                .blocks(
                    Block.builder().blockType(BlockType.PAGE).build(),
                    line(LINE_1),
                    Block.builder().blockType(BlockType.WORD).text("U.S.").build(),
                    line(""),
                    line(LINE_2))
                .build());

    String text = service.extract("i20-documents", "user-1/doc-1/i20.pdf");

    assertThat(text).isEqualTo(LINE_1 + "\n" + LINE_2);

    ArgumentCaptor<AnalyzeDocumentRequest> req = ArgumentCaptor.forClass(AnalyzeDocumentRequest.class);
    verify(textract).analyzeDocument(req.capture());
    assertThat(req.getValue().document().s3Object().bucket()).isEqualTo("i20-documents");
    assertThat(req.getValue().document().s3Object().name()).isEqualTo("user-1/doc-1/i20.pdf");
    assertThat(req.getValue().featureTypes()).containsExactly(FeatureType.FORMS, FeatureType.TABLES);
  }

  @Test
  void tooLittleTextIsAFailure() {
    when(textract.analyzeDocument(any(AnalyzeDocumentRequest.class)))
        .thenReturn(AnalyzeDocumentResponse.builder().blocks(line("I-20")).build());

    assertThatThrownBy(() -> service.extract("b", "u/d/f.pdf"))
        .isInstanceOf(TextExtractionException.class)
        .hasMessage("Could not extract enough text (4 chars). Please upload a clear, readable PDF.")
        .extracting(e -> ((TextExtractionException) e).getReason())
        .isEqualTo(ExtractionFailureReason.TEXT_TOO_SHORT);
  }

  @Test
  void missingObjectIsDocumentNotFound() {
    when(textract.analyzeDocument(any(AnalyzeDocumentRequest.class)))
        .thenThrow((InvalidS3ObjectException) InvalidS3ObjectException.builder().message("nope").build());

    assertThatThrownBy(() -> service.extract("b", "u/d/f.pdf"))
        .isInstanceOf(TextExtractionException.class)
        .hasMessage("Document not found or cannot be accessed. Please try uploading again.")
        .extracting(e -> ((TextExtractionException) e).getReason())
        .isEqualTo(ExtractionFailureReason.DOCUMENT_NOT_FOUND);
  }

  @Test
  void unsupportedFormatIsReported() {
    when(textract.analyzeDocument(any(AnalyzeDocumentRequest.class)))
        .thenThrow(
            (UnsupportedDocumentException)
                UnsupportedDocumentException.builder().message("bad format").build());

    assertThatThrownBy(() -> service.extract("b", "u/d/f.docx"))
        .isInstanceOf(TextExtractionException.class)
        .extracting(e -> ((TextExtractionException) e).getReason())
        .isEqualTo(ExtractionFailureReason.UNSUPPORTED_DOCUMENT);
  }

  @Test
  void anyOtherErrorIsServiceError() {
    when(textract.analyzeDocument(any(AnalyzeDocumentRequest.class)))
        .thenThrow(SdkClientException.create("api call timeout"));

    assertThatThrownBy(() -> service.extract("b", "u/d/f.pdf"))
        .isInstanceOf(TextExtractionException.class)
        .hasCauseInstanceOf(SdkClientException.class)
        .extracting(e -> ((TextExtractionException) e).getReason())
        .isEqualTo(ExtractionFailureReason.SERVICE_ERROR);
  }

  private static Block line(String text) {
    return Block.builder().blockType(BlockType.LINE).text(text).build();
  }
}
