package com.optwise.docai.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optwise.docai.app.exception.FieldStructuringException;
import com.optwise.docai.app.model.ExtractedField;
import com.optwise.docai.app.model.I20Field;
import com.optwise.docai.app.model.I20Fields;
import com.optwise.docai.app.model.StructuringFailureReason;
import com.optwise.docai.app.prompt.PromptConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FieldStructuringServiceTest {

  private static final String GOOD_RESPONSE =
      "{"
          + "\"full_name\": {\"value\": \"Priya Raman\", \"confidence\": 0.97},"
          + "\"sevis_id\": {\"value\": \"N0012345678\", \"confidence\": 0.92},"
          + "\"program_end_date\": {\"value\": \"2026-05-15\", \"confidence\": 0.9},"
          + "\"school_name\": {\"value\": \"Northeastern University\", \"confidence\": 0.88},"
          + "\"date_of_birth\": null"
          + "}";

  @Mock private AiTextClient ai;

  private FieldStructuringService service;

  @BeforeEach
  void setUp() {
    PromptConfig prompt = new PromptConfig();
    prompt.setSystemTemplate("You extract I-20 data.");
    prompt.setUserTemplate("{document_text}");
    prompt.setRules(Map.of());

    Retry retry =
        Retry.of("test", RetryConfig.custom().maxAttempts(3).waitDuration(Duration.ZERO).build());

    service = new FieldStructuringService(ai, prompt, retry, 8000);
  }

  @Test
  void parsesFencedJsonIntoFields() {
    when(ai.generate(anyString(), anyString())).thenReturn("```json\n" + GOOD_RESPONSE + "\n```");

    I20Fields fields = service.structure("FORM I-20 Certificate of Eligibility ...");

    assertThat(fields.size()).isEqualTo(4);
    assertThat(fields.sevisId()).contains(ExtractedField.of("N0012345678", 0.92));
    assertThat(fields.fullName().map(ExtractedField::getValue)).contains("Priya Raman");
    assertThat(fields.isPresent(I20Field.DATE_OF_BIRTH)).isFalse();
  }

  @Test
  void retriesTransientFailuresThenSucceeds() {
    when(ai.generate(anyString(), anyString()))
        .thenThrow(new RuntimeException("read timed out"))
        .thenReturn(GOOD_RESPONSE);

    I20Fields fields = service.structure("text");

    assertThat(fields.size()).isEqualTo(4);
    verify(ai, times(2)).generate(anyString(), anyString());
  }

  @Test
  void exhaustedRetriesAreAiUnavailable() {
    when(ai.generate(anyString(), anyString())).thenThrow(new RuntimeException("503"));

    assertThatThrownBy(() -> service.structure("text"))
        .isInstanceOf(FieldStructuringException.class)
        .satisfies(
            e -> {
              FieldStructuringException fse = (FieldStructuringException) e;
              assertThat(fse.getReason()).isEqualTo(StructuringFailureReason.AI_UNAVAILABLE);
              assertThat(fse.getMessage())
                  .isEqualTo("AI processing failed. Please try again or contact support.");
            });
    verify(ai, times(3)).generate(anyString(), anyString());
  }

  @Test
  void unparseableResponseIsNotRetried() {
    when(ai.generate(anyString(), anyString())).thenReturn("Sorry, I cannot read this document.");

    assertThatThrownBy(() -> service.structure("text"))
        .isInstanceOf(FieldStructuringException.class)
        .extracting(e -> ((FieldStructuringException) e).getReason())
        .isEqualTo(StructuringFailureReason.UNPARSEABLE_RESPONSE);
    verify(ai, times(1)).generate(anyString(), anyString());
  }

  @Test
  void jsonArrayIsUnparseable() {
    when(ai.generate(anyString(), anyString())).thenReturn("[1, 2, 3]");

    assertThatThrownBy(() -> service.structure("text"))
        .isInstanceOf(FieldStructuringException.class)
        .extracting(e -> ((FieldStructuringException) e).getReason())
        .isEqualTo(StructuringFailureReason.UNPARSEABLE_RESPONSE);
  }

  @Test
  void truncatesLongInputBeforePrompting() {
    when(ai.generate(anyString(), anyString())).thenReturn("{}");

    service.structure("a".repeat(9000));

    ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
    verify(ai).generate(any(), userPrompt.capture());
    assertThat(userPrompt.getValue()).hasSize(8000);
  }

  @Test
  void parseHandlesLooseFieldShapes() {
    I20Fields fields =
        service.parse(
            "{"
                + "\"full_name\": \"Priya Raman\","
                + "\"sevis_id\": {\"value\": null, \"confidence\": 0.9},"
                + "\"program_end_date\": {\"value\": \"2026-05-15\", \"confidence\": \"0.8\"},"
                + "\"school_name\": {\"value\": \"NEU\", \"confidence\": 1.7},"
                + "\"school_address\": {\"value\": 360},"
                + "\"unknown_field\": {\"value\": \"ignored\", \"confidence\": 1.0}"
                + "}");

    assertThat(fields.fullName()).contains(ExtractedField.of("Priya Raman", 0.0));
    assertThat(fields.isPresent(I20Field.SEVIS_ID)).isFalse();
    assertThat(fields.programEndDate().map(ExtractedField::getConfidence)).contains(0.8);
    assertThat(fields.schoolName().map(ExtractedField::getConfidence)).contains(1.0);
    assertThat(fields.schoolAddress()).contains(ExtractedField.of("360", 0.0));
    assertThat(fields.size()).isEqualTo(4);
  }

  @Test
  void stripsCodeFences() {
    assertThat(FieldStructuringService.stripCodeFences("```json\n{\"a\":1}\n```"))
        .isEqualTo("{\"a\":1}");
    assertThat(FieldStructuringService.stripCodeFences("```JSON{\"a\":1}```")).isEqualTo("{\"a\":1}");
    assertThat(FieldStructuringService.stripCodeFences("```\n{}\n```")).isEqualTo("{}");
    assertThat(FieldStructuringService.stripCodeFences("  {}  ")).isEqualTo("{}");
  }
}
