package com.optwise.docai.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.optwise.docai.app.exception.FieldStructuringException;
import com.optwise.docai.app.model.I20Field;
import com.optwise.docai.app.model.I20Fields;
import com.optwise.docai.app.model.StructuringFailureReason;
import com.optwise.docai.app.prompt.PromptConfig;
import io.github.resilience4j.retry.Retry;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Turns raw OCR text into {@link I20Fields} with an AI text model.
 *
 * <ol>
 *   <li>Truncate the text to {@code maxInputChars} and render the extraction prompt.
 *   <li>Call the model through {@link Retry}; only the call is retried.
 *   <li>Strip markdown code fences and parse the JSON object into fields.
 * </ol>
 *
 * A parse failure of an otherwise successful call is terminal and is not retried.
 */
@Log4j2
public class FieldStructuringService {

  static final String DOCUMENT_TEXT_VAR = "document_text";

  private final AiTextClient ai;
  private final PromptConfig prompt;
  private final Retry retry;
  private final int maxInputChars;
  private final ObjectMapper om = new ObjectMapper();

  public FieldStructuringService(
      AiTextClient ai, PromptConfig prompt, Retry retry, int maxInputChars) {
    this.ai = Objects.requireNonNull(ai, "ai must not be null");
    this.prompt = Objects.requireNonNull(prompt, "prompt must not be null");
    this.retry = Objects.requireNonNull(retry, "retry must not be null");
    this.maxInputChars = maxInputChars;
  }

  /**
   * @throws FieldStructuringException {@code AI_UNAVAILABLE} once retries are exhausted, {@code
   *     UNPARSEABLE_RESPONSE} when the response is not a JSON object
   */
  public I20Fields structure(String rawText) {
    String text = rawText == null ? "" : rawText;
    if (text.length() > maxInputChars) {
      log.info("structuring.truncate originalChars={} truncatedChars={}", text.length(), maxInputChars);
      text = text.substring(0, maxInputChars);
    }

    Map<String, String> vars = Map.of(DOCUMENT_TEXT_VAR, text);
    String systemPrompt = prompt.renderSystem(vars);
    String userPrompt = prompt.renderUser(vars);

    log.info(
        "structuring.call model={} promptChars={} maxAttempts={}",
        ai.modelName(),
        userPrompt.length(),
        retry.getRetryConfig().getMaxAttempts());

    String response;
    try {
      response = Retry.decorateSupplier(retry, () -> ai.generate(systemPrompt, userPrompt)).get();
    } catch (RuntimeException e) {
      log.error(
          "structuring.call.exhausted model={} type={} msg={}",
          ai.modelName(),
          e.getClass().getSimpleName(),
          e.getMessage(),
          e);
      throw new FieldStructuringException(StructuringFailureReason.AI_UNAVAILABLE, e);
    }

    I20Fields fields = parse(response);
    log.info("structuring.done fieldsExtracted={}", fields.size());
    return fields;
  }

  I20Fields parse(String response) {
    if (response == null) {
      log.error("structuring.parse empty response");
      throw new FieldStructuringException(StructuringFailureReason.UNPARSEABLE_RESPONSE, null);
    }
    String cleaned = stripCodeFences(response);

    JsonNode root;
    try {
      root = om.readTree(cleaned);
    } catch (JsonProcessingException e) {
      log.error(
          "structuring.parse failed preview={} msg={}", truncate(cleaned, 200), e.getOriginalMessage());
      throw new FieldStructuringException(StructuringFailureReason.UNPARSEABLE_RESPONSE, e);
    }
    if (root == null || !root.isObject()) {
      log.error("structuring.parse not an object preview={}", truncate(cleaned, 200));
      throw new FieldStructuringException(StructuringFailureReason.UNPARSEABLE_RESPONSE, null);
    }

    I20Fields.Builder out = I20Fields.builder();
    for (I20Field field : I20Field.values()) {
      JsonNode node = root.get(field.getJsonName());
      if (node == null || node.isNull()) continue;

      if (node.isObject()) {
        JsonNode value = node.get("value");
        if (value == null || value.isNull()) continue;
        out.put(field, asText(value), confidence(node.get("confidence")));
      } else if (node.isValueNode()) {
        // bare value without a confidence score
        out.put(field, node.asText(), 0.0);
      }
    }
    return out.build();
  }

  static String stripCodeFences(String text) {
    String s = text.strip();
    if (s.regionMatches(true, 0, "```json", 0, 7)) {
      s = s.substring(7);
    } else if (s.startsWith("```")) {
      s = s.substring(3);
    }
    if (s.endsWith("```")) {
      s = s.substring(0, s.length() - 3);
    }
    return s.strip();
  }

  private static String asText(JsonNode value) {
    return value.isValueNode() ? value.asText() : value.toString();
  }

  private static double confidence(JsonNode node) {
    if (node == null || node.isNull()) return 0.0;
    if (node.isNumber()) return node.asDouble();
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException e) {
        return 0.0;
      }
    }
    return 0.0;
  }

  private static String truncate(String s, int max) {
    return s.length() <= max ? s : s.substring(0, max) + "...";
  }
}
