package com.optwise.docai.app.service;

/**
 * Single-shot text generation against a hosted language model.
 *
 * <p>Implementations throw an unchecked exception on any transport, timeout or service error; they
 * do not retry.
 */
public interface AiTextClient {

  /**
   * @param systemPrompt optional instructions; may be null
   * @param userPrompt the prompt body, required
   * @return raw model text
   */
  String generate(String systemPrompt, String userPrompt);

  /** Model identifier, for logs and status records. */
  String modelName();
}
