package com.optwise.docai.app.service;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.openai.OpenAiChatOptions;

/**
 * {@link AiTextClient} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Messages are passed pre-rendered so that literal braces in the prompt (JSON examples) are not
 * treated as template variables.
 */
@Log4j2
public class SpringAiTextClient implements AiTextClient {

  private final ChatClient chat;
  private final String model;
  private final double temperature;

  public SpringAiTextClient(ChatClient.Builder builder, String model, double temperature) {
    this.chat = builder.build();
    this.model = model;
    this.temperature = temperature;
  }

  @Override
  public String generate(String systemPrompt, String userPrompt) {
    List<Message> messages = new ArrayList<>();
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.add(new SystemMessage(systemPrompt));
    }
    messages.add(new UserMessage(userPrompt));

    OpenAiChatOptions options =
        OpenAiChatOptions.builder().model(model).temperature(temperature).build();

    String content = chat.prompt().messages(messages).options(options).call().content();
    log.debug("ai.raw model={} chars={}", model, content == null ? 0 : content.length());
    return content;
  }

  @Override
  public String modelName() {
    return model;
  }
}
