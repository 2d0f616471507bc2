package com.optwise.docai.app.config;

import com.optwise.docai.app.exception.MissingConfigurationException;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ChatGPT configuration for Spring AI.
 *
 * <p>Provides the {@link ChatClient.Builder} used by the field structuring step. Spring AI
 * autoconfigures the {@link OpenAiChatModel} from {@code spring.ai.openai.*}; a blank API key
 * stops startup.
 */
@Configuration
public class ChatGptConfig {

  @Value("${spring.ai.openai.api-key:}")
  private String apiKey;

  @Bean
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new MissingConfigurationException("spring.ai.openai.api-key");
    }
    return ChatClient.builder(openAiChatModel);
  }
}
