package com.optwise.docai.app.config;

import com.optwise.docai.app.prompt.PromptConfig;
import com.optwise.docai.app.repository.dynamodb.DocumentStatusRepository;
import com.optwise.docai.app.service.*;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import software.amazon.awssdk.services.textract.TextractClient;

@Log4j2
@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final DocAiProperties props;
  private final TextractClient textractClient;
  private final ChatClient.Builder chatClientBuilder;
  private final DocumentStatusRepository documentStatusRepository;

  @Value("${spring.ai.openai.chat.options.model:gpt-4o-mini}")
  private String modelName;

  @Value("${spring.ai.openai.chat.options.temperature:0.0}")
  private double temperature;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PromptLoaderService promptLoaderService(ResourceLoader resourceLoader) {
    return new PromptLoaderService(resourceLoader);
  }

  @Bean
  public PromptConfig i20ExtractionPrompt(PromptLoaderService promptLoaderService) {
    return promptLoaderService.load(props.getStructuring().getPromptLocation());
  }

  /** Retry for the AI call only: 1s, 2s, ... between attempts. */
  @Bean
  public Retry structuringRetry() {
    DocAiProperties.Retry cfg = props.getStructuring().getRetry();
    RetryConfig retryConfig =
        RetryConfig.custom()
            .maxAttempts(cfg.getMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    cfg.getInitialInterval(), cfg.getMultiplier()))
            .retryExceptions(RuntimeException.class)
            .build();
    Retry retry = Retry.of("ai-structuring", retryConfig);
    retry
        .getEventPublisher()
        .onRetry(
            e ->
                log.warn(
                    "structuring.retry attempt={} wait={} msg={}",
                    e.getNumberOfRetryAttempts(),
                    e.getWaitInterval(),
                    e.getLastThrowable() == null ? null : e.getLastThrowable().getMessage()));
    return retry;
  }

  @Bean
  public AiTextClient aiTextClient() {
    return new SpringAiTextClient(chatClientBuilder, modelName, temperature);
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public TextExtractionService textExtractionService() {
    return new TextExtractionService(
        textractClient, props.getExtraction().getMinTextLength());
  }

  @Bean
  public FieldStructuringService fieldStructuringService(
      AiTextClient aiTextClient, PromptConfig i20ExtractionPrompt, Retry structuringRetry) {
    return new FieldStructuringService(
        aiTextClient,
        i20ExtractionPrompt,
        structuringRetry,
        props.getStructuring().getMaxInputChars());
  }

  @Bean
  public I20FieldValidator i20FieldValidator(Clock clock) {
    return new I20FieldValidator(clock, props.getValidation().getMinConfidence());
  }

  @Bean
  public OptTimelineCalculator optTimelineCalculator(Clock clock) {
    return new OptTimelineCalculator(clock);
  }

  @Bean
  public StatusService statusService(Clock clock) {
    return new StatusService(documentStatusRepository, clock);
  }

  @Bean
  public DocumentProcessingPipeline documentProcessingPipeline(
      TextExtractionService textExtractionService,
      FieldStructuringService fieldStructuringService,
      I20FieldValidator i20FieldValidator,
      OptTimelineCalculator optTimelineCalculator,
      StatusService statusService) {
    return new DocumentProcessingPipeline(
        textExtractionService,
        fieldStructuringService,
        i20FieldValidator,
        optTimelineCalculator,
        statusService,
        props.isDev());
  }
}
