package com.optwise.docai.app;

import com.optwise.docai.app.config.DocAiProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the I-20 document AI service.
 *
 * <p>The service OCRs uploaded I-20 forms, structures the text into fields with an AI model,
 * validates them and derives the student's OPT timeline. Run with a profile:
 *
 * <pre>
 *   mvn spring-boot:run -Dspring-boot.run.profiles=local
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(DocAiProperties.class)
public class I20DocAiServiceApplication {

  public static void main(String[] args) {
    log.info("Starting I-20 DocAI service...");
    SpringApplication.run(I20DocAiServiceApplication.class, args);
    log.info("I-20 DocAI service started successfully.");
  }
}
