package com.optwise.docai.app.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Tunables for the I-20 processing pipeline, bound from {@code docai.*}. */
@Data
@ConfigurationProperties(prefix = "docai")
public class DocAiProperties {

  /** {@code dev} exposes internal error details in API responses and status records. */
  private String environment = "production";

  private S3 s3 = new S3();
  private Extraction extraction = new Extraction();
  private Structuring structuring = new Structuring();
  private Validation validation = new Validation();
  private Dynamodb dynamodb = new Dynamodb();

  public boolean isDev() {
    return "dev".equalsIgnoreCase(environment);
  }

  @Data
  public static class S3 {
    private String bucket;
    private String uploadPrefix = "";
  }

  @Data
  public static class Extraction {
    private int minTextLength = 100;
  }

  @Data
  public static class Structuring {
    private int maxInputChars = 8000;
    private String promptLocation = "classpath:prompts/i20-extraction.yaml";
    private Retry retry = new Retry();
  }

  @Data
  public static class Retry {
    private int maxAttempts = 3;
    private Duration initialInterval = Duration.ofSeconds(1);
    private double multiplier = 2.0;
  }

  @Data
  public static class Validation {
    private double minConfidence = 0.75;
  }

  @Data
  public static class Dynamodb {
    private String documentsTable = "immigration-documents";
  }
}
