package com.optwise.docai.app.config;

import com.optwise.docai.app.repository.dynamodb.DocumentStatusRepository;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS configuration for the production profile.
 *
 * <p>Clients resolve credentials through the default provider chain (instance role, environment).
 * Active only when the {@code production} Spring profile is enabled.
 */
@Configuration
@Profile("production")
@Import({ServiceConfig.class, ChatGptConfig.class, SchedulerConfig.class})
public class AwsProdConfig {

  @Value("${aws.region}")
  private String region;

  @Value("${aws.textract.api-call-timeout:60s}")
  private Duration textractTimeout;

  @Bean
  public S3Client s3Client() {
    return S3Client.builder().region(Region.of(region)).build();
  }

  /**
   * Creates an Amazon Textract client. A call that exceeds {@code aws.textract.api-call-timeout}
   * fails and is reported as a text extraction service error.
   */
  @Bean
  public TextractClient textractClient() {
    return TextractClient.builder()
        .region(Region.of(region))
        .overrideConfiguration(
            ClientOverrideConfiguration.builder().apiCallTimeout(textractTimeout).build())
        .build();
  }

  @Bean
  public DynamoDbClient dynamoDbClient() {
    return DynamoDbClient.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  public DocumentStatusRepository documentStatusRepository(
      DynamoDbClient ddb, DocAiProperties props) {
    return new DocumentStatusRepository(ddb, props.getDynamodb().getDocumentsTable());
  }
}
