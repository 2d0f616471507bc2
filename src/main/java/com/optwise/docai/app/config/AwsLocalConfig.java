package com.optwise.docai.app.config;

import com.optwise.docai.app.repository.dynamodb.DocumentStatusRepository;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS configuration for the local environment.
 *
 * <p>Uses static credentials from the application properties for local development. It defines
 * Spring beans for:
 *
 * <ul>
 *   <li>{@link S3Client} - listing uploaded documents for the sweep.
 *   <li>{@link TextractClient} - OCR of uploaded I-20s, with a bounded per-call timeout.
 *   <li>{@link DynamoDbClient} - the documents status table.
 * </ul>
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 */
@Configuration
@Profile("local")
@Import({ServiceConfig.class, ChatGptConfig.class, SchedulerConfig.class})
public class AwsLocalConfig {

  @Value("${aws.region}")
  private String region;

  /** Static key pair for developer machines; never set in deployed environments. */
  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  @Value("${aws.textract.api-call-timeout:60s}")
  private Duration textractTimeout;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  @Bean
  public S3Client s3Client(StaticCredentialsProvider creds) {
    return S3Client.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public TextractClient textractClient(StaticCredentialsProvider creds) {
    return TextractClient.builder()
        .region(Region.of(region))
        .credentialsProvider(creds)
        .overrideConfiguration(
            ClientOverrideConfiguration.builder().apiCallTimeout(textractTimeout).build())
        .build();
  }

  @Bean
  public DynamoDbClient dynamoDbClient(StaticCredentialsProvider creds) {
    return DynamoDbClient.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public DocumentStatusRepository documentStatusRepository(
      DynamoDbClient ddb, DocAiProperties props) {
    return new DocumentStatusRepository(ddb, props.getDynamodb().getDocumentsTable());
  }
}
