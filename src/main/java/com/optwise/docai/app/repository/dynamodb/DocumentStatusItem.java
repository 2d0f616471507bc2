package com.optwise.docai.app.repository.dynamodb;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/**
 * One row of the documents table: the current processing state of a single uploaded document.
 * Attribute names are snake_case because the frontend reads them back unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class DocumentStatusItem {

  /** Partition key. */
  private String userId;

  /** Sort key. */
  private String documentId;

  private String documentType;

  private String fileName;

  /** uploading | processing | success | needs_verification | failed */
  private String status;

  /** text_extraction | ai_structuring | validation | complete | error */
  private String processingStage;

  /** Extracted fields keyed by JSON field name. */
  private Map<String, ExtractedFieldItem> extractedData;

  private List<ValidationIssueItem> validationErrors;

  private String errorMessage;

  /** OPT timeline serialized as JSON; only written for successful documents. */
  private String optTimeline;

  private Instant createdAt;

  private Instant updatedAt;

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute("user_id")
  public String getUserId() {
    return userId;
  }

  @DynamoDbSortKey
  @DynamoDbAttribute("document_id")
  public String getDocumentId() {
    return documentId;
  }

  @DynamoDbAttribute("document_type")
  public String getDocumentType() {
    return documentType;
  }

  @DynamoDbAttribute("file_name")
  public String getFileName() {
    return fileName;
  }

  @DynamoDbAttribute("status")
  public String getStatus() {
    return status;
  }

  @DynamoDbAttribute("processing_stage")
  public String getProcessingStage() {
    return processingStage;
  }

  @DynamoDbAttribute("extracted_data")
  public Map<String, ExtractedFieldItem> getExtractedData() {
    return extractedData;
  }

  @DynamoDbAttribute("validation_errors")
  public List<ValidationIssueItem> getValidationErrors() {
    return validationErrors;
  }

  @DynamoDbAttribute("error_message")
  public String getErrorMessage() {
    return errorMessage;
  }

  @DynamoDbAttribute("opt_timeline")
  public String getOptTimeline() {
    return optTimeline;
  }

  @DynamoDbAttribute("created_at")
  public Instant getCreatedAt() {
    return createdAt;
  }

  @DynamoDbAttribute("updated_at")
  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
