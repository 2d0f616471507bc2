package com.optwise.docai.app.repository.dynamodb;

import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** Stored form of a validation issue, as returned to the frontend under validation_errors. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ValidationIssueItem {

  /** JSON name of the field, e.g. sevis_id. */
  private String field;

  /** critical | warning */
  private String severity;

  private String message;

  private String suggestion;

  private String value;

  @DynamoDbAttribute("field")
  public String getField() {
    return field;
  }

  @DynamoDbAttribute("severity")
  public String getSeverity() {
    return severity;
  }

  @DynamoDbAttribute("message")
  public String getMessage() {
    return message;
  }

  @DynamoDbAttribute("suggestion")
  public String getSuggestion() {
    return suggestion;
  }

  @DynamoDbAttribute("value")
  public String getValue() {
    return value;
  }
}
