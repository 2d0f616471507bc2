package com.optwise.docai.app.repository.dynamodb;

import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** Stored form of one extracted field: the raw value and the model's confidence. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ExtractedFieldItem {

  private String value;

  /** 0.0 - 1.0 */
  private Double confidence;

  @DynamoDbAttribute("value")
  public String getValue() {
    return value;
  }

  @DynamoDbAttribute("confidence")
  public Double getConfidence() {
    return confidence;
  }
}
