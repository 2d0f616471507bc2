package com.optwise.docai.app.model;

import lombok.Builder;
import lombok.Value;

/** Identifies one uploaded document: where it lives in S3 and whom it belongs to. */
@Value
@Builder
public class DocumentRef {

  String bucket;

  /** Full object key, {@code userId/documentId/fileName}. */
  String key;

  String userId;

  String documentId;

  String fileName;

  public String s3Uri() {
    return "s3://" + bucket + "/" + key;
  }
}
