package com.optwise.docai.app.repository.dynamodb;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.enhanced.dynamodb.*;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/** Repository over the Enhanced DynamoDB documents table (user_id + document_id). */
@Log4j2
public class DocumentStatusRepository {

  private final DynamoDbTable<DocumentStatusItem> table;

  public DocumentStatusRepository(DynamoDbClient ddb, String tableName) {
    DynamoDbEnhancedClient enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build();
    this.table = enhanced.table(tableName, TableSchema.fromBean(DocumentStatusItem.class));
    log.info("docstatus.repository table={}", tableName);
  }

  DocumentStatusRepository(DynamoDbTable<DocumentStatusItem> table) {
    this.table = table;
  }

  public DocumentStatusItem get(String userId, String documentId) {
    if (userId == null || documentId == null) return null;
    return table.getItem(Key.builder().partitionValue(userId).sortValue(documentId).build());
  }

  /** All documents of one user, sort key descending, at most {@code limit} items. */
  public List<DocumentStatusItem> listByUser(String userId, int limit) {
    if (userId == null) return List.of();
    return table
        .query(
            r ->
                r.queryConditional(QueryConditional.keyEqualTo(k -> k.partitionValue(userId)))
                    .scanIndexForward(false)
                    .limit(limit))
        .items()
        .stream()
        .limit(limit)
        .collect(Collectors.toList());
  }

  /**
   * Partial upsert: only non-null attributes of {@code changes} are written, so earlier data
   * (file name, extracted fields) survives later status changes. {@code createdAt} is stamped
   * when the record does not exist yet.
   */
  public DocumentStatusItem update(DocumentStatusItem changes) {
    Objects.requireNonNull(changes, "changes");
    Objects.requireNonNull(changes.getUserId(), "userId");
    Objects.requireNonNull(changes.getDocumentId(), "documentId");

    if (changes.getUpdatedAt() == null) changes.setUpdatedAt(Instant.now());
    if (changes.getCreatedAt() == null && get(changes.getUserId(), changes.getDocumentId()) == null) {
      changes.setCreatedAt(changes.getUpdatedAt());
    }

    DocumentStatusItem stored = table.updateItem(r -> r.item(changes).ignoreNulls(true));
    log.debug(
        "docstatus.update userId={} docId={} status={} stage={}",
        changes.getUserId(),
        changes.getDocumentId(),
        changes.getStatus(),
        changes.getProcessingStage());
    return stored;
  }
}
