package com.optwise.docai.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.optwise.docai.app.model.DocumentStatus;
import com.optwise.docai.app.model.DocumentStatusUpdate;
import com.optwise.docai.app.model.ExtractedField;
import com.optwise.docai.app.model.I20Fields;
import com.optwise.docai.app.model.OptTimeline;
import com.optwise.docai.app.model.ValidationIssue;
import com.optwise.docai.app.repository.dynamodb.DocumentStatusItem;
import com.optwise.docai.app.repository.dynamodb.DocumentStatusRepository;
import com.optwise.docai.app.repository.dynamodb.ExtractedFieldItem;
import com.optwise.docai.app.repository.dynamodb.ValidationIssueItem;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * Central status writer for document processing, backed by the DynamoDB documents table.
 *
 * <p>Each {@link DocumentStatusUpdate} becomes one partial upsert: status and {@code updated_at}
 * always, everything else only when set.
 */
@Log4j2
public class StatusService implements DocumentStatusSink {

  private final DocumentStatusRepository repo;
  private final Clock clock;
  private final ObjectMapper om;

  public StatusService(DocumentStatusRepository repo, Clock clock) {
    this.repo = repo;
    this.clock = clock;
    this.om =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  // =====================================================================
  // Read helper used by controller and scheduler
  // =====================================================================

  public Optional<DocumentStatusItem> getStatus(String userId, String documentId) {
    validateId("userId", userId);
    validateId("documentId", documentId);
    return Optional.ofNullable(repo.get(userId, documentId));
  }

  /**
   * A user's documents, newest first by {@code created_at}. {@code statusFilter} is matched
   * case-insensitively and applied after the query, so fewer than {@code limit} may come back.
   */
  public List<DocumentStatusItem> listDocuments(String userId, String statusFilter, int limit) {
    validateId("userId", userId);
    List<DocumentStatusItem> items = repo.listByUser(userId, limit);
    List<DocumentStatusItem> out =
        items.stream()
            .filter(
                i ->
                    statusFilter == null
                        || statusFilter.isBlank()
                        || statusFilter.equalsIgnoreCase(i.getStatus()))
            .sorted(
                Comparator.comparing(
                    DocumentStatusItem::getCreatedAt,
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
            .collect(Collectors.toList());
    log.info(
        "status.list userId={} found={} returned={} statusFilter={}",
        userId,
        items.size(),
        out.size(),
        statusFilter);
    return out;
  }

  /** Reads the stored timeline back; empty when none was written or it no longer parses. */
  public Optional<JsonNode> readTimeline(DocumentStatusItem item) {
    if (item == null || item.getOptTimeline() == null) return Optional.empty();
    try {
      return Optional.of(om.readTree(item.getOptTimeline()));
    } catch (JsonProcessingException e) {
      log.warn(
          "status.timeline.unreadable userId={} docId={} msg={}",
          item.getUserId(),
          item.getDocumentId(),
          e.getOriginalMessage());
      return Optional.empty();
    }
  }

  // =====================================================================
  // Writes
  // =====================================================================

  @Override
  public void update(DocumentStatusUpdate update) {
    validateId("userId", update.getUserId());
    validateId("documentId", update.getDocumentId());
    if (update.getStatus() == null) throw new IllegalArgumentException("status is required");

    DocumentStatusItem changes =
        DocumentStatusItem.builder()
            .userId(update.getUserId())
            .documentId(update.getDocumentId())
            .status(update.getStatus().getCode())
            .processingStage(update.getStage() == null ? null : update.getStage().getCode())
            .extractedData(toItems(update.getData()))
            .validationErrors(toItems(update.getValidationIssues()))
            .errorMessage(update.getError())
            .optTimeline(toJson(update.getTimeline()))
            .updatedAt(Instant.now(clock))
            .build();

    repo.update(changes);
    log.info(
        "status.update userId={} docId={} status={} stage={}",
        update.getUserId(),
        update.getDocumentId(),
        changes.getStatus(),
        changes.getProcessingStage());
  }

  /** Marks a document as discovered but not yet processed; used by the upload sweep. */
  public void recordUploaded(String userId, String documentId, String fileName) {
    validateId("userId", userId);
    validateId("documentId", documentId);
    repo.update(
        DocumentStatusItem.builder()
            .userId(userId)
            .documentId(documentId)
            .fileName(fileName)
            .documentType("i20")
            .status(DocumentStatus.UPLOADING.getCode())
            .updatedAt(Instant.now(clock))
            .build());
    log.info("status.uploaded userId={} docId={} file={}", userId, documentId, fileName);
  }

  // =====================================================================
  // Internals
  // =====================================================================

  private static Map<String, ExtractedFieldItem> toItems(I20Fields data) {
    if (data == null) return null;
    Map<String, ExtractedFieldItem> out = new LinkedHashMap<>();
    for (Map.Entry<String, ExtractedField> e : data.asMap().entrySet()) {
      out.put(
          e.getKey(),
          ExtractedFieldItem.builder()
              .value(e.getValue().getValue())
              .confidence(e.getValue().getConfidence())
              .build());
    }
    return out;
  }

  private static List<ValidationIssueItem> toItems(List<ValidationIssue> issues) {
    if (issues == null) return null;
    return issues.stream()
        .map(
            i ->
                ValidationIssueItem.builder()
                    .field(i.getField() == null ? null : i.getField().getJsonName())
                    .severity(i.getSeverity() == null ? null : i.getSeverity().code())
                    .message(i.getMessage())
                    .suggestion(i.getSuggestion())
                    .value(i.getValue())
                    .build())
        .collect(Collectors.toList());
  }

  private String toJson(OptTimeline timeline) {
    if (timeline == null) return null;
    try {
      return om.writeValueAsString(timeline);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize OPT timeline", e);
    }
  }

  private static void validateId(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
