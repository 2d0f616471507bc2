package com.optwise.docai.app.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.optwise.docai.app.exception.DocumentNotFoundException;
import com.optwise.docai.app.exception.InvalidListLimitException;
import com.optwise.docai.app.exception.InvalidS3EventException;
import com.optwise.docai.app.model.DocumentRef;
import com.optwise.docai.app.model.DocumentStatus;
import com.optwise.docai.app.model.OptTimeline;
import com.optwise.docai.app.model.ProcessingOutcome;
import com.optwise.docai.app.repository.dynamodb.DocumentStatusItem;
import com.optwise.docai.app.repository.dynamodb.ExtractedFieldItem;
import com.optwise.docai.app.repository.dynamodb.ValidationIssueItem;
import com.optwise.docai.app.service.DocumentProcessingPipeline;
import com.optwise.docai.app.service.OptTimelineCalculator;
import com.optwise.docai.app.service.StatusService;
import com.optwise.docai.app.util.DocumentKeyParser;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Log4j2
@Validated
@RestController
@RequiredArgsConstructor
public class DocumentController {

  static final String PROCESSING_COMPLETED = "Processing completed";
  static final int MAX_LIST_LIMIT = 100;

  private final DocumentProcessingPipeline pipeline;
  private final StatusService statusService;
  private final OptTimelineCalculator timelineCalculator;

  // ------------------------------------------------------------
  // /documents/events/s3
  // ------------------------------------------------------------
  @PostMapping(
      path = "/documents/events/s3",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ProcessResponse> onS3Event(@RequestBody S3EventNotification event) {
    if (event.getRecords() == null || event.getRecords().isEmpty()) {
      throw new InvalidS3EventException();
    }
    S3EventNotification.S3Entity s3 = event.getRecords().get(0).getS3();
    if (s3 == null || s3.getBucket() == null || s3.getObject() == null) {
      throw new InvalidS3EventException();
    }

    String bucket = s3.getBucket().getName();
    String key = DocumentKeyParser.decodeEventKey(s3.getObject().getKey());
    log.info(
        "documents.s3-event records={} bucket={} key={}", event.getRecords().size(), bucket, key);

    return ResponseEntity.ok(run(DocumentKeyParser.parse(bucket, key)));
  }

  // ------------------------------------------------------------
  // /documents/process
  // ------------------------------------------------------------
  @PostMapping(
      path = "/documents/process",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ProcessResponse> process(@RequestBody @Validated ProcessRequest req) {
    log.info("documents.process bucket={} key={}", req.getBucket(), req.getKey());
    return ResponseEntity.ok(run(DocumentKeyParser.parse(req.getBucket(), req.getKey())));
  }

  // ------------------------------------------------------------
  // /documents/{userId}/{documentId}/status
  // ------------------------------------------------------------
  @GetMapping(
      path = "/documents/{userId}/{documentId}/status",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<StatusEnvelope> getStatus(
      @PathVariable("userId") String userId, @PathVariable("documentId") String documentId) {
    DocumentStatusItem item =
        statusService
            .getStatus(userId, documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    log.debug("documents.status docId={} status={}", documentId, item.getStatus());
    return ResponseEntity.ok(new StatusEnvelope(true, toStatusResponse(item)));
  }

  // ------------------------------------------------------------
  // /documents/{userId}
  // ------------------------------------------------------------
  @GetMapping(path = "/documents/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentListEnvelope> listDocuments(
      @PathVariable("userId") String userId,
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    if (limit < 1 || limit > MAX_LIST_LIMIT) {
      throw new InvalidListLimitException(1, MAX_LIST_LIMIT);
    }
    List<DocumentSummary> documents =
        statusService.listDocuments(userId, status, limit).stream()
            .map(DocumentController::toSummary)
            .collect(Collectors.toList());
    return ResponseEntity.ok(
        new DocumentListEnvelope(true, new DocumentList(documents, documents.size())));
  }

  // ------------------------------------------------------------
  // /timeline/opt
  // ------------------------------------------------------------
  @GetMapping(path = "/timeline/opt", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<OptTimeline> timeline(
      @RequestParam("programEndDate") String programEndDate) {
    OptTimeline timeline = timelineCalculator.calculate(programEndDate);
    if (timeline.isError()) {
      return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(timeline);
    }
    return ResponseEntity.ok(timeline);
  }

  // ============================================================
  // DTOs
  // ============================================================
  @Data
  public static class ProcessRequest {
    @NotBlank private String bucket;
    @NotBlank private String key;
  }

  /** The subset of an S3 event notification the service reads. */
  @Data
  public static class S3EventNotification {
    @JsonProperty("Records")
    private List<EventRecord> records;

    @Data
    public static class EventRecord {
      private S3Entity s3;
    }

    @Data
    public static class S3Entity {
      private Bucket bucket;
      private S3ObjectEntity object;
    }

    @Data
    public static class Bucket {
      private String name;
    }

    @Data
    public static class S3ObjectEntity {
      private String key;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ProcessResponse {
    private final String message;
    private final String documentId;
    private final String status;
  }

  @Data
  public static class StatusEnvelope {
    private final boolean success;
    private final StatusResponse data;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class StatusResponse {
    private String documentId;
    private String documentType;
    private String fileName;
    private String status;
    private String processingStage;
    private Instant createdAt;
    private Instant updatedAt;
    private Map<String, ExtractedFieldItem> extractedData;
    private List<ValidationIssueItem> validationErrors;
    private JsonNode optTimeline;
    private String errorMessage;
    private String message;
  }

  @Data
  public static class DocumentListEnvelope {
    private final boolean success;
    private final DocumentList data;
  }

  @Data
  public static class DocumentList {
    private final List<DocumentSummary> documents;
    private final int count;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class DocumentSummary {
    private String documentId;
    private String documentType;
    private String fileName;
    private String status;
    private Instant createdAt;
    private Instant updatedAt;
    private DocumentPreview preview;
    private String errorMessage;
  }

  /** Key fields shown on a document card; null values are dropped from the JSON. */
  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class DocumentPreview {
    private final String fullName;
    private final String sevisId;
    private final String programEndDate;
  }

  // ============================================================
  // Helpers
  // ============================================================
  private ProcessResponse run(DocumentRef ref) {
    ProcessingOutcome outcome = pipeline.process(ref);
    return new ProcessResponse(
        PROCESSING_COMPLETED, ref.getDocumentId(), statusOf(outcome).getCode());
  }

  static DocumentStatus statusOf(ProcessingOutcome outcome) {
    return switch (outcome.getKind()) {
      case EXTRACTION_FAILED, STRUCTURING_FAILED, VALIDATION_FAILED -> DocumentStatus.FAILED;
      case NEEDS_VERIFICATION -> DocumentStatus.NEEDS_VERIFICATION;
      case SUCCESS -> DocumentStatus.SUCCESS;
    };
  }

  private static DocumentSummary toSummary(DocumentStatusItem item) {
    DocumentSummary s = new DocumentSummary();
    s.setDocumentId(item.getDocumentId());
    s.setDocumentType(item.getDocumentType());
    s.setFileName(item.getFileName());
    s.setStatus(item.getStatus());
    s.setCreatedAt(item.getCreatedAt());
    s.setUpdatedAt(item.getUpdatedAt());
    Map<String, ExtractedFieldItem> data = item.getExtractedData();
    if (data != null && !data.isEmpty()) {
      s.setPreview(
          new DocumentPreview(
              previewValue(data, "full_name"),
              previewValue(data, "sevis_id"),
              previewValue(data, "program_end_date")));
    }
    if (DocumentStatus.FAILED.getCode().equals(item.getStatus())) {
      s.setErrorMessage(item.getErrorMessage());
    }
    return s;
  }

  private static String previewValue(Map<String, ExtractedFieldItem> data, String field) {
    ExtractedFieldItem f = data.get(field);
    return f == null ? null : f.getValue();
  }

  private StatusResponse toStatusResponse(DocumentStatusItem item) {
    StatusResponse r = new StatusResponse();
    r.setDocumentId(item.getDocumentId());
    r.setDocumentType(item.getDocumentType());
    r.setFileName(item.getFileName());
    r.setStatus(item.getStatus());
    r.setProcessingStage(item.getProcessingStage());
    r.setCreatedAt(item.getCreatedAt());
    r.setUpdatedAt(item.getUpdatedAt());

    String status = item.getStatus() == null ? "unknown" : item.getStatus();
    Optional<DocumentStatus> known = DocumentStatus.fromCode(status);
    if (known.isEmpty()) {
      r.setMessage("Document status: " + status);
      return r;
    }
    switch (known.get()) {
      case SUCCESS -> {
        r.setExtractedData(orEmpty(item.getExtractedData()));
        r.setValidationErrors(orEmpty(item.getValidationErrors()));
        r.setOptTimeline(statusService.readTimeline(item).orElse(null));
        r.setMessage("Document processed successfully");
      }
      case NEEDS_VERIFICATION -> {
        r.setExtractedData(orEmpty(item.getExtractedData()));
        r.setValidationErrors(orEmpty(item.getValidationErrors()));
        r.setMessage("Document processed but needs verification");
      }
      case PROCESSING -> r.setMessage(
          "Processing document: "
              + (item.getProcessingStage() == null ? "unknown stage" : item.getProcessingStage()));
      case UPLOADING -> r.setMessage("Document is being uploaded");
      case FAILED -> {
        r.setErrorMessage(
            item.getErrorMessage() == null ? "Processing failed" : item.getErrorMessage());
        r.setValidationErrors(orEmpty(item.getValidationErrors()));
      }
    }
    return r;
  }

  private static <K, V> Map<K, V> orEmpty(Map<K, V> m) {
    return m == null ? Map.of() : m;
  }

  private static <T> List<T> orEmpty(List<T> l) {
    return l == null ? List.of() : l;
  }
}
