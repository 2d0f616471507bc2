package com.optwise.docai.app.scheduler;

import com.optwise.docai.app.exception.InvalidDocumentKeyException;
import com.optwise.docai.app.model.DocumentRef;
import com.optwise.docai.app.model.DocumentStatus;
import com.optwise.docai.app.model.ProcessingOutcome;
import com.optwise.docai.app.repository.dynamodb.DocumentStatusItem;
import com.optwise.docai.app.service.DocumentProcessingPipeline;
import com.optwise.docai.app.service.StatusService;
import com.optwise.docai.app.util.DocumentKeyParser;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Picks up uploads that never reached the pipeline through an S3 event notification.
 *
 * <p>Objects are processed one at a time. A document is skipped once its status record has moved
 * past {@code uploading}.
 */
@Log4j2
public class UploadSweepScheduler {

  private final S3Client s3;
  private final DocumentProcessingPipeline pipeline;
  private final StatusService status;
  private final String bucket;
  private final String prefix;
  private final int maxPerRun;
  private final boolean dryRun;

  public UploadSweepScheduler(
      S3Client s3,
      DocumentProcessingPipeline pipeline,
      StatusService status,
      String bucket,
      String uploadPrefix,
      int maxPerRun,
      boolean dryRun) {
    this.s3 = s3;
    this.pipeline = pipeline;
    this.status = status;
    this.bucket = bucket;
    this.prefix = normalizePrefix(uploadPrefix);
    this.maxPerRun = maxPerRun;
    this.dryRun = dryRun;
  }

  @Scheduled(cron = "${scheduled.sweep.cron:0 */5 * * * *}")
  public void sweepAndProcess() {
    runOnce();
  }

  /** One sweep over the upload prefix; returns how many documents were handed off. */
  int runOnce() {
    log.info(
        "sweep.start bucket={} prefix={} maxPerRun={} dryRun={}", bucket, prefix, maxPerRun, dryRun);

    int processed = 0;
    String continuation = null;

    do {
      ListObjectsV2Response page =
          s3.listObjectsV2(
              ListObjectsV2Request.builder()
                  .bucket(bucket)
                  .prefix(prefix)
                  .continuationToken(continuation)
                  .maxKeys(1000)
                  .build());

      for (S3Object obj : page.contents()) {
        if (processed >= maxPerRun) {
          log.info("sweep.limit reached maxPerRun={}, stopping this cycle", maxPerRun);
          break;
        }
        if (obj.key().endsWith("/") || obj.size() == null || obj.size() <= 0) {
          continue;
        }

        DocumentRef ref;
        try {
          ref = DocumentKeyParser.parse(bucket, obj.key(), prefix);
        } catch (InvalidDocumentKeyException e) {
          log.warn("sweep.skip invalid key={}", obj.key());
          continue;
        }

        Optional<DocumentStatusItem> state =
            status.getStatus(ref.getUserId(), ref.getDocumentId());
        if (state.isPresent() && !isAwaitingProcessing(state.get())) {
          log.debug(
              "sweep.skip tracked docId={} status={}", ref.getDocumentId(), state.get().getStatus());
          continue;
        }

        if (dryRun) {
          log.info("sweep.dryRun would process docId={} key={}", ref.getDocumentId(), obj.key());
          status.recordUploaded(ref.getUserId(), ref.getDocumentId(), ref.getFileName());
          processed++;
          continue;
        }

        try {
          ProcessingOutcome outcome = pipeline.process(ref);
          log.info("sweep.processed docId={} outcome={}", ref.getDocumentId(), outcome.getKind());
        } catch (RuntimeException ex) {
          // the pipeline has already recorded the failure
          log.error("sweep.error docId={} key={} msg={}", ref.getDocumentId(), obj.key(), ex.getMessage());
        }
        processed++;
      }

      if (processed >= maxPerRun) {
        break;
      }
      continuation = page.nextContinuationToken();

    } while (continuation != null);

    log.info("sweep.finish processed={} bucket={} prefix={}", processed, bucket, prefix);
    return processed;
  }

  private static boolean isAwaitingProcessing(DocumentStatusItem item) {
    return item.getStatus() == null
        || DocumentStatus.UPLOADING.getCode().equals(item.getStatus());
  }

  private static String normalizePrefix(String p) {
    if (p == null || p.isBlank()) return "";
    return p.endsWith("/") ? p : p + "/";
  }
}
