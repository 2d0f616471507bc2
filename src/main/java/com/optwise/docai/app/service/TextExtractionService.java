package com.optwise.docai.app.service;

import com.optwise.docai.app.exception.TextExtractionException;
import com.optwise.docai.app.model.ExtractionFailureReason;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentRequest;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentResponse;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.Document;
import software.amazon.awssdk.services.textract.model.FeatureType;
import software.amazon.awssdk.services.textract.model.InvalidS3ObjectException;
import software.amazon.awssdk.services.textract.model.S3Object;
import software.amazon.awssdk.services.textract.model.UnsupportedDocumentException;

/**
 * Wraps AWS Textract: one synchronous {@code AnalyzeDocument} call (FORMS + TABLES) per document,
 * no retry.
 *
 * <p>The text of every LINE block is returned in service order, one line per block. A technically
 * successful call that yields fewer than {@code minTextLength} characters is still a failure.
 */
@Log4j2
public class TextExtractionService {

  private final TextractClient textractClient;
  private final int minTextLength;

  public TextExtractionService(TextractClient textractClient, int minTextLength) {
    this.textractClient = Objects.requireNonNull(textractClient, "textractClient must not be null");
    this.minTextLength = minTextLength;
  }

  /**
   * Extracts raw line text from the S3 object.
   *
   * @throws TextExtractionException with the reason the text could not be obtained
   */
  public String extract(String bucket, String key) {
    log.info("textract.start s3://{}/{}", bucket, key);

    AnalyzeDocumentResponse response;
    try {
      response =
          textractClient.analyzeDocument(
              AnalyzeDocumentRequest.builder()
                  .document(
                      Document.builder()
                          .s3Object(S3Object.builder().bucket(bucket).name(key).build())
                          .build())
                  .featureTypes(FeatureType.FORMS, FeatureType.TABLES)
                  .build());
    } catch (InvalidS3ObjectException e) {
      log.error("textract.invalid-object s3://{}/{} msg={}", bucket, key, e.getMessage());
      throw failure(ExtractionFailureReason.DOCUMENT_NOT_FOUND, e);
    } catch (UnsupportedDocumentException e) {
      log.error("textract.unsupported-document s3://{}/{} msg={}", bucket, key, e.getMessage());
      throw failure(ExtractionFailureReason.UNSUPPORTED_DOCUMENT, e);
    } catch (RuntimeException e) {
      log.error(
          "textract.failed s3://{}/{} type={} msg={}",
          bucket,
          key,
          e.getClass().getSimpleName(),
          e.getMessage(),
          e);
      throw failure(ExtractionFailureReason.SERVICE_ERROR, e);
    }

    List<String> lines =
        response.blocks().stream()
            .filter(b -> b.blockType() == BlockType.LINE)
            .map(Block::text)
            .filter(t -> t != null && !t.isEmpty())
            .collect(Collectors.toList());
    String rawText = String.join("\n", lines);

    log.info("textract.done s3://{}/{} lines={} chars={}", bucket, key, lines.size(), rawText.length());

    if (rawText.length() < minTextLength) {
      log.warn(
          "textract.text-too-short s3://{}/{} chars={} minimum={}",
          bucket,
          key,
          rawText.length(),
          minTextLength);
      throw new TextExtractionException(
          ExtractionFailureReason.TEXT_TOO_SHORT,
          "Could not extract enough text ("
              + rawText.length()
              + " chars). Please upload a clear, readable PDF.");
    }
    return rawText;
  }

  private static TextExtractionException failure(ExtractionFailureReason reason, Throwable cause) {
    return new TextExtractionException(reason, reason.getUserMessage(), cause);
  }
}
