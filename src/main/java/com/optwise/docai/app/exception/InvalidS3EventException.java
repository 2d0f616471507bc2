package com.optwise.docai.app.exception;

/** An S3 event notification without any record to process. */
public class InvalidS3EventException extends DocumentProcessingException {

  public InvalidS3EventException() {
    super("INVALID_S3_EVENT", "Invalid S3 event");
  }
}
