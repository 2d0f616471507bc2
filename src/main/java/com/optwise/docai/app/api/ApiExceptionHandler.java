package com.optwise.docai.app.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.optwise.docai.app.config.DocAiProperties;
import com.optwise.docai.app.exception.DocumentNotFoundException;
import com.optwise.docai.app.exception.DocumentProcessingException;
import com.optwise.docai.app.exception.InvalidDocumentKeyException;
import com.optwise.docai.app.exception.InvalidListLimitException;
import com.optwise.docai.app.exception.InvalidS3EventException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to {@code {"success": false, "error": {"code", "message"}}}. Internal details
 * are only attached when {@code docai.environment=dev}.
 */
@Log4j2
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

  private final DocAiProperties props;

  @ExceptionHandler({
    InvalidS3EventException.class,
    InvalidDocumentKeyException.class,
    InvalidListLimitException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(DocumentProcessingException ex) {
    log.warn("api.bad-request code={} msg={}", ex.getCode(), ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, null);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return error(
        HttpStatus.BAD_REQUEST, "INVALID_PARAMETER", ex.getName() + " has an invalid value", null);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParam(MissingServletRequestParameterException ex) {
    return error(
        HttpStatus.BAD_REQUEST,
        "MISSING_PARAMETER",
        ex.getParameterName() + " parameter is required",
        null);
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(DocumentNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ex.getCode(), ex.getMessage(), null);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ErrorResponse> handleProcessing(DocumentProcessingException ex) {
    log.error("api.processing-error code={} msg={}", ex.getCode(), ex.getMessage(), ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ex.getCode(),
        "Internal processing error",
        details(ex.getCause() == null ? ex : ex.getCause()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    log.error("api.unexpected-error type={} msg={}", ex.getClass().getSimpleName(), ex.getMessage(), ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        DocumentProcessingException.INTERNAL_ERROR,
        "An unexpected error occurred",
        details(ex));
  }

  private String details(Throwable t) {
    return props.isDev() ? t.getMessage() : null;
  }

  private static ResponseEntity<ErrorResponse> error(
      HttpStatus status, String code, String message, String details) {
    return ResponseEntity.status(status)
        .body(new ErrorResponse(false, new ErrorBody(code, message, details)));
  }

  @Value
  public static class ErrorResponse {
    boolean success;
    ErrorBody error;
  }

  @Value
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ErrorBody {
    String code;
    String message;
    String details;
  }
}
