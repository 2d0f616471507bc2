package com.optwise.docai.app.service;

import com.optwise.docai.app.model.ExtractedField;
import com.optwise.docai.app.model.I20Field;
import com.optwise.docai.app.model.I20Fields;
import com.optwise.docai.app.model.ValidationIssue;
import com.optwise.docai.app.model.ValidationIssue.Severity;
import com.optwise.docai.app.util.IsoDates;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;

/**
 * Deterministic business rules over extracted I-20 fields.
 *
 * <p>Every rule runs; nothing short-circuits. Issues come back in rule order: presence and
 * confidence per required field, SEVIS format, program end date, name length, school name length.
 */
@Log4j2
public class I20FieldValidator {

  public static final Pattern SEVIS_ID = Pattern.compile("^N\\d{10}$");

  static final int MIN_TEXT_LENGTH = 3;
  static final long MAX_DAYS_IN_PAST = 730;
  static final long MAX_DAYS_IN_FUTURE = 2190;

  private final Clock clock;
  private final double minConfidence;

  public I20FieldValidator(Clock clock, double minConfidence) {
    this.clock = clock;
    this.minConfidence = minConfidence;
  }

  public List<ValidationIssue> validate(I20Fields fields) {
    List<ValidationIssue> issues = new ArrayList<>();

    for (I20Field field : I20Field.requiredFields()) {
      Optional<ExtractedField> extracted = fields.get(field);
      if (extracted.isEmpty()) {
        issues.add(
            ValidationIssue.builder()
                .field(field)
                .severity(Severity.CRITICAL)
                .message(field.getDisplayName() + " is missing and is required")
                .suggestion("Please upload a clearer I-20 or enter manually")
                .build());
        continue;
      }
      double confidence = extracted.get().getConfidence();
      if (confidence < minConfidence) {
        issues.add(
            ValidationIssue.builder()
                .field(field)
                .severity(Severity.WARNING)
                .message(
                    "Low confidence ("
                        + Math.round(confidence * 100)
                        + "%) for "
                        + field.getDisplayName())
                .suggestion("Please verify this value is correct")
                .value(extracted.get().getValue())
                .build());
      }
    }

    fields.sevisId().ifPresent(f -> checkSevisId(f.getValue(), issues));
    fields.programEndDate().ifPresent(f -> checkProgramEndDate(f.getValue(), issues));
    fields
        .fullName()
        .ifPresent(
            f -> checkMinLength(I20Field.FULL_NAME, f.getValue(), "Name is too short or missing", issues));
    fields
        .schoolName()
        .ifPresent(
            f ->
                checkMinLength(
                    I20Field.SCHOOL_NAME, f.getValue(), "School name is too short or missing", issues));

    log.info(
        "validation.done total={} critical={} warnings={}",
        issues.size(),
        issues.stream().filter(ValidationIssue::isCritical).count(),
        issues.stream().filter(ValidationIssue::isWarning).count());
    return List.copyOf(issues);
  }

  public static boolean isValidSevisId(String value) {
    return value != null && SEVIS_ID.matcher(value).matches();
  }

  private static void checkSevisId(String value, List<ValidationIssue> issues) {
    if (isValidSevisId(value)) return;
    issues.add(
        ValidationIssue.builder()
            .field(I20Field.SEVIS_ID)
            .severity(Severity.CRITICAL)
            .message("Invalid SEVIS ID format: \"" + value + "\"")
            .suggestion("SEVIS ID should be \"N\" followed by 10 digits (e.g., N0012345678)")
            .value(value)
            .build());
  }

  private void checkProgramEndDate(String value, List<ValidationIssue> issues) {
    Optional<LocalDate> parsed = IsoDates.parse(value);
    if (parsed.isEmpty()) {
      issues.add(
          ValidationIssue.builder()
              .field(I20Field.PROGRAM_END_DATE)
              .severity(Severity.CRITICAL)
              .message("Invalid date format for program end date")
              .suggestion("Date should be in YYYY-MM-DD format")
              .value(value)
              .build());
      return;
    }

    LocalDate endDate = parsed.get();
    LocalDate today = LocalDate.now(clock);

    if (endDate.isBefore(today.minusDays(MAX_DAYS_IN_PAST))) {
      issues.add(
          ValidationIssue.builder()
              .field(I20Field.PROGRAM_END_DATE)
              .severity(Severity.WARNING)
              .message("Program end date (" + value + ") is over 2 years ago")
              .suggestion("This may be an old I-20. Please verify this is your current I-20.")
              .value(value)
              .build());
    }
    if (endDate.isAfter(today.plusDays(MAX_DAYS_IN_FUTURE))) {
      issues.add(
          ValidationIssue.builder()
              .field(I20Field.PROGRAM_END_DATE)
              .severity(Severity.WARNING)
              .message("Program end date (" + value + ") is over 6 years away")
              .suggestion("Please verify this date is correct.")
              .value(value)
              .build());
    }
  }

  private static void checkMinLength(
      I20Field field, String value, String message, List<ValidationIssue> issues) {
    if (value != null && value.length() >= MIN_TEXT_LENGTH) return;
    issues.add(
        ValidationIssue.builder()
            .field(field)
            .severity(Severity.CRITICAL)
            .message(message)
            .value(value)
            .build());
  }
}
