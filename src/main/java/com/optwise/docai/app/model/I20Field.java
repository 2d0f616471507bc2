package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;

/**
 * The fixed set of fields extracted from an I-20 form.
 *
 * <p>{@code jsonName} is the key used in the AI response, in persisted records and in API payloads.
 * Required fields are the ones the validator enforces presence and confidence for.
 */
public enum I20Field {
  FULL_NAME("full_name", "Student name", true),
  SEVIS_ID("sevis_id", "SEVIS ID", true),
  DATE_OF_BIRTH("date_of_birth", "Date of birth", false),
  PROGRAM_END_DATE("program_end_date", "Program end date", true),
  SCHOOL_NAME("school_name", "School name", true),
  DEGREE_PROGRAM("degree_program", "Degree program", false),
  SCHOOL_ADDRESS("school_address", "School address", false);

  private final String jsonName;
  private final String displayName;
  private final boolean required;

  I20Field(String jsonName, String displayName, boolean required) {
    this.jsonName = jsonName;
    this.displayName = displayName;
    this.required = required;
  }

  @JsonValue
  public String getJsonName() {
    return jsonName;
  }

  public String getDisplayName() {
    return displayName;
  }

  public boolean isRequired() {
    return required;
  }

  /** Required fields in validation order: full_name, sevis_id, program_end_date, school_name. */
  public static List<I20Field> requiredFields() {
    return Arrays.stream(values()).filter(I20Field::isRequired).toList();
  }
}
