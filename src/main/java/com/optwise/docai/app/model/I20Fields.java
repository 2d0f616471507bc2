package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Fixed-schema set of extracted I-20 fields.
 *
 * <p>Every {@link I20Field} is either present with an {@link ExtractedField} or absent. Absence is
 * meaningful: the validator reports a missing required field as critical. Instances are immutable.
 */
@ToString
@EqualsAndHashCode
public final class I20Fields {

  private final Map<I20Field, ExtractedField> fields;

  private I20Fields(Map<I20Field, ExtractedField> fields) {
    this.fields = Collections.unmodifiableMap(new EnumMap<>(fields));
  }

  public static I20Fields empty() {
    return new I20Fields(new EnumMap<>(I20Field.class));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<ExtractedField> get(I20Field field) {
    return Optional.ofNullable(fields.get(field));
  }

  public boolean isPresent(I20Field field) {
    return fields.containsKey(field);
  }

  public Optional<ExtractedField> fullName() {
    return get(I20Field.FULL_NAME);
  }

  public Optional<ExtractedField> sevisId() {
    return get(I20Field.SEVIS_ID);
  }

  public Optional<ExtractedField> programEndDate() {
    return get(I20Field.PROGRAM_END_DATE);
  }

  public Optional<ExtractedField> schoolName() {
    return get(I20Field.SCHOOL_NAME);
  }

  public Optional<ExtractedField> schoolAddress() {
    return get(I20Field.SCHOOL_ADDRESS);
  }

  public int size() {
    return fields.size();
  }

  /** Present fields keyed by their JSON name, in {@link I20Field} declaration order. */
  @JsonValue
  public Map<String, ExtractedField> asMap() {
    Map<String, ExtractedField> out = new LinkedHashMap<>();
    fields.forEach((k, v) -> out.put(k.getJsonName(), v));
    return Collections.unmodifiableMap(out);
  }

  public static final class Builder {
    private final Map<I20Field, ExtractedField> fields = new EnumMap<>(I20Field.class);

    private Builder() {}

    public Builder put(I20Field field, ExtractedField value) {
      fields.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder put(I20Field field, String value, double confidence) {
      return put(field, ExtractedField.of(value, confidence));
    }

    public I20Fields build() {
      return new I20Fields(fields);
    }
  }
}
