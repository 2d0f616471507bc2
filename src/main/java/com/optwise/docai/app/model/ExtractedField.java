package com.optwise.docai.app.model;

import lombok.Value;

/**
 * A single value pulled out of the document by the structuring step, with the model's confidence
 * in [0, 1].
 */
@Value
public class ExtractedField {

  /** Extracted text; never null (an absent field is modelled by absence, not by null). */
  String value;

  /** Model confidence, clamped into [0, 1]. */
  double confidence;

  public static ExtractedField of(String value, double confidence) {
    double c = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
    return new ExtractedField(value == null ? "" : value, c);
  }
}
