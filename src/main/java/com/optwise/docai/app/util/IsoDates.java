package com.optwise.docai.app.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/** Lenient ISO-8601 date parsing shared by the validator and the timeline calculator. */
public final class IsoDates {

  private static final List<Function<String, LocalDate>> PARSERS =
      List.of(
          LocalDate::parse,
          s -> LocalDateTime.parse(s).toLocalDate(),
          s -> OffsetDateTime.parse(s).toLocalDate());

  private IsoDates() {}

  /**
   * Parses {@code 2025-12-15}, {@code 2025-12-15T10:00:00} or {@code 2025-12-15T10:00:00Z} into a
   * calendar date. Anything else, including null or blank, yields empty.
   */
  public static Optional<LocalDate> parse(String text) {
    if (text == null || text.isBlank()) return Optional.empty();
    String s = text.trim();
    for (Function<String, LocalDate> parser : PARSERS) {
      Optional<LocalDate> parsed = tryParse(parser, s);
      if (parsed.isPresent()) return parsed;
    }
    return Optional.empty();
  }

  private static Optional<LocalDate> tryParse(Function<String, LocalDate> parser, String s) {
    try {
      return Optional.of(parser.apply(s));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
