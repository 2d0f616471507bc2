package com.optwise.docai.app.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class IsoDatesTest {

  @Test
  void parsesPlainAndTimestampedDates() {
    LocalDate expected = LocalDate.of(2025, 12, 15);

    assertThat(IsoDates.parse("2025-12-15")).contains(expected);
    assertThat(IsoDates.parse(" 2025-12-15 ")).contains(expected);
    assertThat(IsoDates.parse("2025-12-15T10:00:00")).contains(expected);
    assertThat(IsoDates.parse("2025-12-15T10:00:00Z")).contains(expected);
    assertThat(IsoDates.parse("2025-12-15T10:00:00-05:00")).contains(expected);
  }

  @Test
  void rejectsEverythingElse() {
    assertThat(IsoDates.parse(null)).isEmpty();
    assertThat(IsoDates.parse("")).isEmpty();
    assertThat(IsoDates.parse("not-a-date")).isEmpty();
    assertThat(IsoDates.parse("12/15/2025")).isEmpty();
    assertThat(IsoDates.parse("2025-02-30")).isEmpty();
  }
}
