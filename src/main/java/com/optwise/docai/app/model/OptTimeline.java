package com.optwise.docai.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * OPT deadline snapshot derived from a program end date and "today".
 *
 * <p>Read-only and recomputed on every call. An unparseable end date produces an error timeline
 * ({@link TimelineStatus#ERROR}) that carries only {@code status} and {@code error}.
 *
 * <p>Day counts are signed: negative means the date has already passed.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OptTimeline {

  LocalDate programEndDate;

  LocalDate optWindowOpens;

  LocalDate recommendedApplyBy;

  /** Same as the program end date: the last day an OPT application can be filed. */
  LocalDate lastDayToApply;

  LocalDate gracePeriodEnds;

  Integer daysUntilWindow;

  Integer daysUntilDeadline;

  Integer daysUntilGraceEnd;

  TimelineStatus status;

  Urgency urgency;

  String statusMessage;

  String displayLabel;

  List<String> actionItems;

  List<TimelineWarning> warnings;

  /** Set only on error timelines. */
  String error;

  @JsonIgnore
  public boolean isError() {
    return status == TimelineStatus.ERROR;
  }

  public static OptTimeline error(String message) {
    return OptTimeline.builder().status(TimelineStatus.ERROR).error(message).build();
  }
}
