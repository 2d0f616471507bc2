package com.optwise.docai.app.service;

import com.optwise.docai.app.model.OptTimeline;
import com.optwise.docai.app.model.TimelineStatus;
import com.optwise.docai.app.model.TimelineWarning;
import com.optwise.docai.app.model.TimelineWarning.Severity;
import com.optwise.docai.app.model.Urgency;
import com.optwise.docai.app.util.IsoDates;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives the OPT application timeline for an F-1 student from the program end date.
 *
 * <ul>
 *   <li>the OPT window opens 90 days before the program end date
 *   <li>applying 30 days before the end date is recommended
 *   <li>the program end date is the last day to apply
 *   <li>the grace period ends 60 days after the program end date
 * </ul>
 *
 * <p>The calculation is a pure function of the end date and "today"; the {@link Clock} is only
 * consulted by {@link #calculate(String)}.
 */
public class OptTimelineCalculator {

  public static final int OPT_WINDOW_DAYS = 90;
  public static final int RECOMMENDED_BUFFER_DAYS = 30;
  public static final int GRACE_PERIOD_DAYS = 60;

  /** Preparation horizon before the window opens; only shapes the status, not any date. */
  public static final int PREPARATION_DAYS = 120;

  static final int MIN_YEAR = 1900;
  static final int MAX_YEAR = 9999;

  static final int CRITICAL_DAYS = 7;
  static final int URGENT_DAYS = 30;

  private final Clock clock;

  public OptTimelineCalculator(Clock clock) {
    this.clock = clock;
  }

  public OptTimeline calculate(String programEndDate) {
    return calculate(programEndDate, LocalDate.now(clock));
  }

  /**
   * Never throws for bad input: an unparseable date, or one whose year falls outside {@value
   * #MIN_YEAR}..{@value #MAX_YEAR}, yields an error timeline.
   */
  public OptTimeline calculate(String programEndDate, LocalDate today) {
    Optional<LocalDate> parsed = IsoDates.parse(programEndDate);
    if (parsed.isEmpty()) {
      return OptTimeline.error("Invalid program end date format. Must be YYYY-MM-DD.");
    }
    int year = parsed.get().getYear();
    if (year < MIN_YEAR || year > MAX_YEAR) {
      return OptTimeline.error(
          "Program end date must be between years " + MIN_YEAR + " and " + MAX_YEAR + ".");
    }
    return calculate(parsed.get(), today);
  }

  public OptTimeline calculate(LocalDate endDate, LocalDate today) {
    LocalDate windowOpens = endDate.minusDays(OPT_WINDOW_DAYS);
    LocalDate recommendedApplyBy = endDate.minusDays(RECOMMENDED_BUFFER_DAYS);
    LocalDate graceEnds = endDate.plusDays(GRACE_PERIOD_DAYS);

    int daysUntilWindow = daysBetween(today, windowOpens);
    int daysUntilDeadline = daysBetween(today, endDate);
    int daysUntilGraceEnd = daysBetween(today, graceEnds);

    TimelineStatus status;
    Urgency urgency;
    String message;

    if (today.isBefore(windowOpens)) {
      if (daysUntilWindow > PREPARATION_DAYS) {
        status = TimelineStatus.FAR_BEFORE_WINDOW;
        urgency = Urgency.NONE;
        message = "Your OPT window is not open yet. Start preparing soon.";
      } else {
        status = TimelineStatus.BEFORE_WINDOW;
        urgency = Urgency.LOW;
        message = "Your OPT window opens in " + daysUntilWindow + " days. Time to prepare!";
      }
    } else if (!today.isAfter(endDate)) {
      if (daysUntilDeadline <= CRITICAL_DAYS) {
        status = TimelineStatus.IN_WINDOW_CRITICAL;
        urgency = Urgency.CRITICAL;
        message = "URGENT: Only " + daysUntilDeadline + " days left to apply!";
      } else if (daysUntilDeadline <= URGENT_DAYS) {
        status = TimelineStatus.IN_WINDOW_URGENT;
        urgency = Urgency.HIGH;
        message = "Application deadline approaching: " + daysUntilDeadline + " days remaining";
      } else {
        status = TimelineStatus.IN_WINDOW;
        urgency = Urgency.MEDIUM;
        message = "Your OPT window is open. " + daysUntilDeadline + " days to apply.";
      }
    } else if (!today.isAfter(graceEnds)) {
      status = TimelineStatus.GRACE_PERIOD;
      urgency = Urgency.HIGH;
      message = "You are in the 60-day grace period. " + daysUntilGraceEnd + " days remaining.";
    } else {
      status = TimelineStatus.EXPIRED;
      urgency = Urgency.CRITICAL;
      message = "Grace period has ended. Immediate action required.";
    }

    return OptTimeline.builder()
        .programEndDate(endDate)
        .optWindowOpens(windowOpens)
        .recommendedApplyBy(recommendedApplyBy)
        .lastDayToApply(endDate)
        .gracePeriodEnds(graceEnds)
        .daysUntilWindow(daysUntilWindow)
        .daysUntilDeadline(daysUntilDeadline)
        .daysUntilGraceEnd(daysUntilGraceEnd)
        .status(status)
        .urgency(urgency)
        .statusMessage(message)
        .displayLabel(status.getDisplayLabel())
        .actionItems(
            actionItems(
                status, windowOpens, recommendedApplyBy, endDate, graceEnds, daysUntilWindow,
                daysUntilDeadline))
        .warnings(warnings(status))
        .build();
  }

  private static List<String> actionItems(
      TimelineStatus status,
      LocalDate windowOpens,
      LocalDate recommendedApplyBy,
      LocalDate lastDay,
      LocalDate graceEnds,
      int daysUntilWindow,
      int daysUntilDeadline) {

    return switch (status) {
      case FAR_BEFORE_WINDOW -> List.of(
          "Review OPT eligibility requirements",
          "Start saving for $410 USCIS filing fee",
          "Familiarize yourself with I-765 form",
          "Keep your passport valid (6+ months)",
          "OPT window opens in " + daysUntilWindow + " days");
      case BEFORE_WINDOW -> List.of(
          "Gather required documents (passport, I-20, transcripts)",
          "Get passport photos taken (2\" x 2\", recent)",
          "Download and review I-765 form",
          "Prepare filing fee ($410 check or money order)",
          "Schedule meeting with DSO for signature",
          "Window opens on " + windowOpens);
      case IN_WINDOW -> List.of(
          "Complete I-765 application form",
          "Get DSO signature on I-20 (page 3)",
          "Make copies of all documents (2 sets)",
          "Get check/money order for $410",
          "Review USCIS mailing address",
          "Recommended to apply by " + recommendedApplyBy,
          daysUntilDeadline + " days remaining");
      case IN_WINDOW_URGENT -> List.of(
          "URGENT: Apply as soon as possible",
          "Complete I-765 form TODAY",
          "Get DSO signature IMMEDIATELY",
          "Prepare all documents and copies",
          "Use certified mail with tracking",
          "Deadline: " + lastDay + " (" + daysUntilDeadline + " days)");
      case IN_WINDOW_CRITICAL -> List.of(
          "CRITICAL: Apply IMMEDIATELY - express processing recommended",
          "Complete I-765 RIGHT NOW",
          "Visit DSO TODAY for signature",
          "Use overnight/express mail",
          "Document everything with photos/receipts",
          "FINAL DEADLINE: " + lastDay);
      case GRACE_PERIOD -> List.of(
          "You are in the 60-day grace period after graduation",
          "If you applied for OPT: Track application status online",
          "If you didn't apply: Consider other visa options (H-1B, transfer)",
          "Cannot work until EAD card is received",
          "Consult with DSO about your options",
          "Grace period ends: " + graceEnds);
      case EXPIRED -> List.of(
          "Grace period has ended",
          "You may be out of status",
          "Contact immigration attorney IMMEDIATELY",
          "Do NOT work without proper authorization",
          "Discuss options with DSO and lawyer");
      case ERROR -> List.of("Contact your DSO for guidance");
    };
  }

  private static List<TimelineWarning> warnings(TimelineStatus status) {
    List<TimelineWarning> warnings = new ArrayList<>();
    switch (status) {
      case IN_WINDOW_CRITICAL -> warnings.add(
          new TimelineWarning(
              Severity.CRITICAL,
              "Less than 7 days to apply for OPT. Apply immediately to avoid missing the deadline.",
              "Visit your DSO today"));
      case EXPIRED -> warnings.add(
          new TimelineWarning(
              Severity.CRITICAL,
              "Grace period has ended. You may be out of status and need immediate legal advice.",
              "Contact immigration attorney ASAP"));
      case IN_WINDOW_URGENT -> warnings.add(
          new TimelineWarning(
              Severity.HIGH,
              "Less than 30 days to apply. Start your application now to avoid issues.",
              "Begin I-765 application immediately"));
      case GRACE_PERIOD -> warnings.add(
          new TimelineWarning(
              Severity.HIGH,
              "You are in your 60-day grace period. Cannot work without EAD card.",
              "Track your OPT application status"));
      default -> {
        // no status-specific warning
      }
    }
    if (status.isInWindow()) {
      warnings.add(
          new TimelineWarning(
              Severity.INFO,
              "USCIS processing typically takes 90-120 days. Apply early for peace of mind.",
              null));
    }
    return List.copyOf(warnings);
  }

  private static int daysBetween(LocalDate from, LocalDate to) {
    return Math.toIntExact(ChronoUnit.DAYS.between(from, to));
  }
}
