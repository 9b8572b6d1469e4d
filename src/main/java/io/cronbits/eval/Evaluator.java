package io.cronbits.eval;

import io.cronbits.ast.CronField;
import io.cronbits.ast.FieldMasks;
import io.cronbits.ast.Weekday;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the firing instants of parsed field masks.
 *
 * <h2>Search</h2>
 *
 * <p>Both directions run two nested searches on a minute-aligned candidate. The day search fixes
 * the month, then the day of month, then the day of week, re-normalizing the date after every
 * move. Day of month and day of week must both match. The time search then fixes the hour and the
 * minute on that day. When a time move crosses midnight the day search starts over from the new
 * candidate. Every move jumps straight to the next permitted value with {@link Bits}, so a call
 * costs a handful of steps per calendar unit.
 *
 * <p>A search always ends: the masks are non-empty, at least one permitted day of month exists in
 * some permitted month, and every move strictly advances (or retreats) the candidate.
 *
 * <h2>DST (Daylight Saving Time) Handling</h2>
 *
 * <p>Wall-clock fields are read in the zone of the reference time. When a move lands on a local
 * time that has to be resolved to an instant:
 *
 * <ol>
 *   <li><b>DST Gap (Spring Forward):</b> the local time does not exist. A forward search continues
 *       at the end of the gap, a backward search at the last minute before it. Wall-clock times
 *       inside the gap never fire.
 *   <li><b>DST Fold (Fall Back):</b> the local time is ambiguous and fires in both passes, as
 *       every instant whose wall-clock fields match does. A search keeps the offset of its
 *       current candidate, so it only sees one pass. When its result lies across a fall-back
 *       transition, the search is run again from the transition, in the other pass.
 * </ol>
 */
public final class Evaluator {
  private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

  private Evaluator() {}

  /**
   * Computes the first firing instant strictly after the minute containing {@code from}.
   *
   * @param masks the field masks
   * @param from the reference time
   * @return the next firing instant, minute-aligned, in {@code from}'s zone
   */
  public static ZonedDateTime nextFrom(FieldMasks masks, ZonedDateTime from) {
    ZonedDateTime start = from.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
    ZoneRules rules = start.getZone().getRules();
    while (true) {
      ZonedDateTime found = searchForward(masks, start);
      ZoneOffsetTransition fold = firstOverlapAfter(rules, start.toInstant(), found.toInstant());
      if (fold == null) {
        return found;
      }
      // The search ran in the earlier offset and skipped the repeated hour.
      logger.trace("rescanning from fall-back transition at {}", fold.getInstant());
      start = firstMinuteAtOrAfter(fold.getInstant(), start.getZone());
    }
  }

  /** Returns the first firing instant at or after the minute-aligned {@code start}. */
  private static ZonedDateTime searchForward(FieldMasks masks, ZonedDateTime start) {
    ZonedDateTime t = start;
    while (true) {
      t = nextDay(masks, t);
      LocalDate day = t.toLocalDate();
      t = nextTimeOfDay(masks, t, day);
      if (t.toLocalDate().equals(day)) {
        return t;
      }
      logger.trace("no firing time left on {}, searching days again from {}", day, t);
    }
  }

  /**
   * Computes the last firing instant strictly before the minute containing {@code from}.
   *
   * @param masks the field masks
   * @param from the reference time
   * @return the previous firing instant, minute-aligned, in {@code from}'s zone
   */
  public static ZonedDateTime previousFrom(FieldMasks masks, ZonedDateTime from) {
    ZonedDateTime start = from.truncatedTo(ChronoUnit.MINUTES).minusMinutes(1);
    ZoneRules rules = start.getZone().getRules();
    while (true) {
      ZonedDateTime found = searchBackward(masks, start);
      ZoneOffsetTransition fold = lastOverlapBefore(rules, start.toInstant(), found.toInstant());
      if (fold == null) {
        return found;
      }
      // The search ran in the later offset and skipped the first pass of the repeated hour.
      logger.trace("rescanning from before fall-back transition at {}", fold.getInstant());
      start = lastMinuteBefore(fold.getInstant(), start.getZone());
    }
  }

  /** Returns the last firing instant at or before the minute-aligned {@code start}. */
  private static ZonedDateTime searchBackward(FieldMasks masks, ZonedDateTime start) {
    ZonedDateTime t = start;
    while (true) {
      t = previousDay(masks, t);
      LocalDate day = t.toLocalDate();
      t = previousTimeOfDay(masks, t, day);
      if (t.toLocalDate().equals(day)) {
        return t;
      }
      logger.trace("no firing time left on {}, searching days again from {}", day, t);
    }
  }

  /**
   * Computes the next n firing instants after the given time.
   *
   * @param masks the field masks
   * @param from the reference time
   * @param n the number of instants to compute
   * @return a list of the next n firing instants, in ascending order
   */
  public static List<ZonedDateTime> nextNFrom(FieldMasks masks, ZonedDateTime from, int n) {
    if (n < 0) {
      throw new IllegalArgumentException("n must not be negative: " + n);
    }
    List<ZonedDateTime> results = new ArrayList<>(n);
    ZonedDateTime current = from;
    for (int i = 0; i < n; i++) {
      current = nextFrom(masks, current);
      results.add(current);
    }
    return results;
  }

  /**
   * Returns a lazy, unbounded stream of firing instants after the given time, ascending.
   *
   * @param masks the field masks
   * @param from the reference time (exclusive)
   * @return a stream of firing instants
   */
  public static Stream<ZonedDateTime> occurrences(FieldMasks masks, ZonedDateTime from) {
    return iterate(from, t -> nextFrom(masks, t));
  }

  /**
   * Returns a lazy, unbounded stream of firing instants before the given time, descending.
   *
   * @param masks the field masks
   * @param from the reference time (exclusive)
   * @return a stream of firing instants
   */
  public static Stream<ZonedDateTime> occurrencesBefore(FieldMasks masks, ZonedDateTime from) {
    return iterate(from, t -> previousFrom(masks, t));
  }

  /**
   * Returns a lazy stream of firing instants where from &lt; instant &lt;= to.
   *
   * @param masks the field masks
   * @param from the start time (exclusive)
   * @param to the end time (inclusive)
   * @return a stream of firing instants in the range
   */
  public static Stream<ZonedDateTime> between(
      FieldMasks masks, ZonedDateTime from, ZonedDateTime to) {
    return occurrences(masks, from).takeWhile(dt -> !dt.isAfter(to));
  }

  /**
   * Checks whether a time is a firing instant: zero seconds and nanos, and every wall-clock field
   * permitted.
   *
   * @param masks the field masks
   * @param dt the time to check
   * @return true if the schedule fires at {@code dt}
   */
  public static boolean matches(FieldMasks masks, ZonedDateTime dt) {
    return dt.getSecond() == 0
        && dt.getNano() == 0
        && masks.permits(CronField.MINUTES, dt.getMinute())
        && masks.permits(CronField.HOURS, dt.getHour())
        && masks.permits(CronField.DAYS_OF_MONTH, dt.getDayOfMonth())
        && masks.permits(CronField.MONTHS, dt.getMonthValue())
        && masks.permits(CronField.DAYS_OF_WEEK, Weekday.cronDOW(dt.getDayOfWeek()));
  }

  /** Returns the first candidate at or after {@code t} whose date is permitted. */
  private static ZonedDateTime nextDay(FieldMasks masks, ZonedDateTime t) {
    long months = masks.get(CronField.MONTHS);
    long days = masks.get(CronField.DAYS_OF_MONTH);
    long weekdays = masks.get(CronField.DAYS_OF_WEEK);
    while (true) {
      int year = t.getYear();
      int month = t.getMonthValue();
      int day = t.getDayOfMonth();
      int dow = Weekday.cronDOW(t.getDayOfWeek());
      if (!isSet(months, month)) {
        month = Bits.next(month, 12, months);
        day = 1;
      } else if (!isSet(days, day)) {
        day = Bits.next(day, YearMonth.of(year, month).lengthOfMonth(), days);
      } else if (!isSet(weekdays, dow)) {
        day += Bits.next(dow, 6, weekdays) - dow;
      } else {
        return t;
      }
      t = resolve(normalize(year, month, day).atStartOfDay(), t, true);
    }
  }

  /**
   * Returns the first firing time at or after {@code t} on {@code day}, or the first candidate on
   * a later day if none is left.
   */
  private static ZonedDateTime nextTimeOfDay(FieldMasks masks, ZonedDateTime t, LocalDate day) {
    long hours = masks.get(CronField.HOURS);
    long minutes = masks.get(CronField.MINUTES);
    while (true) {
      int hour = t.getHour();
      int minute = t.getMinute();
      if (!isSet(hours, hour)) {
        hour = Bits.next(hour, 23, hours);
        minute = 0;
      } else if (!isSet(minutes, minute)) {
        minute = Bits.next(minute, 59, minutes);
      } else {
        return t;
      }
      t = resolve(day.atStartOfDay().plusHours(hour).plusMinutes(minute), t, true);
      if (!t.toLocalDate().equals(day)) {
        return t;
      }
    }
  }

  /** Returns the last candidate at or before {@code t} whose date is permitted. */
  private static ZonedDateTime previousDay(FieldMasks masks, ZonedDateTime t) {
    long months = masks.get(CronField.MONTHS);
    long days = masks.get(CronField.DAYS_OF_MONTH);
    long weekdays = masks.get(CronField.DAYS_OF_WEEK);
    while (true) {
      int year = t.getYear();
      int month = t.getMonthValue();
      int day = t.getDayOfMonth();
      int dow = Weekday.cronDOW(t.getDayOfWeek());
      if (!isSet(months, month)) {
        // Day 0 of the month after the previous permitted month is that month's last day.
        month = Bits.prev(month, 1, months) + 1;
        day = 0;
      } else if (!isSet(days, day)) {
        day = Bits.prev(day, 1, days);
      } else if (!isSet(weekdays, dow)) {
        day -= dow - Bits.prev(dow, 0, weekdays);
      } else {
        return t;
      }
      t = resolve(normalize(year, month, day).atTime(23, 59), t, false);
    }
  }

  /**
   * Returns the last firing time at or before {@code t} on {@code day}, or the last candidate on
   * an earlier day if none is left.
   */
  private static ZonedDateTime previousTimeOfDay(
      FieldMasks masks, ZonedDateTime t, LocalDate day) {
    long hours = masks.get(CronField.HOURS);
    long minutes = masks.get(CronField.MINUTES);
    while (true) {
      int hour = t.getHour();
      int minute = t.getMinute();
      if (!isSet(hours, hour)) {
        // Minute -1 of the hour after the previous permitted hour is that hour's last minute.
        hour = Bits.prev(hour, 0, hours) + 1;
        minute = -1;
      } else if (!isSet(minutes, minute)) {
        minute = Bits.prev(minute, 0, minutes);
      } else {
        return t;
      }
      t = resolve(day.atStartOfDay().plusHours(hour).plusMinutes(minute), t, false);
      if (!t.toLocalDate().equals(day)) {
        return t;
      }
    }
  }

  private static boolean isSet(long mask, int bit) {
    return (mask & (1L << bit)) != 0;
  }

  /** Builds a date from fields that may be out of range, carrying overflow like a calendar. */
  private static LocalDate normalize(int year, int month, int day) {
    return LocalDate.of(year, 1, 1).plusMonths(month - 1L).plusDays(day - 1L);
  }

  /**
   * Resolves a local time in the zone of {@code current}, preferring the offset of {@code
   * current}. A local time inside a DST gap resolves to the end of the gap when searching forward
   * and to the minute before the gap when searching backward.
   */
  private static ZonedDateTime resolve(
      LocalDateTime local, ZonedDateTime current, boolean forward) {
    ZoneId zone = current.getZone();
    ZoneRules rules = zone.getRules();
    if (rules.getValidOffsets(local).isEmpty()) {
      Instant gapEnd = rules.getTransition(local).getInstant();
      return ZonedDateTime.ofInstant(
          forward ? gapEnd : gapEnd.minus(1, ChronoUnit.MINUTES), zone);
    }
    return ZonedDateTime.ofLocal(local, zone, current.getOffset());
  }

  /** Returns the first fall-back transition in {@code (after, until]}, or null. */
  private static ZoneOffsetTransition firstOverlapAfter(
      ZoneRules rules, Instant after, Instant until) {
    ZoneOffsetTransition tr = rules.nextTransition(after);
    while (tr != null && !tr.getInstant().isAfter(until)) {
      if (tr.isOverlap()) {
        return tr;
      }
      tr = rules.nextTransition(tr.getInstant());
    }
    return null;
  }

  /** Returns the last fall-back transition in {@code (until, before]}, or null. */
  private static ZoneOffsetTransition lastOverlapBefore(
      ZoneRules rules, Instant before, Instant until) {
    // previousTransition is exclusive of its argument.
    ZoneOffsetTransition tr = rules.previousTransition(before.plusNanos(1));
    while (tr != null && tr.getInstant().isAfter(until)) {
      if (tr.isOverlap()) {
        return tr;
      }
      tr = rules.previousTransition(tr.getInstant());
    }
    return null;
  }

  private static ZonedDateTime firstMinuteAtOrAfter(Instant instant, ZoneId zone) {
    ZonedDateTime t = ZonedDateTime.ofInstant(instant, zone);
    ZonedDateTime truncated = t.truncatedTo(ChronoUnit.MINUTES);
    return truncated.isBefore(t) ? truncated.plusMinutes(1) : truncated;
  }

  private static ZonedDateTime lastMinuteBefore(Instant instant, ZoneId zone) {
    return ZonedDateTime.ofInstant(instant.minusNanos(1), zone).truncatedTo(ChronoUnit.MINUTES);
  }

  private static Stream<ZonedDateTime> iterate(
      ZonedDateTime from, UnaryOperator<ZonedDateTime> step) {
    Iterator<ZonedDateTime> iterator =
        new Iterator<>() {
          private ZonedDateTime current = from;

          @Override
          public boolean hasNext() {
            return true;
          }

          @Override
          public ZonedDateTime next() {
            current = step.apply(current);
            return current;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }
}
