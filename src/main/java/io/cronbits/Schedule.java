package io.cronbits;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.cronbits.ast.FieldMasks;
import io.cronbits.eval.Evaluator;
import io.cronbits.parser.Parser;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for parsing and evaluating 5-field cron expressions.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Schedule schedule = Schedule.parse("30 9 * * mon-fri");
 * ZonedDateTime next = schedule.nextFrom(ZonedDateTime.now(ZoneId.of("Europe/Paris")));
 * System.out.println("Next occurrence: " + next);
 * }</pre>
 *
 * <p>Day of month and day of week must both match: {@code 0 0 13 * fri} fires only on Friday
 * the 13th. Times are computed in the zone of the reference time passed to each query.
 *
 * <p>A Schedule is immutable and may be shared between threads. It serializes with Jackson as its
 * source text.
 */
public final class Schedule {
  private static final Logger logger = LoggerFactory.getLogger(Schedule.class);

  private final String source;
  private final FieldMasks masks;

  private Schedule(String source, FieldMasks masks) {
    this.source = source;
    this.masks = masks;
  }

  /**
   * Parses a cron expression into a Schedule.
   *
   * @param input the cron expression, fields separated by single spaces
   * @return the parsed schedule
   * @throws CronException if the input is invalid
   */
  public static Schedule parse(String input) throws CronException {
    try {
      return new Schedule(input, Parser.parse(input));
    } catch (CronException e) {
      logger.debug("rejected cron expression \"{}\" ({}): {}", input, e.kind(), e.getMessage());
      throw e;
    }
  }

  /**
   * Parses a cron expression that is known to be valid, such as a constant.
   *
   * @param input the cron expression
   * @return the parsed schedule
   * @throws IllegalArgumentException if the input is invalid
   */
  public static Schedule mustParse(String input) {
    try {
      return parse(input);
    } catch (CronException e) {
      throw new IllegalArgumentException(
          "cron: parsing \"" + input + "\": " + e.getMessage(), e);
    }
  }

  /**
   * Restores a schedule from its source text. Used by Jackson.
   *
   * @param text the source text, as produced by {@link #toString()}
   * @return the parsed schedule
   * @throws CronException if the text is not a valid expression
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Schedule fromText(String text) throws CronException {
    return parse(text);
  }

  /**
   * Validates a cron expression without throwing.
   *
   * @param input the cron expression
   * @return true if the expression is valid
   */
  public static boolean validate(String input) {
    try {
      Parser.parse(input);
      return true;
    } catch (CronException e) {
      return false;
    }
  }

  /**
   * Computes the first firing instant after the given time. Seconds and nanos of {@code now} are
   * ignored, so the result is always later than the minute containing {@code now}.
   *
   * @param now the reference time
   * @return the next firing instant, in the zone of {@code now}
   */
  public ZonedDateTime nextFrom(ZonedDateTime now) {
    return Evaluator.nextFrom(masks, now);
  }

  /**
   * Computes the next n firing instants after the given time.
   *
   * @param now the reference time
   * @param n the number of instants to compute
   * @return a list of the next n firing instants
   */
  public List<ZonedDateTime> nextNFrom(ZonedDateTime now, int n) {
    return Evaluator.nextNFrom(masks, now, n);
  }

  /**
   * Computes the last firing instant before the minute containing the given time.
   *
   * @param now the reference time (exclusive upper bound)
   * @return the previous firing instant, in the zone of {@code now}
   */
  public ZonedDateTime previousFrom(ZonedDateTime now) {
    return Evaluator.previousFrom(masks, now);
  }

  /**
   * Checks if the schedule fires at the given time.
   *
   * @param datetime the datetime to check
   * @return true if the datetime is a firing instant
   */
  public boolean matches(ZonedDateTime datetime) {
    return Evaluator.matches(masks, datetime);
  }

  /**
   * Returns a lazy, unbounded stream of firing instants after the given time.
   *
   * @param from the reference time (exclusive)
   * @return a stream of firing instants, ascending
   */
  public Stream<ZonedDateTime> occurrences(ZonedDateTime from) {
    return Evaluator.occurrences(masks, from);
  }

  /**
   * Returns a lazy, unbounded stream of firing instants before the given time.
   *
   * @param from the reference time (exclusive)
   * @return a stream of firing instants, descending
   */
  public Stream<ZonedDateTime> occurrencesBefore(ZonedDateTime from) {
    return Evaluator.occurrencesBefore(masks, from);
  }

  /**
   * Returns a lazy stream of firing instants where from &lt; instant &lt;= to.
   *
   * @param from the start time (exclusive)
   * @param to the end time (inclusive)
   * @return a stream of firing instants in the range
   */
  public Stream<ZonedDateTime> between(ZonedDateTime from, ZonedDateTime to) {
    return Evaluator.between(masks, from, to);
  }

  /**
   * Returns the parsed field masks.
   *
   * @return the field masks
   */
  public FieldMasks masks() {
    return masks;
  }

  /**
   * Returns the source text this schedule was parsed from, unchanged.
   *
   * @return the source text
   */
  @JsonValue
  @Override
  public String toString() {
    return source;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Schedule)) {
      return false;
    }
    return source.equals(((Schedule) o).source);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source);
  }
}
