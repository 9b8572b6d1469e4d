package io.cronbits.ast;

/** One of the five calendar dimensions of a cron expression, in expression order. */
public enum CronField {
  MINUTES(0, 59, "minutes"),
  HOURS(0, 23, "hours"),
  DAYS_OF_MONTH(1, 31, "days of month"),
  MONTHS(1, 12, "months"),
  DAYS_OF_WEEK(0, 6, "days of week");

  private final int min;
  private final int max;
  private final String displayName;

  CronField(int min, int max, String displayName) {
    this.min = min;
    this.max = max;
    this.displayName = displayName;
  }

  /**
   * Returns the smallest value the field accepts.
   *
   * @return the lower bound of the domain
   */
  public int min() {
    return min;
  }

  /**
   * Returns the largest value the field accepts.
   *
   * @return the upper bound of the domain
   */
  public int max() {
    return max;
  }

  /**
   * Returns the bitmask with every value of the domain set.
   *
   * @return the full-domain mask
   */
  public long fullMask() {
    return (-1L >>> (63 - max)) & (-1L << min);
  }

  /**
   * Resolves a 3-letter alias for this field, if the field has aliases.
   *
   * @param s the candidate alias, any case
   * @return the numeric value, or -1 if {@code s} is not an alias of this field
   */
  public int alias(String s) {
    return switch (this) {
      case MONTHS -> MonthName.parse(s).map(MonthName::number).orElse(-1);
      case DAYS_OF_WEEK -> Weekday.parse(s).map(Weekday::cronDOW).orElse(-1);
      default -> -1;
    };
  }

  @Override
  public String toString() {
    return displayName;
  }
}
