package io.cronbits.ast;

/**
 * The parsed bitmasks of a cron expression. Bit {@code k} set means value {@code k} is permitted.
 *
 * @param minutes minutes 0-59
 * @param hours hours 0-23
 * @param daysOfMonth days of month 1-31
 * @param months months 1-12
 * @param daysOfWeek days of week 0-6, Sunday is 0
 */
public record FieldMasks(long minutes, int hours, int daysOfMonth, int months, int daysOfWeek) {
  /** Rejects masks that are empty or have bits outside their field's domain. */
  public FieldMasks {
    check(CronField.MINUTES, minutes);
    check(CronField.HOURS, Integer.toUnsignedLong(hours));
    check(CronField.DAYS_OF_MONTH, Integer.toUnsignedLong(daysOfMonth));
    check(CronField.MONTHS, Integer.toUnsignedLong(months));
    check(CronField.DAYS_OF_WEEK, Integer.toUnsignedLong(daysOfWeek));
  }

  private static void check(CronField field, long mask) {
    if (mask == 0 || (mask & ~field.fullMask()) != 0) {
      throw new IllegalArgumentException(
          "invalid mask for field \"" + field + "\": 0x" + Long.toHexString(mask));
    }
  }

  /**
   * Returns the mask of a field, zero-extended to a long. Bit 31 of {@link #daysOfMonth()} makes
   * that int negative, so widen through this method rather than by assignment.
   *
   * @param field the field
   * @return the field's mask
   */
  public long get(CronField field) {
    return switch (field) {
      case MINUTES -> minutes;
      case HOURS -> Integer.toUnsignedLong(hours);
      case DAYS_OF_MONTH -> Integer.toUnsignedLong(daysOfMonth);
      case MONTHS -> Integer.toUnsignedLong(months);
      case DAYS_OF_WEEK -> Integer.toUnsignedLong(daysOfWeek);
    };
  }

  /**
   * Checks whether a field permits a value.
   *
   * @param field the field
   * @param value the value, any int
   * @return true if the value is inside the domain and its bit is set
   */
  public boolean permits(CronField field, int value) {
    return value >= 0 && value < 64 && (get(field) & (1L << value)) != 0;
  }
}
