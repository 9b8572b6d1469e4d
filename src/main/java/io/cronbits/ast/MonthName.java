package io.cronbits.ast;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Represents a month of the year and its 3-letter cron alias. */
public enum MonthName {
  JANUARY(1, "jan", 31),
  FEBRUARY(2, "feb", 29),
  MARCH(3, "mar", 31),
  APRIL(4, "apr", 30),
  MAY(5, "may", 31),
  JUNE(6, "jun", 30),
  JULY(7, "jul", 31),
  AUGUST(8, "aug", 31),
  SEPTEMBER(9, "sep", 30),
  OCTOBER(10, "oct", 31),
  NOVEMBER(11, "nov", 30),
  DECEMBER(12, "dec", 31);

  private final int monthNumber;
  private final String alias;
  private final int maxLength;

  MonthName(int monthNumber, String alias, int maxLength) {
    this.monthNumber = monthNumber;
    this.alias = alias;
    this.maxLength = maxLength;
  }

  /**
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return monthNumber;
  }

  /**
   * Returns the number of days of the month in a leap year.
   *
   * @return 29 for February, otherwise 30 or 31
   */
  public int maxLength() {
    return maxLength;
  }

  /**
   * Returns the bit of this month in a month mask.
   *
   * @return {@code 1 << number()}
   */
  public int bit() {
    return 1 << monthNumber;
  }

  @Override
  public String toString() {
    return alias;
  }

  private static final Map<String, MonthName> PARSE_MAP =
      Map.ofEntries(
          Map.entry("jan", JANUARY),
          Map.entry("feb", FEBRUARY),
          Map.entry("mar", MARCH),
          Map.entry("apr", APRIL),
          Map.entry("may", MAY),
          Map.entry("jun", JUNE),
          Map.entry("jul", JULY),
          Map.entry("aug", AUGUST),
          Map.entry("sep", SEPTEMBER),
          Map.entry("oct", OCTOBER),
          Map.entry("nov", NOVEMBER),
          Map.entry("dec", DECEMBER));

  /**
   * Parses a 3-letter month alias (case insensitive). Full month names are not aliases.
   *
   * @param s the string to parse
   * @return the month if valid
   */
  public static Optional<MonthName> parse(String s) {
    if (s.length() != 3) {
      return Optional.empty();
    }
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase(Locale.ROOT)));
  }
}
