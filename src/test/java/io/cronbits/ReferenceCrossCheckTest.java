package io.cronbits;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

/**
 * Compares the library with a slow, independent reference on a seeded random corpus of
 * expressions. The reference expands every field into a table of booleans and walks the calendar
 * day by day. Every expression is stepped forward for a year from START and backward for a year
 * to it, one occurrence at a time.
 */
public class ReferenceCrossCheckTest {
  private static final long SEED = 20111221L;
  private static final int EXPRESSIONS = 400;
  // Bounds the walk for schedules that fire every minute.
  private static final int MAX_STEPS = 40_000;
  private static final LocalDateTime START = LocalDateTime.of(2011, 12, 21, 13, 37);
  private static final int HORIZON_DAYS = 4 * 366;

  private static final int[] MIN = {0, 0, 1, 1, 0};
  private static final int[] MAX = {59, 23, 31, 12, 6};
  private static final List<String> MONTHS =
      List.of("jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");
  private static final List<String> DAYS = List.of("sun", "mon", "tue", "wed", "thu", "fri", "sat");

  private static final Pattern GROUP =
      Pattern.compile("([0-9]+|[A-Za-z]{3})(?:-([0-9]+|[A-Za-z]{3}))?(?:/([0-9]+))?");

  @Test
  void testRandomCorpusAgreesWithReference() {
    Random random = new Random(SEED);
    int accepted = 0;
    for (int i = 0; i < EXPRESSIONS; i++) {
      String expression = randomExpression(random);
      boolean[][] tables = referenceParse(expression);
      assertEquals(tables != null, Schedule.validate(expression), "validate(" + expression + ")");
      if (tables == null) {
        continue;
      }
      accepted++;
      Schedule schedule = Schedule.mustParse(expression);
      walkForward(expression, schedule, tables);
      walkBackward(expression, schedule, tables);
    }
    assertTrue(accepted > EXPRESSIONS / 10, "corpus should contain valid expressions");
  }

  /** Chains nextFrom from START until one year later, checking every step. */
  private static void walkForward(String expression, Schedule schedule, boolean[][] tables) {
    LocalDateTime end = START.plusYears(1);
    LocalDateTime from = START;
    for (int step = 0; step < MAX_STEPS; step++) {
      ZonedDateTime actual = schedule.nextFrom(from.atZone(ZoneOffset.UTC));
      LocalDateTime expected = referenceNext(tables, from);
      if (expected == null) {
        assertTrue(
            actual.toLocalDate().isAfter(from.toLocalDate().plusDays(HORIZON_DAYS - 1)),
            "nextFrom(" + from + ") for " + expression + " should lie beyond the horizon");
        return;
      }
      assertEquals(expected, actual.toLocalDateTime(), "nextFrom(" + from + ") for " + expression);
      if (!expected.isBefore(end)) {
        return;
      }
      from = expected;
    }
  }

  /** Chains previousFrom from one year after START back to START, checking every step. */
  private static void walkBackward(String expression, Schedule schedule, boolean[][] tables) {
    LocalDateTime from = START.plusYears(1);
    for (int step = 0; step < MAX_STEPS; step++) {
      ZonedDateTime actual = schedule.previousFrom(from.atZone(ZoneOffset.UTC));
      LocalDateTime expected = referencePrevious(tables, from);
      if (expected == null) {
        assertTrue(
            actual.toLocalDate().isBefore(from.toLocalDate().minusDays(HORIZON_DAYS - 1)),
            "previousFrom(" + from + ") for " + expression + " should lie beyond the horizon");
        return;
      }
      assertEquals(
          expected, actual.toLocalDateTime(), "previousFrom(" + from + ") for " + expression);
      if (!expected.isAfter(START)) {
        return;
      }
      from = expected;
    }
  }

  // Reference

  /** Returns one table per field, or null when the expression is rejected. */
  private static boolean[][] referenceParse(String expression) {
    String[] fields = expression.split(" ", 5);
    if (fields.length != 5) {
      return null;
    }
    boolean[][] tables = new boolean[5][];
    for (int f = 0; f < 5; f++) {
      tables[f] = referenceField(fields[f], f);
      if (tables[f] == null) {
        return null;
      }
    }
    for (int month = 1; month <= 12; month++) {
      int length = month == 2 ? 29 : LocalDate.of(2001, month, 1).lengthOfMonth();
      for (int day = 1; day <= length; day++) {
        if (tables[3][month] && tables[2][day]) {
          return tables;
        }
      }
    }
    return null;
  }

  private static boolean[] referenceField(String text, int f) {
    boolean[] table = new boolean[MAX[f] + 1];
    if (text.isEmpty()) {
      return null;
    }
    for (String group : text.split(",", -1)) {
      if (group.equals("*")) {
        for (int v = MIN[f]; v <= MAX[f]; v++) {
          table[v] = true;
        }
        continue;
      }
      Matcher m = GROUP.matcher(group);
      if (!m.matches()) {
        return null;
      }
      int from = referenceValue(m.group(1), f);
      int to = m.group(2) != null ? referenceValue(m.group(2), f) : from;
      if (from < 0 || to < 0 || to < from) {
        return null;
      }
      int step = 1;
      if (m.group(3) != null) {
        step = digits(m.group(3));
        if (step < 1 || step > MAX[f] - MIN[f] + 1) {
          return null;
        }
        if (m.group(2) == null) {
          to = MAX[f];
        }
      }
      for (int v = from; v <= to; v += step) {
        table[v] = true;
      }
    }
    return table;
  }

  private static int referenceValue(String token, int f) {
    String lower = token.toLowerCase(Locale.ROOT);
    if (f == 3 && MONTHS.contains(lower)) {
      return MONTHS.indexOf(lower) + 1;
    }
    if (f == 4 && DAYS.contains(lower)) {
      return DAYS.indexOf(lower);
    }
    int v = digits(token);
    return v < MIN[f] || v > MAX[f] ? -1 : v;
  }

  /** Parses plain decimal digits, with anything malformed or huge as -1. */
  private static int digits(String token) {
    if (!token.chars().allMatch(c -> c >= '0' && c <= '9')) {
      return -1;
    }
    String trimmed = token.replaceFirst("^0+(?=.)", "");
    return trimmed.length() > 6 ? -1 : Integer.parseInt(trimmed);
  }

  private static boolean dayMatches(boolean[][] tables, LocalDate date) {
    return tables[3][date.getMonthValue()]
        && tables[2][date.getDayOfMonth()]
        && tables[4][date.getDayOfWeek().getValue() % 7];
  }

  private static LocalDateTime referenceNext(boolean[][] tables, LocalDateTime from) {
    LocalDateTime after = from.withSecond(0).withNano(0);
    for (int d = 0; d < HORIZON_DAYS; d++) {
      LocalDate date = after.toLocalDate().plusDays(d);
      if (!dayMatches(tables, date)) {
        continue;
      }
      int firstMinute = d == 0 ? after.getHour() * 60 + after.getMinute() + 1 : 0;
      for (int h = firstMinute / 60; h < 24; h++) {
        for (int m = h == firstMinute / 60 ? firstMinute % 60 : 0; m < 60; m++) {
          LocalDateTime candidate = date.atTime(h, m);
          if (tables[1][h] && tables[0][m] && candidate.isAfter(after)) {
            return candidate;
          }
        }
      }
    }
    return null;
  }

  private static LocalDateTime referencePrevious(boolean[][] tables, LocalDateTime from) {
    LocalDateTime before = from.withSecond(0).withNano(0);
    for (int d = 0; d < HORIZON_DAYS; d++) {
      LocalDate date = before.toLocalDate().minusDays(d);
      if (!dayMatches(tables, date)) {
        continue;
      }
      int lastMinute = d == 0 ? before.getHour() * 60 + before.getMinute() - 1 : 24 * 60 - 1;
      for (int h = lastMinute / 60; h >= 0; h--) {
        for (int m = h == lastMinute / 60 ? lastMinute % 60 : 59; m >= 0; m--) {
          LocalDateTime candidate = date.atTime(h, m);
          if (tables[1][h] && tables[0][m] && candidate.isBefore(before)) {
            return candidate;
          }
        }
      }
    }
    return null;
  }

  // Corpus

  private static String randomExpression(Random random) {
    List<String> fields = new ArrayList<>();
    for (int f = 0; f < 5; f++) {
      fields.add(randomField(random, f));
    }
    String expression = String.join(" ", fields);
    switch (random.nextInt(40)) {
      case 0:
        return expression + " *";
      case 1:
        return expression.substring(0, expression.lastIndexOf(' '));
      case 2:
        return expression.replaceFirst(" ", "  ");
      default:
        return expression;
    }
  }

  private static String randomField(Random random, int f) {
    int groups = 1 + random.nextInt(3);
    List<String> parts = new ArrayList<>();
    for (int g = 0; g < groups; g++) {
      parts.add(randomGroup(random, f));
    }
    String field = String.join(",", parts);
    if (random.nextInt(50) == 0) {
      field += ",";
    }
    return field;
  }

  private static String randomGroup(Random random, int f) {
    switch (random.nextInt(12)) {
      case 0:
        return "*";
      case 1:
        return randomValue(random, f) + "-" + randomValue(random, f);
      case 2:
        return randomValue(random, f) + "/" + (random.nextInt(MAX[f] + 3));
      case 3:
        return randomValue(random, f)
            + "-"
            + randomValue(random, f)
            + "/"
            + (1 + random.nextInt(8));
      case 4:
        return random.nextBoolean() ? "*/" + (1 + random.nextInt(5)) : "-" + randomValue(random, f);
      default:
        return randomValue(random, f);
    }
  }

  private static String randomValue(Random random, int f) {
    int roll = random.nextInt(20);
    if (roll == 0 && f == 3) {
      String alias = MONTHS.get(random.nextInt(12));
      return random.nextBoolean() ? alias.toUpperCase(Locale.ROOT) : alias;
    }
    if (roll == 0 && f == 4) {
      return DAYS.get(random.nextInt(7));
    }
    if (roll == 1) {
      return String.valueOf(MAX[f] + 1 + random.nextInt(3));
    }
    return String.valueOf(MIN[f] + random.nextInt(MAX[f] - MIN[f] + 1));
  }
}
