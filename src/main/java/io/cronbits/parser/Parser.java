package io.cronbits.parser;

import io.cronbits.CronException;
import io.cronbits.ErrorKind;
import io.cronbits.Span;
import io.cronbits.ast.CronField;
import io.cronbits.ast.FieldMasks;
import io.cronbits.ast.MonthName;
import io.cronbits.eval.Bits;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parser for 5-field cron expressions: {@code minute hour day-of-month month day-of-week}.
 *
 * <p>Fields are separated by single spaces. Everything after the fourth space is the day-of-week
 * field, so surplus fields are reported there. Fields are parsed left to right and the first
 * failure is thrown.
 */
public final class Parser {
  /** Months with 31 days: any day of month is reachable if one of them is selected. */
  private static final int MONTHS_WITH_31_DAYS = monthsOfLength(31);

  private Parser() {}

  /**
   * Parses a cron expression into its field masks.
   *
   * @param input the expression
   * @return the validated masks
   * @throws CronException if a field is malformed or the date fields can never match together
   */
  public static FieldMasks parse(String input) throws CronException {
    Objects.requireNonNull(input, "input");

    CronField[] fields = CronField.values();
    long[] masks = new long[fields.length];
    int[] starts = new int[fields.length];
    int[] ends = new int[fields.length];

    int pos = 0;
    for (int i = 0; i < fields.length; i++) {
      int start = Math.min(pos, input.length());
      int end = input.length();
      if (i < fields.length - 1) {
        int space = input.indexOf(' ', start);
        if (space >= 0) {
          end = space;
        }
      }
      starts[i] = start;
      ends[i] = end;
      masks[i] = FieldParser.parse(input, fields[i], input.substring(start, end), start);
      pos = end + 1;
    }

    FieldMasks result =
        new FieldMasks(masks[0], (int) masks[1], (int) masks[2], (int) masks[3], (int) masks[4]);
    int dom = CronField.DAYS_OF_MONTH.ordinal();
    checkDateCombination(result, new Span(starts[dom], ends[dom]), input);
    return result;
  }

  /**
   * Rejects expressions whose day-of-month field matches no day of any selected month, such as
   * {@code * * 30 2 *}. February 29 counts as reachable.
   */
  private static void checkDateCombination(FieldMasks masks, Span domSpan, String input)
      throws CronException {
    if ((masks.months() & MONTHS_WITH_31_DAYS) != 0) {
      return;
    }
    boolean onlyFebruary = masks.months() == MonthName.FEBRUARY.bit();
    int maxDay = onlyFebruary ? MonthName.FEBRUARY.maxLength() : 30;
    if ((masks.daysOfMonth() & Bits.range(1, maxDay)) != 0) {
      return;
    }
    throw CronException.of(
        ErrorKind.UNSATISFIABLE_DATE_COMBINATION,
        CronField.DAYS_OF_MONTH,
        "doesn't match any day of " + describeMonths(masks.months()),
        domSpan,
        input);
  }

  private static String describeMonths(int months) {
    List<String> numbers = new ArrayList<>();
    for (MonthName m : MonthName.values()) {
      if ((months & m.bit()) != 0) {
        numbers.add(String.valueOf(m.number()));
      }
    }
    if (numbers.size() == 1) {
      return "month " + numbers.get(0);
    }
    int last = numbers.size() - 1;
    return "months " + String.join(", ", numbers.subList(0, last)) + " or " + numbers.get(last);
  }

  private static int monthsOfLength(int length) {
    int mask = 0;
    for (MonthName m : MonthName.values()) {
      if (m.maxLength() == length) {
        mask |= m.bit();
      }
    }
    return mask;
  }
}
