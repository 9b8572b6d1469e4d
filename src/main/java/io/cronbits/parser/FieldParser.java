package io.cronbits.parser;

import io.cronbits.CronException;
import io.cronbits.ErrorKind;
import io.cronbits.Span;
import io.cronbits.ast.CronField;
import io.cronbits.eval.Bits;

/**
 * Parses one field of a cron expression into a bitmask.
 *
 * <p>Grammar:
 *
 * <pre>
 * groups     ::= group ( ',' group )*
 * group      ::= '*' | rangeOrNum ( '/' step )?
 * rangeOrNum ::= number ( '-' number )?
 * step       ::= digit+
 * number     ::= digit+ | alias
 * </pre>
 *
 * <p>Aliases are the 3-letter month names for {@link CronField#MONTHS} and the 3-letter weekday
 * names for {@link CronField#DAYS_OF_WEEK}, in any case.
 */
public final class FieldParser {
  private final String input;
  private final CronField field;
  private final int offset;

  private FieldParser(String input, CronField field, int offset) {
    this.input = input;
    this.field = field;
    this.offset = offset;
  }

  /**
   * Parses the text of one field.
   *
   * @param input the whole expression, used for error reporting
   * @param field the field being parsed
   * @param text the field's text
   * @param offset the position of {@code text} in {@code input}
   * @return the field's mask, never zero
   * @throws CronException if the field is malformed
   */
  public static long parse(String input, CronField field, String text, int offset)
      throws CronException {
    return new FieldParser(input, field, offset).parseGroups(text);
  }

  private long parseGroups(String text) throws CronException {
    if (text.isEmpty()) {
      throw error(ErrorKind.FIELD_EMPTY, "field is empty", 0, 0);
    }
    long mask = 0;
    int pos = 0;
    while (true) {
      int comma = text.indexOf(',', pos);
      if (comma == text.length() - 1) {
        throw error(ErrorKind.TRAILING_COMMA, "trailing comma found", comma, comma + 1);
      }
      int end = comma < 0 ? text.length() : comma;
      mask |= parseGroup(text.substring(pos, end), pos);
      if (comma < 0) {
        return mask;
      }
      pos = comma + 1;
    }
  }

  private long parseGroup(String group, int start) throws CronException {
    if (group.equals("*")) {
      return field.fullMask();
    }

    int slash = group.indexOf('/');
    String rangeOrNum = slash < 0 ? group : group.substring(0, slash);
    int dash = rangeOrNum.indexOf('-');

    if (slash >= 0 && slash == group.length() - 1) {
      int at = start + slash;
      throw error(ErrorKind.TRAILING_SLASH, "trailing slash found", at, at + 1);
    }
    if (dash >= 0 && dash == rangeOrNum.length() - 1) {
      int at = start + dash;
      throw error(ErrorKind.TRAILING_DASH, "trailing dash found", at, at + 1);
    }
    if (dash == 0) {
      throw error(ErrorKind.LEADING_SIGN, "leading sign found", start, start + 1);
    }

    String fromText = dash < 0 ? rangeOrNum : rangeOrNum.substring(0, dash);
    int from = parseValue(fromText, start);

    int to;
    if (dash >= 0) {
      to = parseValue(rangeOrNum.substring(dash + 1), start + dash + 1);
      if (to < from) {
        throw error(
            ErrorKind.INVALID_RANGE_OR_STEP,
            String.format("range end %d is less than range start %d", to, from),
            start,
            start + rangeOrNum.length());
      }
    } else if (slash >= 0) {
      to = field.max();
    } else {
      to = from;
    }

    int step = 1;
    if (slash >= 0) {
      step = parseStep(group.substring(slash + 1), start + slash + 1);
    }

    if (step == 1) {
      return Bits.range(from, to);
    }
    long mask = 0;
    for (int i = from; i <= to; i += step) {
      mask |= 1L << i;
    }
    return mask;
  }

  private int parseValue(String text, int start) throws CronException {
    int alias = field.alias(text);
    if (alias >= 0) {
      return alias;
    }
    return checkRange(parseNumber(text, start), start, text, field.min(), field.max());
  }

  private int parseStep(String text, int start) throws CronException {
    int step = parseNumber(text, start);
    if (step == 0) {
      throw error(
          ErrorKind.INVALID_RANGE_OR_STEP, "step must be positive", start, start + text.length());
    }
    return checkRange(step, start, text, 1, field.max() - field.min() + 1);
  }

  /** Parses unsigned decimal digits. Values too large for an int come back as -1. */
  private int parseNumber(String text, int start) throws CronException {
    if (!text.isEmpty() && (text.charAt(0) == '+' || text.charAt(0) == '-')) {
      throw error(ErrorKind.LEADING_SIGN, "leading sign found", start, start + 1);
    }
    if (text.isEmpty() || !isDigits(text)) {
      throw error(
          ErrorKind.INVALID_NUMBER, "invalid value \"" + text + "\"", start, start + text.length());
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private int checkRange(int n, int start, String text, int min, int max) throws CronException {
    if (n < min || n > max) {
      throw error(
          ErrorKind.VALUE_OUT_OF_RANGE,
          String.format("value out of range [%d, %d] found", min, max),
          start,
          start + text.length());
    }
    return n;
  }

  private static boolean isDigits(String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  private CronException error(ErrorKind kind, String detail, int start, int end) {
    return CronException.of(kind, field, detail, new Span(start, end).shift(offset), input);
  }
}
