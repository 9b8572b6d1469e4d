package io.cronbits;

/** The defect found in a cron expression. */
public enum ErrorKind {
  /** The field has no content, e.g. two consecutive spaces or a missing trailing field. */
  FIELD_EMPTY("field_empty"),
  /** A group list ends with a comma. */
  TRAILING_COMMA("trailing_comma"),
  /** A {@code /} with no step after it. */
  TRAILING_SLASH("trailing_slash"),
  /** A {@code -} with no range end after it. */
  TRAILING_DASH("trailing_dash"),
  /** A number starting with {@code +} or {@code -}. */
  LEADING_SIGN("leading_sign"),
  /** A token that is neither digits nor a known alias. */
  INVALID_NUMBER("invalid_number"),
  /** A value outside the field's domain. */
  VALUE_OUT_OF_RANGE("value_out_of_range"),
  /** A range whose end is less than its start, or a step of zero. */
  INVALID_RANGE_OR_STEP("invalid_range_or_step"),
  /** Day-of-month and month constraints that no calendar date satisfies. */
  UNSATISFIABLE_DATE_COMBINATION("unsatisfiable_date_combination");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
