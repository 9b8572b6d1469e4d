package io.cronbits;

import io.cronbits.ast.CronField;
import java.util.Objects;
import java.util.Optional;

/** Exception thrown when a cron expression is rejected. */
public final class CronException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The field the error was found in. */
  private final CronField field;

  /** The source span where the error occurred. */
  private final Span span;

  /** The full input string. */
  private final String input;

  private CronException(
      ErrorKind kind, CronField field, String detail, Span span, String input) {
    super(String.format("field \"%s\": %s", field, detail));
    this.kind = Objects.requireNonNull(kind, "kind");
    this.field = Objects.requireNonNull(field, "field");
    this.span = span;
    this.input = input;
  }

  /**
   * Creates a new error located in the input.
   *
   * @param kind the error kind
   * @param field the field the error was found in
   * @param detail a short description, e.g. {@code "trailing comma found"}
   * @param span the location of the offending token in the input
   * @param input the full input string
   * @return a new CronException
   */
  public static CronException of(
      ErrorKind kind, CronField field, String detail, Span span, String input) {
    return new CronException(kind, field, detail, span, input);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the field the error was found in.
   *
   * @return the field
   */
  public CronField field() {
    return field;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the full input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message with the input underlined at the error location.
   *
   * <p>Produces output like:
   *
   * <pre>
   * error: field "minutes": trailing comma found
   *   0,15, * * * *
   *       ^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (span == null || input == null) {
      return "error: " + getMessage();
    }
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage()).append("\n");
    sb.append("  ").append(input).append("\n");
    sb.append(" ".repeat(span.start() + 2));
    sb.append("^".repeat(span.length()));
    return sb.toString();
  }
}
