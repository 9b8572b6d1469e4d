package io.cronbits;

/**
 * Represents a range of character positions in a cron expression.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span, at least 1 so that an empty token can still be pointed at.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns this span shifted right by {@code offset} characters.
   *
   * @param offset the number of characters to shift by
   * @return the shifted span
   */
  public Span shift(int offset) {
    return new Span(start + offset, end + offset);
  }
}
