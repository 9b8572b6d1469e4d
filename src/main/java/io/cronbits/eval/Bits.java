package io.cronbits.eval;

/**
 * Bit-scan primitives over a 64-bit field mask.
 *
 * <p>Both scans return an out-of-domain sentinel ({@code limit + 1} or {@code limit - 1}) when no
 * bit remains on their side of the limit. Callers feed the sentinel straight into date
 * normalization, which carries it into the next coarser calendar unit.
 */
public final class Bits {
  private Bits() {}

  /**
   * Returns the position of the lowest bit set in {@code field} strictly after {@code i}.
   *
   * @param i the current position, 0-63
   * @param limit the highest position in the domain
   * @param field the mask
   * @return the next set position, or {@code limit + 1} if none is at or below {@code limit}
   */
  public static int next(int i, int limit, long field) {
    long mask = i >= 63 ? 0 : -1L << (i + 1);
    int n = Long.numberOfTrailingZeros(field & mask);
    return n > limit ? limit + 1 : n;
  }

  /**
   * Returns the position of the highest bit set in {@code field} strictly before {@code i}.
   *
   * @param i the current position, 0-63
   * @param limit the lowest position in the domain
   * @param field the mask
   * @return the previous set position, or {@code limit - 1} if none is at or above {@code limit}
   */
  public static int prev(int i, int limit, long field) {
    long mask = (1L << i) - 1;
    int p = 63 - Long.numberOfLeadingZeros(field & mask);
    return p < limit ? limit - 1 : p;
  }

  /**
   * Returns the mask with bits {@code from} through {@code to} set.
   *
   * @param from the lowest bit, 0-63
   * @param to the highest bit, {@code from}-63
   * @return the range mask
   */
  public static long range(int from, int to) {
    return (-1L >>> (63 - to)) & (-1L << from);
  }
}
