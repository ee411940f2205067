package solver.render;

import java.math.BigDecimal;

/** Decimal text for operands: {@code 2} rather than {@code 2.0}, never scientific notation. */
public final class NumberFormatter {
  private static final double EXACT_LONG_LIMIT = 1e15;

  private NumberFormatter() {}

  public static String format(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.toString(value);
    }
    if (value == Math.rint(value) && Math.abs(value) < EXACT_LONG_LIMIT) {
      return Long.toString((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
