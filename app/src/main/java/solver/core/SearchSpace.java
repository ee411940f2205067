package solver.core;

/** Size arithmetic for the search space. All results are exact; overflow throws. */
public final class SearchSpace {
  private SearchSpace() {}

  /** Catalan(k): number of binary tree shapes with k internal nodes. */
  public static long catalan(int k) {
    if (k < 0) {
      throw new IllegalArgumentException("Catalan index must be non-negative: " + k);
    }
    // C(i+1) = C(i) * 2(2i+1) / (i+2), exact at every step
    long c = 1;
    for (int i = 0; i < k; i++) {
      c = Math.multiplyExact(c, 2L * (2L * i + 1)) / (i + 2);
    }
    return c;
  }

  public static long factorial(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("Factorial of a negative number: " + n);
    }
    long f = 1;
    for (int i = 2; i <= n; i++) {
      f = Math.multiplyExact(f, i);
    }
    return f;
  }

  public static long power(int base, int exponent) {
    long p = 1;
    for (int i = 0; i < exponent; i++) {
      p = Math.multiplyExact(p, base);
    }
    return p;
  }

  /** Attempts for {@code operandCount} numbers: ops^(n-1) * n! * Catalan(n-1). */
  public static long attempts(int operatorCount, int operandCount) {
    if (operandCount < 1) {
      throw new IllegalArgumentException("At least one operand is required: " + operandCount);
    }
    return Math.multiplyExact(
        Math.multiplyExact(power(operatorCount, operandCount - 1), factorial(operandCount)),
        catalan(operandCount - 1));
  }
}
