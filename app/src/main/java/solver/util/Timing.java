package solver.util;

/** Monotonic stopwatch started on creation. */
public final class Timing {
  private final long startedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedMillis() {
    return elapsedNanos() / 1_000_000L;
  }

  public long elapsedNanos() {
    return System.nanoTime() - startedAt;
  }

  /** True once more than {@code budgetMs} has passed; a budget of zero or less never expires. */
  public boolean exceeds(long budgetMs) {
    return budgetMs > 0 && elapsedNanos() > budgetMs * 1_000_000L;
  }
}
