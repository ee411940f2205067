package solver.core;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated outcome of one search.
 *
 * <p>{@code expressions} keeps the iteration order of the search: operator tuple, then operand
 * permutation, then shape. {@code terminationReason} is {@code null} when the whole space was
 * explored.
 */
public record SearchResult(
    double target,
    List<Double> numbers,
    long attempts,
    long plannedAttempts,
    long domainFailures,
    List<String> expressions,
    long elapsedMillis,
    String terminationReason) {

  public static final String TIME_BUDGET_EXCEEDED = "time_budget_exceeded";
  public static final String RESULT_LIMIT_REACHED = "result_limit_reached";

  public SearchResult {
    numbers = List.copyOf(Objects.requireNonNull(numbers, "numbers"));
    expressions = List.copyOf(Objects.requireNonNull(expressions, "expressions"));
    if (attempts < 0 || plannedAttempts < 0 || domainFailures < 0) {
      throw new IllegalArgumentException("Counters must be non-negative");
    }
  }

  public int resultCount() {
    return expressions.size();
  }

  public boolean found() {
    return !expressions.isEmpty();
  }

  public boolean isComplete() {
    return terminationReason == null;
  }
}
