package solver.cli;

import java.util.List;
import java.util.Objects;
import solver.core.SearchOptions;

record CliOptions(
    Double target,
    List<Double> numbers,
    List<String> operators,
    double tolerance,
    long timeBudgetMs,
    int maxResults,
    boolean distinct,
    boolean parallel,
    int parallelism,
    boolean json) {

  static final List<String> DEFAULT_OPERATORS = List.of("+", "-", "*", "/");

  CliOptions {
    Objects.requireNonNull(target, "target");
    numbers = List.copyOf(Objects.requireNonNull(numbers, "numbers"));
    operators =
        operators == null || operators.isEmpty() ? DEFAULT_OPERATORS : List.copyOf(operators);
    if (maxResults < 0) {
      throw new IllegalArgumentException("--max-results must be non-negative");
    }
    if (timeBudgetMs < 0) {
      throw new IllegalArgumentException("--time-budget-ms must be non-negative");
    }
  }

  SearchOptions searchOptions() {
    return new SearchOptions(tolerance, timeBudgetMs, maxResults, distinct, parallel, parallelism);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Double target;
    private List<Double> numbers = List.of();
    private List<String> operators = DEFAULT_OPERATORS;
    private double tolerance = SearchOptions.DEFAULT_TOLERANCE;
    private long timeBudgetMs;
    private int maxResults;
    private boolean distinct;
    private boolean parallel;
    private int parallelism;
    private boolean json;

    Builder target(double target) {
      this.target = target;
      return this;
    }

    Builder numbers(List<Double> numbers) {
      this.numbers = numbers;
      return this;
    }

    Builder operators(List<String> operators) {
      this.operators = operators;
      return this;
    }

    Builder tolerance(double tolerance) {
      this.tolerance = tolerance;
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      this.timeBudgetMs = timeBudgetMs;
      return this;
    }

    Builder maxResults(int maxResults) {
      this.maxResults = maxResults;
      return this;
    }

    Builder distinct(boolean distinct) {
      this.distinct = distinct;
      return this;
    }

    Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    CliOptions build() {
      if (target == null) {
        throw new IllegalArgumentException("Missing required option --target");
      }
      if (numbers == null || numbers.isEmpty()) {
        throw new IllegalArgumentException("Missing required option --numbers");
      }
      boolean effectiveParallel = parallel || parallelism > 0;
      return new CliOptions(
          target,
          numbers,
          operators,
          tolerance,
          timeBudgetMs,
          maxResults,
          distinct,
          effectiveParallel,
          parallelism,
          json);
    }
  }
}
