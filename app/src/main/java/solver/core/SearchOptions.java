package solver.core;

/** Configuration for a target-expression search. */
public record SearchOptions(
    double tolerance,
    long timeBudgetMs,
    int maxResults,
    boolean distinct,
    boolean parallel,
    int parallelism) {

  public static final double DEFAULT_TOLERANCE = 1e-9;

  public static SearchOptions defaults() {
    return new SearchOptions(DEFAULT_TOLERANCE, 0, 0, false, false, availableProcessors());
  }

  public static SearchOptions normalize(SearchOptions options) {
    if (options == null) {
      return defaults();
    }
    long timeBudgetMs = Math.max(0L, options.timeBudgetMs());
    int maxResults = Math.max(0, options.maxResults());
    int parallelism = options.parallelism() > 0 ? options.parallelism() : availableProcessors();
    return new SearchOptions(
        options.tolerance(),
        timeBudgetMs,
        maxResults,
        options.distinct(),
        options.parallel(),
        parallelism);
  }

  public SearchOptions inParallel(int parallelism) {
    return new SearchOptions(tolerance, timeBudgetMs, maxResults, distinct, true, parallelism);
  }

  public SearchOptions withTolerance(double tolerance) {
    return new SearchOptions(tolerance, timeBudgetMs, maxResults, distinct, parallel, parallelism);
  }

  public SearchOptions withTimeBudgetMs(long timeBudgetMs) {
    return new SearchOptions(tolerance, timeBudgetMs, maxResults, distinct, parallel, parallelism);
  }

  public SearchOptions withMaxResults(int maxResults) {
    return new SearchOptions(tolerance, timeBudgetMs, maxResults, distinct, parallel, parallelism);
  }

  public SearchOptions withDistinct(boolean distinct) {
    return new SearchOptions(tolerance, timeBudgetMs, maxResults, distinct, parallel, parallelism);
  }

  public boolean hasTimeBudget() {
    return timeBudgetMs > 0;
  }

  public boolean hasResultLimit() {
    return maxResults > 0;
  }

  private static int availableProcessors() {
    return Runtime.getRuntime().availableProcessors();
  }
}
