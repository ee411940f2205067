package solver.pipeline;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import solver.core.SearchOptions;
import solver.core.SearchResult;
import solver.util.Timing;

/**
 * Cooperative early-exit flag shared by all units of one search.
 *
 * <p>Units poll {@link #shouldStop()} before each attempt, so a reason is only recorded when an
 * attempt is actually skipped. The first reason recorded wins. With {@code distinct} on, only
 * expressions not seen before count towards the result limit.
 */
final class StopSignal {
  private final Timing timer;
  private final long timeBudgetMs;
  private final int maxResults;
  private final boolean distinct;
  private final AtomicInteger matches = new AtomicInteger();
  private final Set<String> seen = ConcurrentHashMap.newKeySet();
  private final AtomicReference<String> reason = new AtomicReference<>();

  StopSignal(Timing timer, SearchOptions options) {
    this.timer = timer;
    this.timeBudgetMs = options.timeBudgetMs();
    this.maxResults = options.maxResults();
    this.distinct = options.distinct();
  }

  boolean shouldStop() {
    if (reason.get() != null) {
      return true;
    }
    if (maxResults > 0 && matches.get() >= maxResults) {
      reason.compareAndSet(null, SearchResult.RESULT_LIMIT_REACHED);
      return true;
    }
    if (timer.exceeds(timeBudgetMs)) {
      reason.compareAndSet(null, SearchResult.TIME_BUDGET_EXCEEDED);
      return true;
    }
    return false;
  }

  void recordMatch(String expression) {
    if (maxResults <= 0) {
      return;
    }
    if (distinct && !seen.add(expression)) {
      return;
    }
    matches.incrementAndGet();
  }

  String reason() {
    return reason.get();
  }
}
