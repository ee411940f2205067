package solver.pipeline;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;

/**
 * Shards the search over operator tuples on a {@link ForkJoinPool}.
 *
 * <p>The common pool is used when the requested parallelism matches it; otherwise a dedicated
 * pool is created for the call and shut down afterwards. Outcomes keep tuple order, so merged
 * results match a sequential run.
 */
public final class ParallelExecution implements ExecutionStrategy {
  private final int parallelism;

  public ParallelExecution(int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
    }
    this.parallelism = parallelism;
  }

  @Override
  public List<TupleOutcome> execute(SearchPlan plan) {
    ForkJoinPool pool =
        parallelism == ForkJoinPool.getCommonPoolParallelism()
            ? ForkJoinPool.commonPool()
            : new ForkJoinPool(parallelism);
    try {
      return pool.submit(
              () ->
                  plan.operatorTuples().parallelStream()
                      .map(plan::processOneOperatorTuple)
                      .toList())
          .get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Parallel search was interrupted", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Parallel search failed", cause);
    } finally {
      if (pool != ForkJoinPool.commonPool()) {
        pool.shutdown();
      }
    }
  }

  @Override
  public String name() {
    return "parallel(" + parallelism + ")";
  }
}
