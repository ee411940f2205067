package solver.pipeline;

import java.util.List;

/**
 * Runs every operator tuple of a {@link SearchPlan}.
 *
 * <p>Implementations must return one outcome per tuple, in the plan's tuple order.
 */
public interface ExecutionStrategy {
  List<TupleOutcome> execute(SearchPlan plan);

  /** Short label used in logs. */
  String name();

  static ExecutionStrategy sequential() {
    return new SequentialExecution();
  }

  static ExecutionStrategy parallel(int parallelism) {
    return new ParallelExecution(parallelism);
  }
}
