package solver.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Result of processing one operator tuple against every permutation and shape.
 *
 * @param stopped true when the unit stopped early because the search was asked to stop
 */
public record TupleOutcome(
    List<String> operatorTuple,
    List<String> expressions,
    long attempts,
    long domainFailures,
    boolean stopped) {

  public TupleOutcome {
    operatorTuple = List.copyOf(Objects.requireNonNull(operatorTuple, "operatorTuple"));
    expressions = List.copyOf(Objects.requireNonNull(expressions, "expressions"));
  }
}
