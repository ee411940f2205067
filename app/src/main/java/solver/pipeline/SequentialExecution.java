package solver.pipeline;

import java.util.ArrayList;
import java.util.List;

/** Processes operator tuples one after another on the calling thread. */
public final class SequentialExecution implements ExecutionStrategy {

  @Override
  public List<TupleOutcome> execute(SearchPlan plan) {
    List<TupleOutcome> outcomes = new ArrayList<>(plan.operatorTuples().size());
    for (List<String> tuple : plan.operatorTuples()) {
      TupleOutcome outcome = plan.processOneOperatorTuple(tuple);
      outcomes.add(outcome);
      if (outcome.stopped()) {
        break;
      }
    }
    return outcomes;
  }

  @Override
  public String name() {
    return "sequential";
  }
}
