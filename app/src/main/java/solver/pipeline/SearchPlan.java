package solver.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.core.OperatorTable;
import solver.core.model.PostfixSequence;
import solver.core.model.Shape;
import solver.eval.Evaluation;
import solver.eval.PostfixEvaluator;
import solver.pipeline.generation.SequenceAssembler;
import solver.render.InfixRenderer;

/**
 * Immutable work description of one search: shapes, permutations and operator tuples computed up
 * front and shared read-only by every unit of work.
 *
 * <p>{@link #processOneOperatorTuple(List)} is the unit of parallel work. It touches no mutable
 * state besides the shared {@link StopSignal}, so units may run on any thread in any order.
 */
public final class SearchPlan {
  private static final Logger LOG = LoggerFactory.getLogger(SearchPlan.class);

  private final double target;
  private final double tolerance;
  private final OperatorTable operators;
  private final List<Shape> shapes;
  private final List<List<Double>> permutations;
  private final List<List<String>> operatorTuples;
  private final SequenceAssembler assembler;
  private final PostfixEvaluator evaluator;
  private final InfixRenderer renderer;
  private final StopSignal stopSignal;

  SearchPlan(
      double target,
      double tolerance,
      OperatorTable operators,
      List<Shape> shapes,
      List<List<Double>> permutations,
      List<List<String>> operatorTuples,
      SequenceAssembler assembler,
      PostfixEvaluator evaluator,
      InfixRenderer renderer,
      StopSignal stopSignal) {
    this.target = target;
    this.tolerance = tolerance;
    this.operators = Objects.requireNonNull(operators, "operators");
    this.shapes = List.copyOf(shapes);
    this.permutations = List.copyOf(permutations);
    this.operatorTuples = List.copyOf(operatorTuples);
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.stopSignal = Objects.requireNonNull(stopSignal, "stopSignal");
  }

  public List<List<String>> operatorTuples() {
    return operatorTuples;
  }

  public List<Shape> shapes() {
    return shapes;
  }

  public List<List<Double>> permutations() {
    return permutations;
  }

  /** Attempts one operator tuple against every permutation and shape. */
  public TupleOutcome processOneOperatorTuple(List<String> operatorTuple) {
    Objects.requireNonNull(operatorTuple, "operatorTuple");
    int expectedLength = shapes.get(0).operatorCount();
    if (operatorTuple.size() != expectedLength) {
      throw new IllegalArgumentException(
          "Operator tuple " + operatorTuple + " must have length " + expectedLength);
    }
    for (String symbol : operatorTuple) {
      if (!operators.contains(symbol)) {
        throw new IllegalArgumentException(
            "Operator tuple " + operatorTuple + " uses unknown symbol '" + symbol + "'");
      }
    }

    List<String> found = new ArrayList<>();
    long attempts = 0;
    long failures = 0;
    boolean stopped = false;
    outer:
    for (List<Double> permutation : permutations) {
      for (Shape shape : shapes) {
        if (stopSignal.shouldStop()) {
          stopped = true;
          break outer;
        }
        attempts++;
        PostfixSequence sequence = assembler.assemble(shape, permutation, operatorTuple);
        Evaluation evaluation = evaluator.evaluate(sequence);
        if (evaluation instanceof Evaluation.Value value) {
          if (value.isWithin(target, tolerance)) {
            String expression = render(sequence);
            found.add(expression);
            stopSignal.recordMatch(expression);
          }
        } else {
          failures++;
        }
      }
    }
    LOG.debug(
        "Tuple {}: {} attempt(s), {} match(es), {} domain failure(s)",
        operatorTuple,
        attempts,
        found.size(),
        failures);
    return new TupleOutcome(operatorTuple, found, attempts, failures, stopped);
  }

  String stopReason() {
    return stopSignal.reason();
  }

  private String render(PostfixSequence sequence) {
    return renderer
        .render(sequence)
        .orElseThrow(() -> new IllegalStateException("No rendering for " + sequence));
  }
}
