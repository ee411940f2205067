package solver.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.core.OperatorTable;
import solver.core.SearchOptions;
import solver.core.SearchResult;
import solver.core.SearchSpace;
import solver.core.model.Shape;
import solver.eval.PostfixEvaluator;
import solver.pipeline.generation.OperatorTupleEnumerator;
import solver.pipeline.generation.PermutationGenerator;
import solver.pipeline.generation.SequenceAssembler;
import solver.pipeline.generation.ShapeCache;
import solver.render.InfixRenderer;
import solver.util.Timing;

/**
 * Entry point of the search: finds every expression over the given numbers whose value lies
 * within tolerance of the target.
 *
 * <p>The search space is operator tuples (outer) × operand permutations × shapes (inner). The
 * same kernel serves both execution strategies; only the outer loop is delegated.
 */
public final class SearchDriver {
  private static final Logger LOG = LoggerFactory.getLogger(SearchDriver.class);

  private final OperatorTable operators;
  private final ShapeCache shapeCache;
  private final SequenceAssembler assembler = new SequenceAssembler();
  private final PermutationGenerator permutationGenerator = new PermutationGenerator();
  private final OperatorTupleEnumerator tupleEnumerator = new OperatorTupleEnumerator();
  private final PostfixEvaluator evaluator;
  private final InfixRenderer renderer;

  public SearchDriver(OperatorTable operators) {
    this(operators, new ShapeCache());
  }

  public SearchDriver(OperatorTable operators, ShapeCache shapeCache) {
    this.operators = Objects.requireNonNull(operators, "operators");
    this.shapeCache = Objects.requireNonNull(shapeCache, "shapeCache");
    this.evaluator = new PostfixEvaluator(operators);
    this.renderer = new InfixRenderer(operators);
  }

  public OperatorTable operators() {
    return operators;
  }

  public ShapeCache shapeCache() {
    return shapeCache;
  }

  public SearchResult search(double target, List<Double> numbers) {
    return search(target, numbers, SearchOptions.defaults());
  }

  public SearchResult search(double target, List<Double> numbers, double tolerance) {
    return search(target, numbers, SearchOptions.defaults().withTolerance(tolerance));
  }

  public SearchResult search(double target, List<Double> numbers, SearchOptions options) {
    SearchOptions effective = SearchOptions.normalize(options);
    ExecutionStrategy strategy =
        effective.parallel()
            ? ExecutionStrategy.parallel(effective.parallelism())
            : ExecutionStrategy.sequential();
    return search(target, numbers, effective, strategy);
  }

  public SearchResult search(
      double target, List<Double> numbers, SearchOptions options, ExecutionStrategy strategy) {
    Objects.requireNonNull(strategy, "strategy");
    SearchOptions effective = SearchOptions.normalize(options);
    Timing timer = Timing.start();
    SearchPlan plan = plan(target, numbers, effective, timer);
    long planned = plannedAttempts(numbers.size());

    LOG.info(
        "Searching for {} using {} over operators {}: {} planned attempt(s) ({})",
        target,
        numbers,
        operators.symbols(),
        planned,
        strategy.name());

    List<TupleOutcome> outcomes = strategy.execute(plan);

    long attempts = 0;
    long failures = 0;
    List<String> expressions = new ArrayList<>();
    for (TupleOutcome outcome : outcomes) {
      attempts += outcome.attempts();
      failures += outcome.domainFailures();
      expressions.addAll(outcome.expressions());
    }
    if (effective.distinct()) {
      expressions = new ArrayList<>(new LinkedHashSet<>(expressions));
    }
    if (effective.hasResultLimit() && expressions.size() > effective.maxResults()) {
      expressions = expressions.subList(0, effective.maxResults());
    }

    String terminationReason = plan.stopReason();
    SearchResult result =
        new SearchResult(
            target,
            numbers,
            attempts,
            planned,
            failures,
            expressions,
            timer.elapsedMillis(),
            terminationReason);

    LOG.info("Attempted {} expressions, found {}", result.attempts(), result.resultCount());
    LOG.info(
        "Search took {} ms ({} domain failure(s))",
        result.elapsedMillis(),
        result.domainFailures());
    LOG.debug(
        "Shape cache {} (hit rate {})",
        shapeCache.stats(),
        String.format(Locale.ROOT, "%.2f", shapeCache.stats().hitRate()));
    if (terminationReason != null) {
      LOG.warn(
          "Search terminated early: {} after {} of {} attempt(s)",
          terminationReason,
          attempts,
          planned);
    }
    return result;
  }

  /** Builds the shared, read-only work description for one query. */
  public SearchPlan plan(double target, List<Double> numbers, SearchOptions options) {
    return plan(target, numbers, SearchOptions.normalize(options), Timing.start());
  }

  /** Operator tuples × permutations × shapes for {@code operandCount} numbers. */
  public long plannedAttempts(int operandCount) {
    try {
      return SearchSpace.attempts(operators.size(), operandCount);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException(
          "Search space for " + operandCount + " operand(s) is too large", ex);
    }
  }

  private SearchPlan plan(
      double target, List<Double> numbers, SearchOptions options, Timing timer) {
    validate(target, numbers, options);
    int n = numbers.size();
    plannedAttempts(n);
    List<Shape> shapes = shapeCache.shapes(n);
    List<List<Double>> permutations = permutationGenerator.permutations(numbers);
    List<List<String>> tuples = tupleEnumerator.enumerate(operators.symbols(), n - 1);
    return new SearchPlan(
        target,
        options.tolerance(),
        operators,
        shapes,
        permutations,
        tuples,
        assembler,
        evaluator,
        renderer,
        new StopSignal(timer, options));
  }

  private static void validate(double target, List<Double> numbers, SearchOptions options) {
    Objects.requireNonNull(numbers, "numbers");
    if (numbers.isEmpty()) {
      throw new IllegalArgumentException("At least one number is required");
    }
    for (Double number : numbers) {
      if (number == null || !Double.isFinite(number)) {
        throw new IllegalArgumentException("Numbers must be finite: " + numbers);
      }
    }
    if (!Double.isFinite(target)) {
      throw new IllegalArgumentException("Target must be finite: " + target);
    }
    double tolerance = options.tolerance();
    if (!Double.isFinite(tolerance) || tolerance <= 0) {
      throw new IllegalArgumentException("Tolerance must be positive and finite: " + tolerance);
    }
  }
}
