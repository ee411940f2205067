package solver.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import solver.core.Operators;
import solver.core.SearchOptions;
import solver.core.SearchResult;
import solver.eval.Evaluation;
import solver.eval.PostfixEvaluator;
import solver.testing.InfixParser;

final class SearchDriverTest {
  private static final List<Double> GAME = List.of(2.0, 4.0, 8.0, 12.0);

  private final SearchDriver driver = new SearchDriver(Operators.standard());

  @Test
  void findsTwentyFour() {
    SearchResult result = driver.search(24, GAME);

    assertEquals(7680L, result.attempts(), "4^3 * 4! * Catalan(3)");
    assertEquals(7680L, result.plannedAttempts());
    assertTrue(result.found(), "24 is reachable from " + GAME);
    assertTrue(result.isComplete());
    assertTrue(result.domainFailures() > 0, "12 / (8 - 2 * 4) divides by zero");
    assertTrue(
        result.expressions().contains("(12 - 8) * (2 + 4)"),
        "Expected (12 - 8) * (2 + 4) among " + result.expressions());

    InfixParser parser = new InfixParser(Operators.standard());
    PostfixEvaluator evaluator = new PostfixEvaluator(Operators.standard());
    for (String expression : result.expressions()) {
      Evaluation evaluation = evaluator.evaluate(parser.toPostfix(expression));
      assertTrue(
          evaluation instanceof Evaluation.Value value && value.isWithin(24, 1e-6),
          expression + " should evaluate to 24");
    }
  }

  @Test
  void unreachableTargetGivesEmptyResult() {
    SearchResult result = driver.search(1000, List.of(1.0, 1.0));
    assertFalse(result.found());
    assertEquals(8L, result.attempts(), "4 tuples * 2 permutations * 1 shape");
    assertNull(result.terminationReason());
  }

  @Test
  void independentlyUnreachableTargetIsNotFound() {
    double target = 1e6;
    for (double value : reachableValues(GAME)) {
      assertTrue(Math.abs(value - target) >= 1e-9, "Pairwise reduction reaches " + value);
    }
    SearchResult result = driver.search(target, GAME);
    assertTrue(result.expressions().isEmpty());
    assertEquals(7680L, result.attempts());
  }

  @Test
  void singleNumberIsOneAttempt() {
    SearchResult hit = driver.search(5, List.of(5.0));
    assertEquals(List.of("5"), hit.expressions());
    assertEquals(1L, hit.attempts());

    SearchResult miss = driver.search(3, List.of(5.0));
    assertFalse(miss.found());
    assertEquals(1L, miss.attempts());
  }

  @Test
  void duplicatesAreKeptUnlessDistinctIsRequested() {
    assertEquals(List.of("1 + 1", "1 + 1"), driver.search(2, List.of(1.0, 1.0)).expressions());
    assertEquals(
        List.of("1 + 1"),
        driver
            .search(2, List.of(1.0, 1.0), SearchOptions.defaults().withDistinct(true))
            .expressions());
  }

  @Test
  void toleranceWidensMatches() {
    assertFalse(driver.search(0.33, List.of(1.0, 3.0)).found());
    SearchResult loose = driver.search(0.33, List.of(1.0, 3.0), 0.01);
    assertEquals(List.of("1 / 3"), loose.expressions());
  }

  @Test
  void resultLimitStopsTheSearch() {
    SearchResult result = driver.search(24, GAME, SearchOptions.defaults().withMaxResults(2));
    assertEquals(2, result.resultCount());
    assertEquals(SearchResult.RESULT_LIMIT_REACHED, result.terminationReason());
    assertTrue(result.attempts() < result.plannedAttempts(), "Search stopped early");
  }

  @Test
  void distinctResultLimitCountsOnlyNewExpressions() {
    SearchOptions options = SearchOptions.defaults().withDistinct(true).withMaxResults(2);
    SearchResult result = driver.search(4, List.of(2.0, 2.0), options);

    assertEquals(List.of("2 + 2", "2 * 2"), result.expressions());
    assertEquals(SearchResult.RESULT_LIMIT_REACHED, result.terminationReason());
    assertEquals(5L, result.attempts(), "Repeated 2 + 2 must not use up the limit");
  }

  @Test
  void limitReachedOnTheLastAttemptIsComplete() {
    SearchResult result =
        driver.search(5, List.of(5.0), SearchOptions.defaults().withMaxResults(1));
    assertEquals(List.of("5"), result.expressions());
    assertEquals(result.plannedAttempts(), result.attempts());
    assertNull(result.terminationReason(), "Nothing was skipped");
    assertTrue(result.isComplete());
  }

  @Test
  void timeBudgetStopsTheSearch() {
    List<Double> numbers = List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0);
    SearchResult result =
        driver.search(-1e9, numbers, SearchOptions.defaults().withTimeBudgetMs(1));
    assertEquals(SearchResult.TIME_BUDGET_EXCEEDED, result.terminationReason());
    assertTrue(result.attempts() < result.plannedAttempts(), "Search stopped early");
    assertFalse(result.isComplete());
  }

  @Test
  void contractViolationsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> driver.search(1, List.of()));
    assertThrows(IllegalArgumentException.class, () -> driver.search(Double.NaN, GAME));
    assertThrows(IllegalArgumentException.class, () -> driver.search(1, GAME, 0.0));
    assertThrows(IllegalArgumentException.class, () -> driver.search(1, GAME, -1e-3));
    assertThrows(
        IllegalArgumentException.class,
        () -> driver.search(1, List.of(1.0, Double.POSITIVE_INFINITY)));
    assertThrows(
        IllegalArgumentException.class, () -> driver.search(1, Arrays.asList(1.0, null)));
    assertThrows(NullPointerException.class, () -> driver.search(1, null));
  }

  @Test
  void oversizedSearchSpaceIsRejected() {
    Double[] many = new Double[16];
    Arrays.fill(many, 1.0);
    assertThrows(IllegalArgumentException.class, () -> driver.search(1, List.of(many)));
  }

  @Test
  void tupleLengthMustMatchTheShapes() {
    SearchPlan plan = driver.plan(24, GAME, SearchOptions.defaults());
    assertEquals(64, plan.operatorTuples().size());
    assertEquals(5, plan.shapes().size());
    assertEquals(24, plan.permutations().size());
    assertThrows(
        IllegalArgumentException.class, () -> plan.processOneOperatorTuple(List.of("+")));
    assertThrows(
        IllegalArgumentException.class,
        () -> plan.processOneOperatorTuple(List.of("+", "+", "^")));
  }

  @Test
  void oneTupleIsOneUnitOfWork() {
    SearchPlan plan = driver.plan(24, GAME, SearchOptions.defaults());
    TupleOutcome outcome = plan.processOneOperatorTuple(List.of("-", "+", "*"));
    assertEquals(24L * 5, outcome.attempts());
    assertTrue(outcome.expressions().contains("(12 - 8) * (2 + 4)"));
    assertFalse(outcome.stopped());
  }

  /** Values reachable by repeatedly combining two remaining numbers; x / 0 is skipped. */
  private static Set<Double> reachableValues(List<Double> numbers) {
    Set<Double> values = new HashSet<>();
    if (numbers.size() == 1) {
      values.add(numbers.get(0));
      return values;
    }
    for (int i = 0; i < numbers.size(); i++) {
      for (int j = 0; j < numbers.size(); j++) {
        if (i == j) {
          continue;
        }
        double a = numbers.get(i);
        double b = numbers.get(j);
        List<Double> rest = new ArrayList<>();
        for (int k = 0; k < numbers.size(); k++) {
          if (k != i && k != j) {
            rest.add(numbers.get(k));
          }
        }
        List<Double> combined = new ArrayList<>(List.of(a + b, a - b, a * b));
        if (b != 0) {
          combined.add(a / b);
        }
        for (double c : combined) {
          List<Double> next = new ArrayList<>(rest);
          next.add(c);
          values.addAll(reachableValues(next));
        }
      }
    }
    return values;
  }

  @Test
  void shapesAreCachedAcrossQueries() {
    driver.search(24, GAME);
    driver.search(10, List.of(1.0, 2.0, 3.0, 4.0));
    assertEquals(1, driver.shapeCache().stats().misses());
    assertEquals(1, driver.shapeCache().stats().hits());
  }
}
