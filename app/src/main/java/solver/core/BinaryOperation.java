package solver.core;

import java.util.OptionalDouble;
import java.util.function.DoubleBinaryOperator;

/**
 * Binary function backing an {@link Operator}.
 *
 * <p>An empty result signals a domain failure (for example a zero divisor); it is not an error.
 */
@FunctionalInterface
public interface BinaryOperation {
  OptionalDouble apply(double left, double right);

  /** Wraps a total function that is defined for every pair of operands. */
  static BinaryOperation total(DoubleBinaryOperator function) {
    return (left, right) -> OptionalDouble.of(function.applyAsDouble(left, right));
  }
}
