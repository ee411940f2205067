package solver.eval;

import java.util.Objects;

/** Outcome of evaluating a postfix sequence: a value, or the operator application that failed. */
public sealed interface Evaluation {

  boolean isValue();

  static Evaluation value(double value) {
    return new Value(value);
  }

  static Evaluation domainFailure(String symbol, double left, double right) {
    return new DomainFailure(symbol, left, right);
  }

  record Value(double value) implements Evaluation {
    @Override
    public boolean isValue() {
      return true;
    }

    /** True when {@code |value - target| < tolerance}. */
    public boolean isWithin(double target, double tolerance) {
      return Math.abs(value - target) < tolerance;
    }
  }

  /** The operator {@code symbol} has no value for {@code left symbol right}. */
  record DomainFailure(String symbol, double left, double right) implements Evaluation {
    public DomainFailure {
      Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public boolean isValue() {
      return false;
    }

    @Override
    public String toString() {
      return "DomainFailure[" + left + " " + symbol + " " + right + "]";
    }
  }
}
