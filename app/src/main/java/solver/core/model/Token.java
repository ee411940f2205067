package solver.core.model;

import java.util.Objects;

/** A postfix token: either a concrete operand or an operator symbol. */
public sealed interface Token {

  Slot slot();

  static Token number(double value) {
    return new NumberToken(value);
  }

  static Token operator(String symbol) {
    return new OperatorToken(symbol);
  }

  record NumberToken(double value) implements Token {
    @Override
    public Slot slot() {
      return Slot.NUMBER;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  record OperatorToken(String symbol) implements Token {
    public OperatorToken {
      Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public Slot slot() {
      return Slot.OPERATOR;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }
}
