package solver.core;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A binary operator entry of an {@link OperatorTable}.
 *
 * @param symbol unique key, also the text used when rendering
 * @param function value-or-failure implementation
 * @param precedence binding strength, higher binds tighter
 * @param associative true when an equal-precedence right operand never needs parentheses
 */
public record Operator(
    String symbol, BinaryOperation function, int precedence, boolean associative) {

  public Operator {
    Objects.requireNonNull(symbol, "symbol");
    Objects.requireNonNull(function, "function");
    if (symbol.isBlank()) {
      throw new IllegalArgumentException("Operator symbol must not be blank");
    }
    for (int i = 0; i < symbol.length(); i++) {
      char c = symbol.charAt(i);
      if (Character.isWhitespace(c) || c == '(' || c == ')') {
        throw new IllegalArgumentException(
            "Operator symbol must not contain whitespace or parentheses: '" + symbol + "'");
      }
    }
  }

  public OptionalDouble apply(double left, double right) {
    return function.apply(left, right);
  }

  @Override
  public String toString() {
    return symbol + " (precedence=" + precedence + (associative ? ", associative)" : ")");
  }
}
