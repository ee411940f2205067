package solver.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/** Catalogue of the supported arithmetic operators. */
public final class Operators {
  public static final Operator ADD = new Operator("+", BinaryOperation.total(Double::sum), 1, true);
  public static final Operator SUBTRACT =
      new Operator("-", BinaryOperation.total((l, r) -> l - r), 1, false);
  public static final Operator MULTIPLY =
      new Operator("*", BinaryOperation.total((l, r) -> l * r), 2, true);
  public static final Operator DIVIDE =
      new Operator(
          "/", (l, r) -> r == 0 ? OptionalDouble.empty() : OptionalDouble.of(l / r), 2, false);
  // Binds tighter than * and /: at equal precedence "a * b % c" would read as (a * b) % c.
  public static final Operator MODULO =
      new Operator(
          "%", (l, r) -> r == 0 ? OptionalDouble.empty() : OptionalDouble.of(l % r), 3, false);

  private static final Map<String, Operator> CATALOGUE = buildCatalogue();
  private static final OperatorTable STANDARD =
      OperatorTable.builder().add(ADD).add(SUBTRACT).add(MULTIPLY).add(DIVIDE).build();

  private Operators() {}

  /** The four basic operators {@code + - * /}. */
  public static OperatorTable standard() {
    return STANDARD;
  }

  /** Builds a table from catalogue symbols, keeping the requested order. */
  public static OperatorTable bySymbols(Collection<String> symbols) {
    Objects.requireNonNull(symbols, "symbols");
    OperatorTable.Builder builder = OperatorTable.builder();
    for (String symbol : symbols) {
      Operator operator = CATALOGUE.get(symbol == null ? null : symbol.trim());
      if (operator == null) {
        throw new IllegalArgumentException(
            "Unsupported operator: '" + symbol + "' (supported: " + CATALOGUE.keySet() + ")");
      }
      builder.add(operator);
    }
    return builder.build();
  }

  private static Map<String, Operator> buildCatalogue() {
    Map<String, Operator> catalogue = new LinkedHashMap<>();
    for (Operator operator : new Operator[] {ADD, SUBTRACT, MULTIPLY, DIVIDE, MODULO}) {
      catalogue.put(operator.symbol(), operator);
    }
    return Collections.unmodifiableMap(catalogue);
  }
}
