package solver.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, insertion-ordered mapping from operator symbol to {@link Operator}.
 *
 * <p>The table is validated once on construction and then shared read-only by every search. It
 * does not check that precedences match the mathematical behaviour of the functions.
 */
public final class OperatorTable {
  private final Map<String, Operator> operators;
  private final List<String> symbols;

  private OperatorTable(Map<String, Operator> operators) {
    this.operators = Collections.unmodifiableMap(new LinkedHashMap<>(operators));
    this.symbols = List.copyOf(operators.keySet());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static OperatorTable of(List<Operator> operators) {
    Objects.requireNonNull(operators, "operators");
    Builder builder = builder();
    operators.forEach(builder::add);
    return builder.build();
  }

  /** Looks up an operator; unknown symbols are a caller error. */
  public Operator get(String symbol) {
    Operator operator = operators.get(symbol);
    if (operator == null) {
      throw new IllegalArgumentException(
          "Unknown operator symbol: '" + symbol + "' (known: " + symbols + ")");
    }
    return operator;
  }

  public boolean contains(String symbol) {
    return operators.containsKey(symbol);
  }

  /** Symbols in table order. */
  public List<String> symbols() {
    return symbols;
  }

  public List<Operator> operators() {
    return List.copyOf(operators.values());
  }

  public int size() {
    return operators.size();
  }

  @Override
  public String toString() {
    return "OperatorTable" + symbols;
  }

  public static final class Builder {
    private final List<Operator> entries = new ArrayList<>();

    private Builder() {}

    public Builder add(Operator operator) {
      entries.add(Objects.requireNonNull(operator, "operator"));
      return this;
    }

    public Builder add(
        String symbol, BinaryOperation function, int precedence, boolean associative) {
      return add(new Operator(symbol, function, precedence, associative));
    }

    public OperatorTable build() {
      if (entries.isEmpty()) {
        throw new IllegalArgumentException("Operator table requires at least one operator");
      }
      Map<String, Operator> bySymbol = new LinkedHashMap<>();
      for (Operator operator : entries) {
        if (bySymbol.putIfAbsent(operator.symbol(), operator) != null) {
          throw new IllegalArgumentException("Duplicate operator symbol: " + operator.symbol());
        }
      }
      return new OperatorTable(bySymbol);
    }
  }
}
