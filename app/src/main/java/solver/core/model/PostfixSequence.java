package solver.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A shape whose slots are bound to concrete operands and operator symbols.
 *
 * <p>Well-formedness is checked by the consumers (evaluator and renderer), so hand-built
 * sequences in tests can exercise malformed input.
 */
public final class PostfixSequence {
  private static final PostfixSequence EMPTY = new PostfixSequence(List.of());

  private final List<Token> tokens;

  public PostfixSequence(List<Token> tokens) {
    this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
  }

  public static PostfixSequence empty() {
    return EMPTY;
  }

  public static PostfixSequence of(Token... tokens) {
    return new PostfixSequence(List.of(tokens));
  }

  /**
   * Parses whitespace separated postfix text such as {@code "2 4 + 8 *"}. Tokens that parse as
   * numbers become operands, everything else an operator symbol.
   */
  public static PostfixSequence parse(String text) {
    Objects.requireNonNull(text, "text");
    List<Token> tokens = new ArrayList<>();
    for (String raw : text.trim().split("\\s+")) {
      if (raw.isEmpty()) {
        continue;
      }
      tokens.add(isNumeric(raw) ? Token.number(Double.parseDouble(raw)) : Token.operator(raw));
    }
    return new PostfixSequence(tokens);
  }

  public List<Token> tokens() {
    return tokens;
  }

  public int size() {
    return tokens.size();
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }

  private static boolean isNumeric(String raw) {
    char first = raw.charAt(0);
    boolean signed = (first == '-' || first == '+') && raw.length() > 1;
    if (!signed && !Character.isDigit(first) && first != '.') {
      return false;
    }
    try {
      Double.parseDouble(raw);
      return true;
    } catch (NumberFormatException ex) {
      return false;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PostfixSequence other)) {
      return false;
    }
    return tokens.equals(other.tokens);
  }

  @Override
  public int hashCode() {
    return tokens.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Token token : tokens) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(token);
    }
    return sb.toString();
  }
}
