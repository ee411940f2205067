package solver.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import solver.core.Operator;
import solver.core.OperatorTable;
import solver.core.model.PostfixSequence;
import solver.core.model.Token;

/**
 * Conventional infix parser used to check rendered expressions: all operators are
 * left-associative and bind according to the table's precedences.
 *
 * <p>Produces a postfix sequence so the result can be evaluated by either evaluator.
 */
public final class InfixParser {
  private final OperatorTable operators;
  private String text;
  private int pos;
  private List<Token> out;

  public InfixParser(OperatorTable operators) {
    this.operators = Objects.requireNonNull(operators, "operators");
  }

  public PostfixSequence toPostfix(String infix) {
    this.text = Objects.requireNonNull(infix, "infix");
    this.pos = 0;
    this.out = new ArrayList<>();
    parseExpression(Integer.MIN_VALUE);
    skipSpaces();
    if (pos != text.length()) {
      throw new IllegalArgumentException("Trailing input at " + pos + ": " + text);
    }
    return new PostfixSequence(out);
  }

  private void parseExpression(int minPrecedence) {
    parsePrimary();
    while (true) {
      skipSpaces();
      Operator operator = peekOperator();
      if (operator == null || operator.precedence() < minPrecedence) {
        return;
      }
      pos += operator.symbol().length();
      parseExpression(operator.precedence() + 1);
      out.add(Token.operator(operator.symbol()));
    }
  }

  private void parsePrimary() {
    skipSpaces();
    if (pos >= text.length()) {
      throw new IllegalArgumentException("Unexpected end of input: " + text);
    }
    if (text.charAt(pos) == '(') {
      pos++;
      parseExpression(Integer.MIN_VALUE);
      skipSpaces();
      if (pos >= text.length() || text.charAt(pos) != ')') {
        throw new IllegalArgumentException("Missing ')' at " + pos + ": " + text);
      }
      pos++;
      return;
    }
    int start = pos;
    if (text.charAt(pos) == '-') {
      pos++;
    }
    while (pos < text.length()
        && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
      pos++;
    }
    if (start == pos || (pos - start == 1 && text.charAt(start) == '-')) {
      throw new IllegalArgumentException("Expected a number at " + start + ": " + text);
    }
    out.add(Token.number(Double.parseDouble(text.substring(start, pos))));
  }

  private Operator peekOperator() {
    Operator best = null;
    for (Operator candidate : operators.operators()) {
      if (text.startsWith(candidate.symbol(), pos)
          && (best == null || candidate.symbol().length() > best.symbol().length())) {
        best = candidate;
      }
    }
    return best;
  }

  private void skipSpaces() {
    while (pos < text.length() && text.charAt(pos) == ' ') {
      pos++;
    }
  }
}
