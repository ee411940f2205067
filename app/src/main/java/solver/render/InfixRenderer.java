package solver.render;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import solver.core.Operator;
import solver.core.OperatorTable;
import solver.core.model.PostfixSequence;
import solver.core.model.Token;

/**
 * Converts postfix sequences to infix text with the fewest parentheses that keep the evaluation
 * order.
 *
 * <p>Each rendered fragment remembers the operator at its root. When that fragment becomes an
 * operand of a new operator:
 *
 * <ul>
 *   <li>a left operand is wrapped only if its root binds strictly looser than the new operator;
 *   <li>a right operand is also wrapped on equal precedence when the new operator is not
 *       associative, since {@code a - (b - c)} differs from {@code a - b - c}.
 * </ul>
 *
 * <p>Operands never get parentheses. Right-associative operators would need a separate flag and
 * are not supported.
 */
public final class InfixRenderer {
  private final OperatorTable operators;

  public InfixRenderer(OperatorTable operators) {
    this.operators = Objects.requireNonNull(operators, "operators");
  }

  /** Renders {@code sequence}; an empty sequence has no rendering. */
  public Optional<String> render(PostfixSequence sequence) {
    Objects.requireNonNull(sequence, "sequence");
    if (sequence.isEmpty()) {
      return Optional.empty();
    }

    Deque<Fragment> stack = new ArrayDeque<>();
    for (Token token : sequence.tokens()) {
      if (token instanceof Token.NumberToken number) {
        stack.push(Fragment.operand(NumberFormatter.format(number.value())));
        continue;
      }
      Token.OperatorToken opToken = (Token.OperatorToken) token;
      if (stack.size() < 2) {
        throw new IllegalArgumentException(
            "Operator '" + opToken.symbol() + "' lacks operands in: " + sequence);
      }
      Fragment right = stack.pop();
      Fragment left = stack.pop();
      Operator operator = operators.get(opToken.symbol());

      String leftText = needsParentheses(left, operator, false) ? wrap(left.text) : left.text;
      String rightText = needsParentheses(right, operator, true) ? wrap(right.text) : right.text;
      stack.push(new Fragment(leftText + " " + operator.symbol() + " " + rightText, operator));
    }

    if (stack.size() != 1) {
      throw new IllegalArgumentException(
          "Sequence leaves " + stack.size() + " fragments: " + sequence);
    }
    return Optional.of(stack.pop().text);
  }

  static boolean needsParentheses(Fragment operand, Operator parent, boolean rightSide) {
    if (operand.root == null) {
      return false;
    }
    int childPrecedence = operand.root.precedence();
    if (childPrecedence < parent.precedence()) {
      return true;
    }
    return rightSide && childPrecedence == parent.precedence() && !parent.associative();
  }

  private static String wrap(String text) {
    return "(" + text + ")";
  }

  /** Rendered text plus the operator at its root; {@code null} root for a bare operand. */
  static final class Fragment {
    final String text;
    final Operator root;

    Fragment(String text, Operator root) {
      this.text = text;
      this.root = root;
    }

    static Fragment operand(String text) {
      return new Fragment(text, null);
    }
  }
}
