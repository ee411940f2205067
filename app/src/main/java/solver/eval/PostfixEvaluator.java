package solver.eval;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.OptionalDouble;
import solver.core.Operator;
import solver.core.OperatorTable;
import solver.core.model.PostfixSequence;
import solver.core.model.Token;

/**
 * Stack evaluator for postfix sequences.
 *
 * <p>For an operator the most recently pushed value is the right operand. The first domain
 * failure stops evaluation and becomes the result.
 */
public final class PostfixEvaluator {
  private final OperatorTable operators;

  public PostfixEvaluator(OperatorTable operators) {
    this.operators = Objects.requireNonNull(operators, "operators");
  }

  public Evaluation evaluate(PostfixSequence sequence) {
    Objects.requireNonNull(sequence, "sequence");
    if (sequence.isEmpty()) {
      throw new IllegalArgumentException("Cannot evaluate an empty sequence");
    }

    Deque<Double> stack = new ArrayDeque<>();
    for (Token token : sequence.tokens()) {
      if (token instanceof Token.NumberToken number) {
        stack.push(number.value());
        continue;
      }
      Token.OperatorToken opToken = (Token.OperatorToken) token;
      if (stack.size() < 2) {
        throw new IllegalArgumentException(
            "Operator '" + opToken.symbol() + "' lacks operands in: " + sequence);
      }
      double right = stack.pop();
      double left = stack.pop();
      Operator operator = operators.get(opToken.symbol());
      OptionalDouble result = operator.apply(left, right);
      if (result.isEmpty()) {
        return Evaluation.domainFailure(operator.symbol(), left, right);
      }
      stack.push(result.getAsDouble());
    }

    if (stack.size() != 1) {
      throw new IllegalArgumentException(
          "Sequence leaves " + stack.size() + " values on the stack: " + sequence);
    }
    return Evaluation.value(stack.pop());
  }
}
