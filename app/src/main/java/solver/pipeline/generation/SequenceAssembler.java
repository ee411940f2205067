package solver.pipeline.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import solver.core.model.PostfixSequence;
import solver.core.model.Shape;
import solver.core.model.Slot;
import solver.core.model.Token;

/** Binds a shape's slots to one operand permutation and one operator tuple. */
public final class SequenceAssembler {

  public PostfixSequence assemble(Shape shape, List<Double> operands, List<String> operators) {
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(operands, "operands");
    Objects.requireNonNull(operators, "operators");
    if (operands.size() != shape.numberCount() || operators.size() != shape.operatorCount()) {
      throw new IllegalArgumentException(
          "Shape "
              + shape
              + " needs "
              + shape.numberCount()
              + " operand(s) and "
              + shape.operatorCount()
              + " operator(s), got "
              + operands.size()
              + " and "
              + operators.size());
    }

    List<Token> tokens = new ArrayList<>(shape.size());
    int numberIndex = 0;
    int operatorIndex = 0;
    for (Slot slot : shape.slots()) {
      if (slot == Slot.NUMBER) {
        tokens.add(Token.number(operands.get(numberIndex++)));
      } else {
        tokens.add(Token.operator(operators.get(operatorIndex++)));
      }
    }
    return new PostfixSequence(tokens);
  }
}
