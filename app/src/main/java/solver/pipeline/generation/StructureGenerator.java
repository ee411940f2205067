package solver.pipeline.generation;

import java.util.ArrayList;
import java.util.List;
import solver.core.model.Shape;
import solver.core.model.Slot;

/**
 * Enumerates every postfix shape for a given operand count.
 *
 * <p>Shapes are built depth first. An operator slot is only offered while at least two operands
 * are available, so every produced shape is valid and no filtering pass is needed. The number
 * branch is explored before the operator branch, which fixes the output order.
 */
public final class StructureGenerator {

  public List<Shape> generate(int operandCount) {
    if (operandCount < 1) {
      throw new IllegalArgumentException("Operand count must be at least 1: " + operandCount);
    }
    List<Shape> out = new ArrayList<>();
    List<Slot> current = new ArrayList<>(2 * operandCount - 1);
    extend(operandCount, operandCount - 1, 0, current, out);
    return List.copyOf(out);
  }

  private void extend(
      int numbersLeft, int operatorsLeft, int stackSize, List<Slot> current, List<Shape> out) {
    if (numbersLeft == 0 && operatorsLeft == 0) {
      out.add(new Shape(current));
      return;
    }

    if (numbersLeft > 0) {
      current.add(Slot.NUMBER);
      extend(numbersLeft - 1, operatorsLeft, stackSize + 1, current, out);
      current.remove(current.size() - 1);
    }

    if (operatorsLeft > 0 && stackSize >= 2) {
      current.add(Slot.OPERATOR);
      extend(numbersLeft, operatorsLeft - 1, stackSize - 1, current, out);
      current.remove(current.size() - 1);
    }
  }
}
