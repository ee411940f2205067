package solver.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Postfix skeleton of a binary expression tree: the order in which operand and operator slots
 * appear.
 *
 * <p>Reading left to right, the number of available operands never drops below one once an
 * operator is placed, and exactly one operand remains at the end.
 */
public final class Shape {
  private final List<Slot> slots;
  private final int numberCount;

  public Shape(List<Slot> slots) {
    this.slots = List.copyOf(Objects.requireNonNull(slots, "slots"));
    this.numberCount = validate(this.slots);
  }

  public static Shape of(Slot... slots) {
    return new Shape(List.of(slots));
  }

  /** Parses the compact form used in logs and tests, e.g. {@code "NNONO"}. */
  public static Shape parse(String compact) {
    Objects.requireNonNull(compact, "compact");
    Slot[] slots = new Slot[compact.length()];
    for (int i = 0; i < compact.length(); i++) {
      slots[i] =
          switch (compact.charAt(i)) {
            case 'N' -> Slot.NUMBER;
            case 'O' -> Slot.OPERATOR;
            default -> throw new IllegalArgumentException(
                "Invalid shape character '" + compact.charAt(i) + "' in " + compact);
          };
    }
    return of(slots);
  }

  public List<Slot> slots() {
    return slots;
  }

  public int size() {
    return slots.size();
  }

  public Slot get(int index) {
    return slots.get(index);
  }

  public int numberCount() {
    return numberCount;
  }

  public int operatorCount() {
    return slots.size() - numberCount;
  }

  public String compact() {
    StringBuilder sb = new StringBuilder(slots.size());
    for (Slot slot : slots) {
      sb.append(slot == Slot.NUMBER ? 'N' : 'O');
    }
    return sb.toString();
  }

  private static int validate(List<Slot> slots) {
    int stack = 0;
    int numbers = 0;
    for (int i = 0; i < slots.size(); i++) {
      Slot slot = Objects.requireNonNull(slots.get(i), "slot");
      if (slot == Slot.NUMBER) {
        stack++;
        numbers++;
      } else {
        if (stack < 2) {
          throw new IllegalArgumentException(
              "Operator at position " + i + " has fewer than two operands: " + slots);
        }
        stack--;
      }
    }
    if (stack != 1) {
      throw new IllegalArgumentException(
          "Shape must reduce to exactly one operand, got " + stack + ": " + slots);
    }
    return numbers;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Shape other)) {
      return false;
    }
    return slots.equals(other.slots);
  }

  @Override
  public int hashCode() {
    return slots.hashCode();
  }

  @Override
  public String toString() {
    return compact();
  }
}
