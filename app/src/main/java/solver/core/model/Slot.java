package solver.core.model;

/** Position kind inside a {@link Shape}. */
public enum Slot {
  NUMBER,
  OPERATOR
}
