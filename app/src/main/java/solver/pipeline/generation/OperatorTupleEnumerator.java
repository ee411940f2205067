package solver.pipeline.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cartesian product of operator symbols with repetition.
 *
 * <p>Tuples come out in odometer order over the given symbol order, last position varying
 * fastest. A length of zero yields the single empty tuple.
 */
public final class OperatorTupleEnumerator {

  public List<List<String>> enumerate(List<String> symbols, int length) {
    Objects.requireNonNull(symbols, "symbols");
    if (length < 0) {
      throw new IllegalArgumentException("Tuple length must be non-negative: " + length);
    }
    List<List<String>> out = new ArrayList<>();
    if (length == 0) {
      out.add(List.of());
      return List.copyOf(out);
    }
    if (symbols.isEmpty()) {
      return List.of();
    }

    int[] idx = new int[length];
    while (true) {
      List<String> tuple = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        tuple.add(symbols.get(idx[i]));
      }
      out.add(List.copyOf(tuple));

      int p = length - 1;
      while (p >= 0) {
        idx[p]++;
        if (idx[p] < symbols.size()) {
          break;
        }
        idx[p] = 0;
        p--;
      }
      if (p < 0) {
        break;
      }
    }
    return List.copyOf(out);
  }
}
