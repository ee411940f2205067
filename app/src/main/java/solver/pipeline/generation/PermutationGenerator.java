package solver.pipeline.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Orderings of the input operands.
 *
 * <p>Permutations are taken over positions, not values: equal numbers at different positions are
 * treated as distinct items, so {@code n} operands always give {@code n!} permutations. Output is
 * lexicographic by position index.
 */
public final class PermutationGenerator {

  public List<List<Double>> permutations(List<Double> items) {
    Objects.requireNonNull(items, "items");
    int n = items.size();
    List<List<Double>> out = new ArrayList<>();
    if (n == 0) {
      return out;
    }

    int[] idx = new int[n];
    for (int i = 0; i < n; i++) {
      idx[i] = i;
    }
    while (true) {
      List<Double> perm = new ArrayList<>(n);
      for (int i : idx) {
        perm.add(items.get(i));
      }
      out.add(List.copyOf(perm));
      if (!nextPermutation(idx)) {
        break;
      }
    }
    return List.copyOf(out);
  }

  /** Advances {@code idx} to the next lexicographic permutation; false after the last one. */
  static boolean nextPermutation(int[] idx) {
    int pivot = idx.length - 2;
    while (pivot >= 0 && idx[pivot] >= idx[pivot + 1]) {
      pivot--;
    }
    if (pivot < 0) {
      return false;
    }
    int successor = idx.length - 1;
    while (idx[successor] <= idx[pivot]) {
      successor--;
    }
    swap(idx, pivot, successor);
    for (int i = pivot + 1, j = idx.length - 1; i < j; i++, j--) {
      swap(idx, i, j);
    }
    return true;
  }

  private static void swap(int[] a, int i, int j) {
    int tmp = a[i];
    a[i] = a[j];
    a[j] = tmp;
  }
}
