package kleene.graph;

import java.util.Arrays;
import java.util.Collection;
import java.util.stream.IntStream;
import java.util.stream.Collectors;

/**
 * Immutable set of state indices.
 *
 * Used as the key of subsets of states, so equality only depends on the
 * members.
 */
public final class IntSet {

  // Sorted and distinct elements
  private final int[] elements;

  public static IntSet of(int... elems) {
    return new IntSet(IntStream.of(elems));
  }

  public static IntSet of(Collection<Integer> elems) {
    return new IntSet(elems.stream().mapToInt(Integer::intValue));
  }

  private IntSet(IntStream elems) {
    this.elements = elems.sorted().distinct().toArray();
  }

  public IntStream stream() {
    return Arrays.stream(elements);
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(int element) {
    return Arrays.binarySearch(elements, element) >= 0;
  }

  /**
   * Whether the two sets have at least one element in common.
   */
  public boolean intersects(Collection<Integer> other) {
    return stream().anyMatch(other::contains);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof IntSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((IntSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return stream()
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
