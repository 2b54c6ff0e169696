package prefilter.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily enumerated Cartesian product of lists.
 *
 * <p>Combinations come out in lexicographic order of the factor indices: the
 * last factor varies fastest. Nothing is materialized until iterated, and
 * {@link #size()} is available up front so callers can refuse a product that
 * is too large before generating any of it.
 *
 * @param <T> element type
 */
public final class CartesianProduct<T> implements Iterable<List<T>> {

  private final List<List<T>> factors;

  private CartesianProduct(List<List<T>> factors) {
    this.factors = factors;
  }

  /**
   * Product of the given factors, in order.
   *
   * @param factors lists to pick one element from each
   */
  public static <T> CartesianProduct<T> of(List<? extends List<? extends T>> factors) {
    final var copied = new ArrayList<List<T>>(factors.size());
    for (final List<? extends T> factor : factors) {
      copied.add(List.copyOf(factor));
    }
    return new CartesianProduct<>(Collections.unmodifiableList(copied));
  }

  /**
   * Product of a list with itself.
   *
   * @param factor list to pick from
   * @param exponent how many times to pick
   */
  public static <T> CartesianProduct<T> power(List<? extends T> factor, int exponent) {
    if (exponent < 0) {
      throw new IllegalArgumentException("Negative exponent: " + exponent);
    }
    final List<T> copied = List.copyOf(factor);
    return new CartesianProduct<>(Collections.nCopies(exponent, copied));
  }

  /**
   * Number of combinations, saturating at {@link Long#MAX_VALUE}.
   */
  public long size() {
    long size = 1;
    for (final List<T> factor : factors) {
      if (factor.isEmpty()) {
        return 0;
      }
      try {
        size = Math.multiplyExact(size, factor.size());
      } catch (ArithmeticException overflow) {
        size = Long.MAX_VALUE;
      }
    }
    return size;
  }

  @Override
  public Iterator<List<T>> iterator() {
    return new Odometer();
  }

  public Stream<List<T>> stream() {
    return StreamSupport.stream(
      Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
      false
    );
  }

  /**
   * Walks the index tuples like a mechanical counter.
   */
  private final class Odometer implements Iterator<List<T>> {
    private final int[] indices = new int[factors.size()];
    private boolean exhausted = factors.stream().anyMatch(List::isEmpty);

    @Override
    public boolean hasNext() {
      return !exhausted;
    }

    @Override
    public List<T> next() {
      if (exhausted) {
        throw new NoSuchElementException();
      }

      final var combination = new ArrayList<T>(indices.length);
      for (int i = 0; i < indices.length; i++) {
        combination.add(factors.get(i).get(indices[i]));
      }

      // Advance, carrying into earlier positions
      int position = indices.length - 1;
      while (position >= 0) {
        if (++indices[position] < factors.get(position).size()) {
          break;
        }
        indices[position] = 0;
        position--;
      }
      exhausted = position < 0;

      return Collections.unmodifiableList(combination);
    }
  }
}
