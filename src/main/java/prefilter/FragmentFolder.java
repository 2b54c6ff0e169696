package prefilter;

import java.util.ArrayList;
import java.util.List;

/**
 * Left-to-right merge of fragments that follow each other in a pattern.
 *
 * <p>When the running right edge and the next fragment's left edge are both
 * exact, the two boundary substrings are glued into one. Otherwise the
 * substring built so far is complete and a new one starts. Interior
 * substrings of a fragment are already complete and pass through as they are.
 */
final class FragmentFolder {

  private FragmentFolder() { }

  /**
   * Concatenate fragments.
   *
   * <p>The edges of the result describe its outermost substrings, so any
   * leading (trailing) substring-less fragments must be transparent on both
   * sides for the result to stay exact on the left (right). An empty list
   * folds to {@link Fragment#TRANSPARENT}.
   *
   * @param fragments fragments in pattern order
   * @return merged fragment
   */
  static Fragment fold(List<Fragment> fragments) {
    final var completed = new ArrayList<String>();
    final var buffer = new StringBuilder();
    boolean runningExact = true;

    boolean leftExact = true;
    boolean seenSubstring = false;
    boolean trailingExact = true;

    for (final Fragment next : fragments) {
      final boolean connected = runningExact && next.leftExact();
      final List<String> substrings = next.substrings();

      if (substrings.isEmpty()) {
        if (!connected) {
          flush(buffer, completed);
        }
        if (!seenSubstring) {
          leftExact &= next.leftExact() && next.rightExact();
        }
        trailingExact &= next.leftExact() && next.rightExact();
        runningExact = next.rightExact();
        continue;
      }

      if (!seenSubstring) {
        leftExact &= next.leftExact();
        seenSubstring = true;
      }

      if (!connected) {
        flush(buffer, completed);
      }
      buffer.append(substrings.get(0));

      final int last = substrings.size() - 1;
      if (last > 0) {
        flush(buffer, completed);
        completed.addAll(substrings.subList(1, last));
        buffer.append(substrings.get(last));
      }

      trailingExact = next.rightExact();
      runningExact = next.rightExact();
    }
    flush(buffer, completed);

    return new Fragment(completed, leftExact, trailingExact);
  }

  private static void flush(StringBuilder buffer, List<String> completed) {
    if (buffer.length() > 0) {
      completed.add(buffer.toString());
      buffer.setLength(0);
    }
  }
}
