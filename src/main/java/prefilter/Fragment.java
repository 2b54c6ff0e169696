package prefilter;

import java.util.List;
import java.util.Objects;

/**
 * Mandatory substrings of one piece of a pattern, in order.
 *
 * <p>The edge flags say whether the first (resp. last) substring is known to
 * touch whatever precedes (resp. follows) the piece, with nothing in between.
 * For a fragment without substrings, they say whether the piece itself is
 * transparent on that side.
 *
 * @param substrings mandatory substrings, never containing an empty string
 * @param leftExact first substring abuts the preceding content
 * @param rightExact last substring abuts the following content
 */
public record Fragment(List<String> substrings, boolean leftExact, boolean rightExact) {

  /**
   * Something of unknown content and length, which breaks adjacency on both sides.
   */
  public static final Fragment OPAQUE = new Fragment(List.of(), false, false);

  /**
   * Something zero-width, which leaves adjacency untouched.
   */
  public static final Fragment TRANSPARENT = new Fragment(List.of(), true, true);

  public Fragment {
    substrings = List.copyOf(substrings);
    for (final String substring : substrings) {
      if (substring.isEmpty()) {
        throw new IllegalArgumentException("Fragments don't hold empty substrings");
      }
    }
  }

  /**
   * Fragment for an exact run of characters.
   *
   * @param text non-empty literal text
   */
  public static Fragment literal(String text) {
    Objects.requireNonNull(text, "text");
    return new Fragment(List.of(text), true, true);
  }

  /**
   * Is the whole piece one deterministic block of literal text?
   */
  public boolean isPure() {
    return substrings.size() == 1 && leftExact && rightExact;
  }

  public boolean isEmpty() {
    return substrings.isEmpty();
  }

  @Override
  public String toString() {
    return (leftExact ? "|" : "~") + substrings + (rightExact ? "|" : "~");
  }
}
