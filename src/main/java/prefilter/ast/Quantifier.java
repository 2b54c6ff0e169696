package prefilter.ast;

import java.util.OptionalInt;

/**
 * Repetition bounds of a syntax tree node.
 *
 * @param min minimum (inclusive) number of times the node must match
 * @param max maximum (inclusive) number of times the node may match, empty if unbounded
 */
public record Quantifier(int min, OptionalInt max) {

  /**
   * Exactly once, the bounds of an unquantified node.
   */
  public static final Quantifier ONCE = new Quantifier(1, OptionalInt.of(1));

  public Quantifier {
    if (min < 0) {
      throw new IllegalArgumentException("Negative minimum repetition: " + min);
    }
    if (max == null) {
      throw new IllegalArgumentException("Maximum repetition must be present or empty, not null");
    }
    if (max.isPresent() && max.getAsInt() < min) {
      throw new IllegalArgumentException(
        "Maximum repetition " + max.getAsInt() + " is below minimum " + min
      );
    }
  }

  public static Quantifier between(int min, int max) {
    return new Quantifier(min, OptionalInt.of(max));
  }

  public static Quantifier atLeast(int min) {
    return new Quantifier(min, OptionalInt.empty());
  }

  public static Quantifier exactly(int count) {
    return new Quantifier(count, OptionalInt.of(count));
  }

  /**
   * Can the node be skipped entirely?
   */
  public boolean isOptional() {
    return min == 0;
  }

  /**
   * Is the repetition count fixed, as in {@code {3}}?
   */
  public boolean isFixed() {
    return max.isPresent() && max.getAsInt() == min;
  }

  /**
   * Is this the trivial "exactly once" quantifier?
   */
  public boolean isOnce() {
    return min == 1 && isFixed();
  }

  @Override
  public String toString() {
    if (isOnce()) {
      return "";
    } else if (isFixed()) {
      return "{" + min + "}";
    } else if (max.isPresent()) {
      return "{" + min + "," + max.getAsInt() + "}";
    } else {
      return "{" + min + ",}";
    }
  }
}
