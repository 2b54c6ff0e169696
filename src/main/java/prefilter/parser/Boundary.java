package prefilter.parser;

import java.util.Map;

/**
 * Zero-width matchers.
 *
 * <p>Lookaround groups are reported as boundaries too: whatever their body
 * matches, they consume no input.
 */
public enum Boundary {
  /**
   * Beginning of line
   */
  BEGINNING_OF_LINE,

  /**
   * End of line
   */
  END_OF_LINE,

  /**
   * Word boundary
   */
  WORD_BOUNDARY,

  /**
   * Non-word boundary
   */
  NON_WORD_BOUNDARY,

  /**
   * Beginning of input
   */
  BEGINNING_OF_INPUT,

  /**
   * End of input, safe for an optional final terminator
   */
  END_OF_INPUT_OR_TERMINATOR,

  /**
   * End of input
   */
  END_OF_INPUT,

  /**
   * End of the previous match
   */
  END_OF_PREVIOUS_MATCH,

  /**
   * Positive lookahead {@code (?=...)}
   */
  LOOKAHEAD,

  /**
   * Negative lookahead {@code (?!...)}
   */
  NEGATIVE_LOOKAHEAD,

  /**
   * Positive lookbehind {@code (?<=...)}
   */
  LOOKBEHIND,

  /**
   * Negative lookbehind {@code (?<!...)}
   */
  NEGATIVE_LOOKBEHIND;

  /**
   * Mapping from the escaped character used to represent the boundary to the boundary.
   */
  public static final Map<Character, Boundary> CHARACTERS = Map.of(
    'b', Boundary.WORD_BOUNDARY,
    'B', Boundary.NON_WORD_BOUNDARY,
    'A', Boundary.BEGINNING_OF_INPUT,
    'Z', Boundary.END_OF_INPUT_OR_TERMINATOR,
    'z', Boundary.END_OF_INPUT,
    'G', Boundary.END_OF_PREVIOUS_MATCH
  );

  /**
   * Is this boundary a lookaround group rather than an anchor?
   */
  public boolean isLookaround() {
    switch (this) {
      case LOOKAHEAD:
      case NEGATIVE_LOOKAHEAD:
      case LOOKBEHIND:
      case NEGATIVE_LOOKBEHIND:
        return true;
      default:
        return false;
    }
  }
}
