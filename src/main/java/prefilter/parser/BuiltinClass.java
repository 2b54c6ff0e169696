package prefilter.parser;

import java.util.Map;

/**
 * Special character classes, written as {@code .} or as a backslash escape.
 *
 * <p>Only the identity of the class matters downstream: none of these ever
 * contributes a known character.
 */
public enum BuiltinClass {
  /**
   * Any character.
   */
  DOT('.'),

  /**
   * Digit character.
   */
  DIGIT('d'),

  /**
   * Non-digit character.
   */
  NON_DIGIT('D'),

  /**
   * Horizontal whitespace character.
   */
  HORIZONTAL_WHITE_SPACE('h'),

  /**
   * Non-horizontal whitespace character.
   */
  NON_HORIZONTAL_WHITE_SPACE('H'),

  /**
   * Whitespace character.
   */
  WHITE_SPACE('s'),

  /**
   * Non-whitespace character.
   */
  NON_WHITE_SPACE('S'),

  /**
   * Vertical whitespace character.
   */
  VERTICAL_WHITE_SPACE('v'),

  /**
   * Non-vertical whitespace character.
   */
  NON_VERTICAL_WHITE_SPACE('V'),

  /**
   * Word character.
   */
  WORD('w'),

  /**
   * Non-word character.
   */
  NON_WORD('W'),

  /**
   * Any linebreak sequence, which may be two characters wide ({@code \r\n}).
   */
  LINEBREAK('R'),

  /**
   * Extended grapheme cluster, of unknown width.
   */
  GRAPHEME_CLUSTER('X');

  /**
   * Character following the backslash (or the {@code .} itself).
   */
  public final char escape;

  BuiltinClass(char escape) {
    this.escape = escape;
  }

  /**
   * Does the class always match exactly one code point?
   */
  public boolean isSingleCharacter() {
    return this != LINEBREAK && this != GRAPHEME_CLUSTER;
  }

  /**
   * Mapping from the escaped character used to represent the class to the class.
   */
  public static final Map<Character, BuiltinClass> CHARACTERS = Map.ofEntries(
    Map.entry('d', BuiltinClass.DIGIT),
    Map.entry('D', BuiltinClass.NON_DIGIT),
    Map.entry('h', BuiltinClass.HORIZONTAL_WHITE_SPACE),
    Map.entry('H', BuiltinClass.NON_HORIZONTAL_WHITE_SPACE),
    Map.entry('s', BuiltinClass.WHITE_SPACE),
    Map.entry('S', BuiltinClass.NON_WHITE_SPACE),
    Map.entry('v', BuiltinClass.VERTICAL_WHITE_SPACE),
    Map.entry('V', BuiltinClass.NON_VERTICAL_WHITE_SPACE),
    Map.entry('w', BuiltinClass.WORD),
    Map.entry('W', BuiltinClass.NON_WORD),
    Map.entry('R', BuiltinClass.LINEBREAK),
    Map.entry('X', BuiltinClass.GRAPHEME_CLUSTER)
  );
}
