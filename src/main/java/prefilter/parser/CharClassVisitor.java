package prefilter.parser;

/**
 * Bottom-up traversal of the character class AST.
 *
 * @param <C> output from traversing the pattern AST
 */
public interface CharClassVisitor<C> {

  /**
   * Matches a single abstract character.
   *
   * <p>An abstract character is represented by its unicode code point. Note
   * that this is not equivalent to a Java {@code char}, which is instead a
   * code unit (and where unicode code points get encoded as one or two UTF-16
   * code units).
   *
   * @param codePoint unicode code point to match
   * @param flags bitmask of regular expression flags
   */
  C visitCharacter(int codePoint, int flags);

  /**
   * Matches a range of abstract characters.
   *
   * @param startCodePoint first code point in the range (inclusive)
   * @param endCodePoint last code point in the range (inclusive)
   * @param flags bitmask of regular expression flags
   */
  C visitRange(int startCodePoint, int endCodePoint, int flags);

  /**
   * Matches all characters that don't match another pattern.
   *
   * @param negate negated pattern
   */
  C visitNegated(C negate);

  /**
   * Matches characters in either class.
   *
   * <p>The "union" in a character class has no symbolic operator - classes
   * are implicitly unioned.
   *
   * @param lhs first class of characters
   * @param rhs second class of characters
   */
  C visitUnion(C lhs, C rhs);

  /**
   * Matches characters in both classes.
   *
   * @param lhs first class of characters
   * @param rhs second class of characters
   */
  C visitIntersection(C lhs, C rhs);

  /**
   * Matches characters inside a builtin character class.
   *
   * @param cls builtin class
   * @param flags bitmask of regular expression flags
   */
  C visitBuiltinClass(BuiltinClass cls, int flags);

  /**
   * Matches characters with (or without) a named property, as in
   * {@code \p{Alpha}} or {@code \P{InGreek}}.
   *
   * @param propertyName name between the braces
   * @param negated match characters without the property
   * @param flags bitmask of regular expression flags
   */
  C visitPropertyClass(String propertyName, boolean negated, int flags);

  /**
   * Matches characters in a POSIX bracket expression, as in {@code [:alpha:]}.
   *
   * @param className name between the colons
   * @param negated match characters outside the class ({@code [:^alpha:]})
   * @param flags bitmask of regular expression flags
   */
  C visitPosixClass(String className, boolean negated, int flags);
}
