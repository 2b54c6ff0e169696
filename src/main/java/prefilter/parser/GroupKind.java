package prefilter.parser;

/**
 * Flavours of parenthesized group.
 */
public enum GroupKind {
  /**
   * {@code (...)}
   */
  CAPTURING,

  /**
   * {@code (?<name>...)} or {@code (?'name'...)}
   */
  NAMED,

  /**
   * {@code (?:...)}, including the inline flag form {@code (?i:...)}
   */
  NON_CAPTURING,

  /**
   * {@code (?>...)}
   */
  ATOMIC
}
