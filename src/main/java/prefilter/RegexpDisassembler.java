package prefilter;

import prefilter.ast.RegexNode;
import prefilter.ast.SyntaxTreeBuilder;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Extracts the literal substrings that every match of a regular expression
 * must contain.
 *
 * <p>The results are meant for cheaply rejecting inputs before running the
 * real pattern: if an input lacks one of the {@link #substrings()}, or lacks
 * some substring from every row of {@link #alternatedSubstrings()}, it cannot
 * match. The substrings are necessary, never sufficient, and may be fewer or
 * shorter than the best possible answer.
 *
 * <p>Both results are computed on first use and cached. Instances are
 * immutable apart from that cache, so they can be shared between threads.
 */
public final class RegexpDisassembler {

  /**
   * Default bound on the number of rows in {@link #alternatedSubstrings()}.
   */
  public static final int DEFAULT_MAX_ALTERNATIVES = 1024;

  private final RegexNode tree;
  private final boolean caseInsensitive;
  private final int maxAlternatives;
  private final boolean printDebugInfo;

  private volatile List<String> substrings;
  private volatile List<List<String>> alternatedSubstrings;

  /**
   * Parse and disassemble a regular expression.
   *
   * @param regex source of the pattern
   * @return disassembler for the pattern
   */
  public static RegexpDisassembler of(String regex) throws PatternSyntaxException {
    return of(regex, 0);
  }

  /**
   * Parse and disassemble a regular expression.
   *
   * @param regex source of the pattern
   * @param flags bitmask of {@link java.util.regex.Pattern} flags
   * @return disassembler for the pattern
   */
  public static RegexpDisassembler of(String regex, int flags) throws PatternSyntaxException {
    return of(regex, flags, DEFAULT_MAX_ALTERNATIVES, false);
  }

  /**
   * Parse and disassemble a regular expression.
   *
   * @param regex source of the pattern
   * @param flags bitmask of {@link java.util.regex.Pattern} flags
   * @param maxAlternatives bound on the number of alternated rows
   * @param printDebugInfo trace the computation on standard error
   * @return disassembler for the pattern
   */
  public static RegexpDisassembler of(
    String regex,
    int flags,
    int maxAlternatives,
    boolean printDebugInfo
  ) throws PatternSyntaxException {
    final var parsed = SyntaxTreeBuilder.parse(regex, flags);
    if (printDebugInfo) {
      System.err.println("[Disassembler] parsed /" + regex + "/ into " + parsed.tree());
    }
    return new RegexpDisassembler(parsed.tree(), parsed.caseInsensitive(), maxAlternatives, printDebugInfo);
  }

  public RegexpDisassembler(RegexNode tree) {
    this(tree, false, DEFAULT_MAX_ALTERNATIVES, false);
  }

  /**
   * Disassemble an already parsed syntax tree.
   *
   * @param tree syntax tree of the pattern
   * @param caseInsensitive report substrings upper-cased, for case-insensitive searching
   * @param maxAlternatives bound on the number of alternated rows
   * @param printDebugInfo trace the computation on standard error
   */
  public RegexpDisassembler(
    RegexNode tree,
    boolean caseInsensitive,
    int maxAlternatives,
    boolean printDebugInfo
  ) {
    this.tree = Objects.requireNonNull(tree, "tree");
    if (maxAlternatives < 1) {
      throw new IllegalArgumentException("Need room for at least one alternative, got " + maxAlternatives);
    }
    this.caseInsensitive = caseInsensitive;
    this.maxAlternatives = maxAlternatives;
    this.printDebugInfo = printDebugInfo;
  }

  public RegexNode tree() {
    return tree;
  }

  /**
   * Are the substrings upper-cased stand-ins for case-insensitive text?
   */
  public boolean isCaseInsensitive() {
    return caseInsensitive;
  }

  /**
   * Substrings which all occur in every match, alternations being treated as
   * unknown content.
   *
   * @return substrings in pattern order, without empty strings
   */
  public List<String> substrings() {
    List<String> result = substrings;
    if (result == null) {
      final Fragment fragment = tree.accept(new ConjunctiveWalker());
      if (printDebugInfo) {
        System.err.println("[Disassembler] conjunctive fragment: " + fragment);
      }
      result = normalize(fragment);
      substrings = result;
    }
    return result;
  }

  /**
   * Alternative lists of substrings, one per combination of alternation
   * branches: every match contains all substrings of at least one list.
   *
   * <p>Without alternations this is exactly {@code List.of(substrings())}.
   *
   * @return lists in branch declaration order
   */
  public List<List<String>> alternatedSubstrings() {
    List<List<String>> result = alternatedSubstrings;
    if (result == null) {
      final List<Fragment> rows = tree.accept(new DisjunctiveWalker(maxAlternatives, printDebugInfo));
      if (printDebugInfo) {
        System.err.println("[Disassembler] disjunctive fragments: " + rows);
      }
      result = rows
        .stream()
        .map(this::normalize)
        .collect(Collectors.toUnmodifiableList());
      alternatedSubstrings = result;
    }
    return result;
  }

  private List<String> normalize(Fragment fragment) {
    return fragment
      .substrings()
      .stream()
      .filter(substring -> !substring.isEmpty())
      .map(substring -> caseInsensitive ? substring.toUpperCase(Locale.ROOT) : substring)
      .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public String toString() {
    return "RegexpDisassembler(" + tree + ")";
  }
}
