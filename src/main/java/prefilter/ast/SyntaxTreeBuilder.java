package prefilter.ast;

import prefilter.ast.RegexNode.Alternation;
import prefilter.ast.RegexNode.Anchor;
import prefilter.ast.RegexNode.Backreference;
import prefilter.ast.RegexNode.CharacterClass;
import prefilter.ast.RegexNode.Concatenation;
import prefilter.ast.RegexNode.Group;
import prefilter.ast.RegexNode.Literal;
import prefilter.ast.RegexNode.MetaClass;
import prefilter.ast.RegexNode.PosixClass;
import prefilter.ast.RegexNode.Quantified;
import prefilter.ast.RegexNode.SubexpressionCall;
import prefilter.ast.RegexNode.Wildcard;
import prefilter.parser.Boundary;
import prefilter.parser.BuiltinClass;
import prefilter.parser.GroupKind;
import prefilter.parser.RegexParser;
import prefilter.parser.RegexVisitor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex AST visitor which materializes the {@link RegexNode} tree.
 *
 * <p>Beyond a one-to-one translation, the builder normalizes the shape of
 * the tree: nested concatenations are flattened, adjacent unquantified
 * characters are coalesced into a single {@link Literal}, chains of
 * alternations become one {@link Alternation}, and a quantifier lands on the
 * node it repeats (wrapping it in a non-capturing group if that node already
 * has one).
 *
 * <p>A builder instance remembers whether it saw case-insensitive
 * characters, so use a fresh one for every pattern.
 */
public final class SyntaxTreeBuilder
    implements RegexVisitor<RegexNode, SyntaxTreeBuilder.ClassShape> {

  private boolean caseInsensitive = false;

  /**
   * Parse a pattern straight into a syntax tree.
   *
   * @param regex regular expression pattern
   * @param flags bitmask of {@link Pattern} flags
   * @return builder holding the tree and what was learnt while building it
   */
  public static ParsedPattern parse(String regex, int flags) throws PatternSyntaxException {
    final var builder = new SyntaxTreeBuilder();
    final RegexNode tree = RegexParser.parse(builder, regex, flags);
    return new ParsedPattern(regex, tree, builder.caseInsensitive);
  }

  /**
   * Outcome of parsing a pattern.
   *
   * @param pattern source of the pattern
   * @param tree syntax tree
   * @param caseInsensitive whether any character is matched case-insensitively
   */
  public record ParsedPattern(String pattern, RegexNode tree, boolean caseInsensitive) { }

  /**
   * Were any characters matched case-insensitively?
   */
  public boolean isCaseInsensitive() {
    return caseInsensitive;
  }

  /**
   * What a character class turned out to be.
   *
   * <p>Most shapes survive into the tree as their own node kind; the rest are
   * only kept as a rendering for {@link CharacterClass#description()}.
   */
  public sealed interface ClassShape {
    String render();
  }

  record Single(int codePoint) implements ClassShape {
    @Override
    public String render() {
      switch (codePoint) {
        case '\\':
        case '[':
        case ']':
        case '^':
        case '-':
        case '&':
          return "\\" + (char) codePoint;
        default:
          return Character.toString(codePoint);
      }
    }
  }

  record Builtin(BuiltinClass cls) implements ClassShape {
    @Override
    public String render() {
      return cls == BuiltinClass.DOT ? "." : "\\" + cls.escape;
    }
  }

  record Property(String name, boolean negated) implements ClassShape {
    @Override
    public String render() {
      return (negated ? "\\P{" : "\\p{") + name + "}";
    }
  }

  record Posix(String name, boolean negated) implements ClassShape {
    @Override
    public String render() {
      return (negated ? "[:^" : "[:") + name + ":]";
    }
  }

  record Bracket(String body) implements ClassShape {
    @Override
    public String render() {
      return body;
    }
  }

  @Override
  public ClassShape visitCharacter(int codePoint, int flags) {
    if ((flags & Pattern.CASE_INSENSITIVE) != 0) {
      caseInsensitive = true;
    }
    return new Single(codePoint);
  }

  @Override
  public ClassShape visitRange(int startCodePoint, int endCodePoint, int flags) {
    if ((flags & Pattern.CASE_INSENSITIVE) != 0) {
      caseInsensitive = true;
    }
    return new Bracket(new Single(startCodePoint).render() + "-" + new Single(endCodePoint).render());
  }

  @Override
  public ClassShape visitNegated(ClassShape negate) {
    return new Bracket("^" + negate.render());
  }

  @Override
  public ClassShape visitUnion(ClassShape lhs, ClassShape rhs) {
    return new Bracket(lhs.render() + rhs.render());
  }

  @Override
  public ClassShape visitIntersection(ClassShape lhs, ClassShape rhs) {
    return new Bracket(lhs.render() + "&&[" + rhs.render() + "]");
  }

  @Override
  public ClassShape visitBuiltinClass(BuiltinClass cls, int flags) {
    return new Builtin(cls);
  }

  @Override
  public ClassShape visitPropertyClass(String propertyName, boolean negated, int flags) {
    return new Property(propertyName, negated);
  }

  @Override
  public ClassShape visitPosixClass(String className, boolean negated, int flags) {
    return new Posix(className, negated);
  }

  @Override
  public RegexNode visitEpsilon() {
    return new Concatenation(List.of());
  }

  @Override
  public RegexNode visitCharacterClass(ClassShape characterClass) {
    if (characterClass instanceof Single single) {
      return new Literal(Character.toString(single.codePoint()));
    } else if (characterClass instanceof Builtin builtin) {
      if (builtin.cls() == BuiltinClass.DOT) {
        return new Wildcard();
      }
      return new MetaClass(String.valueOf(builtin.cls().escape), Quantifier.ONCE);
    } else if (characterClass instanceof Property property) {
      return new MetaClass(property.render().substring(1), Quantifier.ONCE);
    } else if (characterClass instanceof Posix posix) {
      return new PosixClass(posix.name(), posix.negated(), Quantifier.ONCE);
    } else {
      return new CharacterClass("[" + characterClass.render() + "]", Quantifier.ONCE);
    }
  }

  @Override
  public RegexNode visitConcatenation(RegexNode lhs, RegexNode rhs) {
    final var children = new ArrayList<RegexNode>();
    appendFlattened(children, lhs);
    appendFlattened(children, rhs);
    return children.size() == 1 ? children.get(0) : new Concatenation(children);
  }

  private static void appendFlattened(List<RegexNode> children, RegexNode node) {
    if (node instanceof Concatenation concatenation) {
      for (final RegexNode child : concatenation.children()) {
        appendFlattened(children, child);
      }
      return;
    }

    // Coalesce `a` `b` into `ab`, but never across a quantifier
    if (node instanceof Literal literal && literal.quantifier().isOnce() && !children.isEmpty()) {
      final int lastIdx = children.size() - 1;
      if (children.get(lastIdx) instanceof Literal last && last.quantifier().isOnce()) {
        children.set(lastIdx, new Literal(last.text() + literal.text()));
        return;
      }
    }
    children.add(node);
  }

  @Override
  public RegexNode visitAlternation(RegexNode lhs, RegexNode rhs) {
    final var branches = new ArrayList<RegexNode>();
    if (lhs instanceof Alternation alternation) {
      branches.addAll(alternation.branches());
    } else {
      branches.add(lhs);
    }
    branches.add(rhs);
    return new Alternation(branches);
  }

  @Override
  public RegexNode visitKleene(RegexNode lhs, boolean isLazy) {
    return quantify(lhs, Quantifier.atLeast(0));
  }

  @Override
  public RegexNode visitOptional(RegexNode lhs, boolean isLazy) {
    return quantify(lhs, Quantifier.between(0, 1));
  }

  @Override
  public RegexNode visitPlus(RegexNode lhs, boolean isLazy) {
    return quantify(lhs, Quantifier.atLeast(1));
  }

  @Override
  public RegexNode visitRepetition(RegexNode lhs, int atLeast, OptionalInt atMost, boolean isLazy) {
    return quantify(lhs, new Quantifier(atLeast, atMost));
  }

  /**
   * Attach a quantifier to the node it repeats.
   */
  private static RegexNode quantify(RegexNode node, Quantifier quantifier) {
    // `\Qab\E*` repeats only the last character
    if (node instanceof Literal literal && literal.quantifier().isOnce()) {
      final String text = literal.text();
      final int lastStart = text.offsetByCodePoints(text.length(), -1);
      if (lastStart > 0) {
        return new Concatenation(List.of(
          new Literal(text.substring(0, lastStart)),
          new Literal(text.substring(lastStart), quantifier)
        ));
      }
    }

    if (node instanceof Quantified quantified && quantified.quantifier().isOnce()) {
      return quantified.withQuantifier(quantifier);
    }
    return new Group(node, quantifier);
  }

  @Override
  public RegexNode visitGroup(
    RegexNode arg,
    GroupKind kind,
    OptionalInt groupIndex,
    Optional<String> name
  ) {
    return new Group(arg, kind, name, Quantifier.ONCE);
  }

  @Override
  public RegexNode visitBoundary(Boundary boundary) {
    return new Anchor(boundary);
  }

  @Override
  public RegexNode visitLookaround(RegexNode body, Boundary kind) {
    return new Anchor(kind);
  }

  @Override
  public RegexNode visitBackreference(String reference) {
    return new Backreference(reference, Quantifier.ONCE);
  }

  @Override
  public RegexNode visitSubexpressionCall(String reference) {
    return new SubexpressionCall(reference, Quantifier.ONCE);
  }
}
