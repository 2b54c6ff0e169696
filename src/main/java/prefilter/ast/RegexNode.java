package prefilter.ast;

import prefilter.parser.Boundary;
import prefilter.parser.GroupKind;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable syntax tree of a parsed regular expression.
 *
 * <p>The set of node kinds is closed. Code that needs to handle every kind
 * implements {@link Visitor}, which the compiler then keeps exhaustive.
 */
public sealed interface RegexNode {

  <R> R accept(Visitor<R> visitor);

  /**
   * Nodes which carry their own repetition bounds.
   *
   * <p>Concatenations and alternations don't: to repeat one, it gets wrapped
   * in a group.
   */
  sealed interface Quantified extends RegexNode {

    Quantifier quantifier();

    /**
     * Copy of this node with different repetition bounds.
     */
    Quantified withQuantifier(Quantifier quantifier);
  }

  /**
   * One handler per node kind.
   *
   * @param <R> result of visiting a node
   */
  interface Visitor<R> {
    R visitLiteral(Literal literal);
    R visitCharacterClass(CharacterClass characterClass);
    R visitMetaClass(MetaClass metaClass);
    R visitPosixClass(PosixClass posixClass);
    R visitWildcard(Wildcard wildcard);
    R visitAnchor(Anchor anchor);
    R visitBackreference(Backreference backreference);
    R visitSubexpressionCall(SubexpressionCall call);
    R visitGroup(Group group);
    R visitConcatenation(Concatenation concatenation);
    R visitAlternation(Alternation alternation);
  }

  /**
   * An exact run of characters.
   */
  record Literal(String text, Quantifier quantifier) implements Quantified {
    public Literal {
      Objects.requireNonNull(text, "text");
      Objects.requireNonNull(quantifier, "quantifier");
      if (text.isEmpty()) {
        throw new IllegalArgumentException("Literal text must not be empty");
      }
    }

    public Literal(String text) {
      this(text, Quantifier.ONCE);
    }

    @Override
    public Literal withQuantifier(Quantifier quantifier) {
      return new Literal(text, quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  /**
   * Bracket expression such as {@code [a-z]}, matching one character.
   *
   * @param description rendering of the class, for diagnostics only
   */
  record CharacterClass(String description, Quantifier quantifier) implements Quantified {
    public CharacterClass {
      Objects.requireNonNull(description, "description");
      Objects.requireNonNull(quantifier, "quantifier");
    }

    @Override
    public CharacterClass withQuantifier(Quantifier quantifier) {
      return new CharacterClass(description, quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCharacterClass(this);
    }
  }

  /**
   * Escaped class such as {@code \d} or {@code \p{Alpha}}.
   *
   * @param escape text following the backslash
   */
  record MetaClass(String escape, Quantifier quantifier) implements Quantified {
    public MetaClass {
      Objects.requireNonNull(escape, "escape");
      Objects.requireNonNull(quantifier, "quantifier");
    }

    @Override
    public MetaClass withQuantifier(Quantifier quantifier) {
      return new MetaClass(escape, quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMetaClass(this);
    }
  }

  /**
   * POSIX bracket expression such as {@code [[:alpha:]]}.
   */
  record PosixClass(String name, boolean negated, Quantifier quantifier) implements Quantified {
    public PosixClass {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(quantifier, "quantifier");
    }

    @Override
    public PosixClass withQuantifier(Quantifier quantifier) {
      return new PosixClass(name, negated, quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPosixClass(this);
    }
  }

  /**
   * The {@code .} class.
   */
  record Wildcard(Quantifier quantifier) implements Quantified {
    public Wildcard {
      Objects.requireNonNull(quantifier, "quantifier");
    }

    public Wildcard() {
      this(Quantifier.ONCE);
    }

    @Override
    public Wildcard withQuantifier(Quantifier quantifier) {
      return new Wildcard(quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWildcard(this);
    }
  }

  /**
   * Zero-width assertion: line and input anchors, word boundaries, lookaround.
   */
  record Anchor(Boundary boundary, Quantifier quantifier) implements Quantified {
    public Anchor {
      Objects.requireNonNull(boundary, "boundary");
      Objects.requireNonNull(quantifier, "quantifier");
    }

    public Anchor(Boundary boundary) {
      this(boundary, Quantifier.ONCE);
    }

    @Override
    public Anchor withQuantifier(Quantifier quantifier) {
      return new Anchor(boundary, quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAnchor(this);
    }
  }

  /**
   * Whatever an earlier group captured.
   *
   * @param reference group number or name
   */
  record Backreference(String reference, Quantifier quantifier) implements Quantified {
    public Backreference {
      Objects.requireNonNull(reference, "reference");
      Objects.requireNonNull(quantifier, "quantifier");
    }

    @Override
    public Backreference withQuantifier(Quantifier quantifier) {
      return new Backreference(reference, quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBackreference(this);
    }
  }

  /**
   * Re-invocation of a group's pattern, possibly recursive.
   *
   * @param reference group number or name
   */
  record SubexpressionCall(String reference, Quantifier quantifier) implements Quantified {
    public SubexpressionCall {
      Objects.requireNonNull(reference, "reference");
      Objects.requireNonNull(quantifier, "quantifier");
    }

    @Override
    public SubexpressionCall withQuantifier(Quantifier quantifier) {
      return new SubexpressionCall(reference, quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSubexpressionCall(this);
    }
  }

  /**
   * Parenthesized node.
   *
   * @param name set only for {@link GroupKind#NAMED} groups
   */
  record Group(
    RegexNode child,
    GroupKind kind,
    Optional<String> name,
    Quantifier quantifier
  ) implements Quantified {
    public Group {
      Objects.requireNonNull(child, "child");
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(quantifier, "quantifier");
      if (name.isPresent() != (kind == GroupKind.NAMED)) {
        throw new IllegalArgumentException("Only named groups have a name (kind " + kind + ")");
      }
    }

    public Group(RegexNode child, Quantifier quantifier) {
      this(child, GroupKind.NON_CAPTURING, Optional.empty(), quantifier);
    }

    @Override
    public Group withQuantifier(Quantifier quantifier) {
      return new Group(child, kind, name, quantifier);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGroup(this);
    }
  }

  /**
   * Sequential composition. An empty concatenation matches the empty string.
   */
  record Concatenation(List<RegexNode> children) implements RegexNode {
    public Concatenation {
      children = List.copyOf(children);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConcatenation(this);
    }
  }

  /**
   * Exactly one of the branches matches.
   */
  record Alternation(List<RegexNode> branches) implements RegexNode {
    public Alternation {
      branches = List.copyOf(branches);
      if (branches.isEmpty()) {
        throw new IllegalArgumentException("Alternation must have at least one branch");
      }
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAlternation(this);
    }
  }
}
