package prefilter;

import prefilter.ast.Quantifier;
import prefilter.ast.RegexNode;
import prefilter.ast.RegexNode.Alternation;
import prefilter.ast.RegexNode.Anchor;
import prefilter.ast.RegexNode.Backreference;
import prefilter.ast.RegexNode.CharacterClass;
import prefilter.ast.RegexNode.Concatenation;
import prefilter.ast.RegexNode.Group;
import prefilter.ast.RegexNode.Literal;
import prefilter.ast.RegexNode.MetaClass;
import prefilter.ast.RegexNode.PosixClass;
import prefilter.ast.RegexNode.SubexpressionCall;
import prefilter.ast.RegexNode.Wildcard;
import prefilter.util.CartesianProduct;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Computes alternative fragments, one per way of choosing a branch in every
 * alternation, such that each match contains at least one of them.
 *
 * <p>Products of choices are bounded: when a node would expand to more than
 * {@code maxAlternatives} rows, it falls back to its single conjunctive
 * fragment, which is weaker but still holds for every match.
 */
final class DisjunctiveWalker implements RegexNode.Visitor<List<Fragment>> {

  private final ConjunctiveWalker conjunctive = new ConjunctiveWalker();
  private final int maxAlternatives;
  private final boolean printDebugInfo;

  DisjunctiveWalker(int maxAlternatives, boolean printDebugInfo) {
    this.maxAlternatives = maxAlternatives;
    this.printDebugInfo = printDebugInfo;
  }

  @Override
  public List<Fragment> visitLiteral(Literal literal) {
    return List.of(conjunctive.visitLiteral(literal));
  }

  @Override
  public List<Fragment> visitCharacterClass(CharacterClass characterClass) {
    return List.of(conjunctive.visitCharacterClass(characterClass));
  }

  @Override
  public List<Fragment> visitMetaClass(MetaClass metaClass) {
    return List.of(conjunctive.visitMetaClass(metaClass));
  }

  @Override
  public List<Fragment> visitPosixClass(PosixClass posixClass) {
    return List.of(conjunctive.visitPosixClass(posixClass));
  }

  @Override
  public List<Fragment> visitWildcard(Wildcard wildcard) {
    return List.of(conjunctive.visitWildcard(wildcard));
  }

  @Override
  public List<Fragment> visitAnchor(Anchor anchor) {
    return List.of(conjunctive.visitAnchor(anchor));
  }

  @Override
  public List<Fragment> visitBackreference(Backreference backreference) {
    return List.of(conjunctive.visitBackreference(backreference));
  }

  @Override
  public List<Fragment> visitSubexpressionCall(SubexpressionCall call) {
    return List.of(conjunctive.visitSubexpressionCall(call));
  }

  @Override
  public List<Fragment> visitGroup(Group group) {
    final Quantifier quantifier = group.quantifier();
    if (quantifier.isOptional()) {
      return List.of(Fragment.OPAQUE);
    }

    final List<Fragment> rows = group.child().accept(this);
    if (rows.size() == 1) {
      return List.of(QuantifierRule.apply(rows.get(0), quantifier));
    }

    // Every guaranteed iteration may pick a different branch
    final var iterations = CartesianProduct.power(rows, quantifier.min());
    final long size = iterations.size();
    if (size > maxAlternatives) {
      return fallBack(group, size);
    }
    return iterations
      .stream()
      .map(FragmentFolder::fold)
      .map(folded -> quantifier.isFixed()
        ? folded
        : new Fragment(folded.substrings(), folded.leftExact(), false))
      .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public List<Fragment> visitConcatenation(Concatenation concatenation) {
    final List<List<Fragment>> childRows = concatenation
      .children()
      .stream()
      .map(child -> child.accept(this))
      .collect(Collectors.toList());

    final var combinations = CartesianProduct.of(childRows);
    final long size = combinations.size();
    if (size > maxAlternatives) {
      return fallBack(concatenation, size);
    }
    return combinations
      .stream()
      .map(FragmentFolder::fold)
      .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public List<Fragment> visitAlternation(Alternation alternation) {
    final var rows = new ArrayList<Fragment>();
    for (final RegexNode branch : alternation.branches()) {
      rows.addAll(branch.accept(this));
      if (rows.size() > maxAlternatives) {
        return fallBack(alternation, rows.size());
      }
    }

    // A branch that guarantees nothing makes the whole alternation guarantee nothing
    if (rows.stream().anyMatch(Fragment::isEmpty)) {
      if (printDebugInfo) {
        System.err.println("[Disassembler] alternation with a branch lacking substrings is opaque");
      }
      return List.of(Fragment.OPAQUE);
    }
    return List.copyOf(rows);
  }

  private List<Fragment> fallBack(RegexNode node, long size) {
    if (printDebugInfo) {
      System.err.println(
        "[Disassembler] " + size + " alternatives exceed the limit of " + maxAlternatives +
        "; using the conjunctive fragment of " + node
      );
    }
    return List.of(node.accept(conjunctive));
  }
}
