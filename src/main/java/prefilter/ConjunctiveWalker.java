package prefilter;

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
import java.util.stream.Collectors;

/**
 * Computes the single fragment every match must contain, treating each
 * alternation as an opaque unit.
 */
final class ConjunctiveWalker implements RegexNode.Visitor<Fragment> {

  @Override
  public Fragment visitLiteral(Literal literal) {
    return QuantifierRule.apply(Fragment.literal(literal.text()), literal.quantifier());
  }

  @Override
  public Fragment visitCharacterClass(CharacterClass characterClass) {
    return QuantifierRule.apply(Fragment.OPAQUE, characterClass.quantifier());
  }

  @Override
  public Fragment visitMetaClass(MetaClass metaClass) {
    return QuantifierRule.apply(Fragment.OPAQUE, metaClass.quantifier());
  }

  @Override
  public Fragment visitPosixClass(PosixClass posixClass) {
    return QuantifierRule.apply(Fragment.OPAQUE, posixClass.quantifier());
  }

  @Override
  public Fragment visitWildcard(Wildcard wildcard) {
    return QuantifierRule.apply(Fragment.OPAQUE, wildcard.quantifier());
  }

  @Override
  public Fragment visitAnchor(Anchor anchor) {
    return QuantifierRule.apply(Fragment.TRANSPARENT, anchor.quantifier());
  }

  @Override
  public Fragment visitBackreference(Backreference backreference) {
    return QuantifierRule.apply(Fragment.OPAQUE, backreference.quantifier());
  }

  @Override
  public Fragment visitSubexpressionCall(SubexpressionCall call) {
    return QuantifierRule.apply(Fragment.OPAQUE, call.quantifier());
  }

  @Override
  public Fragment visitGroup(Group group) {
    return QuantifierRule.apply(group.child().accept(this), group.quantifier());
  }

  @Override
  public Fragment visitConcatenation(Concatenation concatenation) {
    return FragmentFolder.fold(
      concatenation
        .children()
        .stream()
        .map(child -> child.accept(this))
        .collect(Collectors.toList())
    );
  }

  @Override
  public Fragment visitAlternation(Alternation alternation) {
    return Fragment.OPAQUE;
  }
}
