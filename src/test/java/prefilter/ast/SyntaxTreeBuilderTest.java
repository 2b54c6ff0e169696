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
import prefilter.ast.RegexNode.SubexpressionCall;
import prefilter.ast.RegexNode.Wildcard;
import prefilter.parser.Boundary;
import prefilter.parser.GroupKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxTreeBuilderTest {

    private static RegexNode tree(String regex) {
        return SyntaxTreeBuilder.parse(regex, 0).tree();
    }

    @Test
    void coalescesAdjacentCharacters() {
        assertEquals(new Literal("abc"), tree("abc"));
    }

    @Test
    void quantifierBindsToTheLastCharacter() {
        assertEquals(new Concatenation(List.of(
            new Literal("ab"),
            new Literal("c", Quantifier.atLeast(0))
        )), tree("abc*"));
    }

    @Test
    void quantifiedLiteralSequenceRepeatsItsLastCharacter() {
        assertEquals(new Concatenation(List.of(
            new Literal("xab"),
            new Literal("c", Quantifier.between(0, 1))
        )), tree("x\\Qabc\\E?"));
    }

    @Test
    void requantifyingWrapsInAGroup() {
        assertEquals(
            new Group(new Literal("a", Quantifier.exactly(2)), Quantifier.exactly(3)),
            tree("a{2}{3}")
        );
    }

    @Test
    void flattensAlternationChains() {
        assertEquals(new Alternation(List.of(
            new Literal("ab"),
            new Literal("cd"),
            new Literal("ef")
        )), tree("ab|cd|ef"));
    }

    @Test
    void buildsGroupKinds() {
        assertEquals(new Group(new Literal("a"), GroupKind.CAPTURING, Optional.empty(), Quantifier.ONCE), tree("(a)"));
        assertEquals(new Group(new Literal("a"), GroupKind.NON_CAPTURING, Optional.empty(), Quantifier.ONCE), tree("(?:a)"));
        assertEquals(new Group(new Literal("a"), GroupKind.ATOMIC, Optional.empty(), Quantifier.ONCE), tree("(?>a)"));
        assertEquals(new Group(new Literal("a"), GroupKind.NAMED, Optional.of("n"), Quantifier.atLeast(1)), tree("(?<n>a)+"));
    }

    @Test
    void buildsClassNodes() {
        assertEquals(new Wildcard(), tree("."));
        assertEquals(new MetaClass("d", Quantifier.ONCE), tree("\\d"));
        assertEquals(new MetaClass("P{Alpha}", Quantifier.ONCE), tree("\\P{Alpha}"));
        assertEquals(new PosixClass("alpha", false, Quantifier.ONCE), tree("[[:alpha:]]"));
        assertEquals(new PosixClass("digit", true, Quantifier.ONCE), tree("[[:^digit:]]"));
        assertEquals(new CharacterClass("[a-z0-9]", Quantifier.atLeast(1)), tree("[a-z0-9]+"));
        assertEquals(new CharacterClass("[^a]", Quantifier.ONCE), tree("[^a]"));
    }

    @Test
    void singleCharacterClassIsALiteral() {
        assertEquals(new Literal("a.b"), tree("a[.]b"));
    }

    @Test
    void buildsZeroWidthNodes() {
        assertEquals(new Anchor(Boundary.BEGINNING_OF_LINE), tree("^"));
        assertEquals(new Anchor(Boundary.END_OF_INPUT), tree("\\z"));
        assertEquals(new Anchor(Boundary.NEGATIVE_LOOKBEHIND), tree("(?<!abc)"));
    }

    @Test
    void buildsReferences() {
        assertEquals(new Concatenation(List.of(
            new Group(new Literal("a"), GroupKind.CAPTURING, Optional.empty(), Quantifier.ONCE),
            new Backreference("1", Quantifier.ONCE),
            new SubexpressionCall("1", Quantifier.atLeast(0))
        )), tree("(a)\\1\\g<1>*"));
        assertEquals(new Backreference("name", Quantifier.ONCE), tree("\\k'name'"));
    }

    @Test
    void multiDigitBackreferencesNeedThatManyGroups() {
        // Only one group, so `\12` is `\1` followed by `2`
        assertEquals(new Concatenation(List.of(
            new Group(new Literal("a"), GroupKind.CAPTURING, Optional.empty(), Quantifier.ONCE),
            new Backreference("1", Quantifier.ONCE),
            new Literal("2")
        )), tree("(a)\\12"));
    }

    @Test
    void emptyPatternIsAnEmptyConcatenation() {
        assertEquals(new Concatenation(List.of()), tree(""));
        assertEquals(new Alternation(List.of(new Literal("a"), new Concatenation(List.of()))), tree("a|"));
    }

    @Test
    void tracksCaseInsensitivity() {
        assertFalse(SyntaxTreeBuilder.parse("abc", 0).caseInsensitive());
        assertTrue(SyntaxTreeBuilder.parse("abc", Pattern.CASE_INSENSITIVE).caseInsensitive());
        assertTrue(SyntaxTreeBuilder.parse("a(?i)b", 0).caseInsensitive());
        assertFalse(SyntaxTreeBuilder.parse("(?i-i:a)", 0).caseInsensitive());
        assertFalse(SyntaxTreeBuilder.parse("(?i)(?-i)a", 0).caseInsensitive());
        assertTrue(SyntaxTreeBuilder.parse("a(?-i)b", Pattern.CASE_INSENSITIVE).caseInsensitive());
        assertTrue(SyntaxTreeBuilder.parse("(?i)(?m)a", 0).caseInsensitive());
    }

    @Test
    void inlineFlagsEndWithTheirGroup() {
        assertFalse(SyntaxTreeBuilder.parse("((?i))a", 0).caseInsensitive());
    }
}
