package prefilter;

import prefilter.ast.Quantifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QuantifierRuleTest {

    private static final Fragment PURE = Fragment.literal("ab");
    private static final Fragment BROKEN = new Fragment(List.of("ab", "cd"), true, true);
    private static final Fragment OPEN_RIGHT = new Fragment(List.of("ab"), true, false);

    @Test
    void classifiesEveryRowOfTheTable() {
        assertEquals(QuantifierRule.OPTIONAL, QuantifierRule.classify(PURE, Quantifier.atLeast(0)));
        assertEquals(QuantifierRule.OPTIONAL, QuantifierRule.classify(PURE, Quantifier.exactly(0)));
        assertEquals(QuantifierRule.IDENTITY, QuantifierRule.classify(BROKEN, Quantifier.ONCE));
        assertEquals(QuantifierRule.FIXED_LITERAL, QuantifierRule.classify(PURE, Quantifier.exactly(3)));
        assertEquals(QuantifierRule.RANGED_LITERAL, QuantifierRule.classify(PURE, Quantifier.between(2, 5)));
        assertEquals(QuantifierRule.RANGED_LITERAL, QuantifierRule.classify(PURE, Quantifier.atLeast(1)));
        assertEquals(QuantifierRule.REPRESENTATIVE, QuantifierRule.classify(BROKEN, Quantifier.exactly(2)));
        assertEquals(QuantifierRule.REPRESENTATIVE, QuantifierRule.classify(OPEN_RIGHT, Quantifier.atLeast(1)));
    }

    @Test
    void optionalDropsEverything() {
        assertEquals(Fragment.OPAQUE, QuantifierRule.apply(PURE, Quantifier.between(0, 1)));
        assertEquals(Fragment.OPAQUE, QuantifierRule.apply(Fragment.TRANSPARENT, Quantifier.atLeast(0)));
    }

    @Test
    void onceKeepsBothEdges() {
        assertSame(BROKEN, QuantifierRule.apply(BROKEN, Quantifier.ONCE));
    }

    @Test
    void fixedLiteralRepeatsTheMinimum() {
        assertEquals(new Fragment(List.of("ababab"), true, true),
            QuantifierRule.apply(PURE, Quantifier.exactly(3)));
    }

    @Test
    void rangedLiteralOpensTheRightEdge() {
        assertEquals(new Fragment(List.of("abab"), true, false),
            QuantifierRule.apply(PURE, Quantifier.between(2, 3)));
        assertEquals(new Fragment(List.of("ab"), true, false),
            QuantifierRule.apply(PURE, Quantifier.atLeast(1)));
    }

    @Test
    void representativeKeepsOneCopyEvenForFixedCounts() {
        assertEquals(new Fragment(List.of("ab", "cd"), true, false),
            QuantifierRule.apply(BROKEN, Quantifier.exactly(4)));
        assertEquals(new Fragment(List.of(), false, false),
            QuantifierRule.apply(Fragment.OPAQUE, Quantifier.exactly(2)));
    }

    @Test
    void longRepetitionsKeepAPrefixOfWholeCopies() {
        final var capped = QuantifierRule.apply(Fragment.literal("abc"), Quantifier.exactly(1_000_000_000));
        final String literal = capped.substrings().get(0);
        assertEquals(QuantifierRule.MAX_LITERAL_LENGTH / 3 * 3, literal.length());
        assertTrue(literal.startsWith("abcabc"));
        assertTrue(literal.endsWith("abc"));
        assertTrue(capped.leftExact());
        assertFalse(capped.rightExact());
    }

    @Test
    void oversizedUnitIsKeptOnce() {
        final String unit = "x".repeat(QuantifierRule.MAX_LITERAL_LENGTH + 1);
        assertEquals(new Fragment(List.of(unit), true, false),
            QuantifierRule.apply(Fragment.literal(unit), Quantifier.exactly(2)));
    }

    @Test
    void repetitionsUpToTheLimitStayExact() {
        final var exact = QuantifierRule.apply(Fragment.literal("a"), Quantifier.exactly(QuantifierRule.MAX_LITERAL_LENGTH));
        assertEquals(QuantifierRule.MAX_LITERAL_LENGTH, exact.substrings().get(0).length());
        assertTrue(exact.rightExact());
    }
}
