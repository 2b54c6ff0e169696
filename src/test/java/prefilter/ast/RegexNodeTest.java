package prefilter.ast;

import prefilter.ast.RegexNode.Alternation;
import prefilter.ast.RegexNode.Concatenation;
import prefilter.ast.RegexNode.Group;
import prefilter.ast.RegexNode.Literal;
import prefilter.parser.GroupKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

public class RegexNodeTest {

    @Test
    void alternationNeedsABranch() {
        final var error = assertThrows(IllegalArgumentException.class, () -> new Alternation(List.of()));
        assertTrue(error.getMessage().contains("at least one branch"));
    }

    @Test
    void quantifierBoundsMustBeOrdered() {
        assertThrows(IllegalArgumentException.class, () -> Quantifier.between(3, 2));
        assertThrows(IllegalArgumentException.class, () -> new Quantifier(-1, OptionalInt.empty()));
        assertThrows(IllegalArgumentException.class, () -> new Quantifier(0, null));
    }

    @Test
    void literalsAreNeverEmpty() {
        assertThrows(IllegalArgumentException.class, () -> new Literal(""));
        assertThrows(NullPointerException.class, () -> new Literal(null));
    }

    @Test
    void containersRejectNullChildren() {
        assertThrows(NullPointerException.class, () -> new Concatenation(Arrays.asList(new Literal("a"), null)));
        assertThrows(NullPointerException.class, () -> new Group(null, Quantifier.ONCE));
    }

    @Test
    void onlyNamedGroupsHaveNames() {
        assertThrows(IllegalArgumentException.class,
            () -> new Group(new Literal("a"), GroupKind.CAPTURING, Optional.of("x"), Quantifier.ONCE));
        assertThrows(IllegalArgumentException.class,
            () -> new Group(new Literal("a"), GroupKind.NAMED, Optional.empty(), Quantifier.ONCE));
    }

    @Test
    void containersAreImmutable() {
        final var children = new ArrayList<RegexNode>(List.of(new Literal("a")));
        final var concatenation = new Concatenation(children);
        children.add(new Literal("b"));
        assertEquals(1, concatenation.children().size());
        assertThrows(UnsupportedOperationException.class, () -> concatenation.children().add(new Literal("c")));
    }

    @Test
    void quantifierPredicates() {
        assertTrue(Quantifier.ONCE.isOnce());
        assertTrue(Quantifier.exactly(0).isOptional());
        assertTrue(Quantifier.exactly(4).isFixed());
        assertFalse(Quantifier.atLeast(1).isFixed());
        assertEquals("{2,5}", Quantifier.between(2, 5).toString());
        assertEquals("{1,}", Quantifier.atLeast(1).toString());
    }
}
