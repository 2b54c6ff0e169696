package prefilter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FragmentFolderTest {

    @Test
    void mergesAcrossExactEdges() {
        assertEquals(Fragment.literal("abcd"),
            FragmentFolder.fold(List.of(Fragment.literal("ab"), Fragment.literal("cd"))));
    }

    @Test
    void breaksAcrossInexactEdges() {
        final Fragment folded = FragmentFolder.fold(List.of(
            Fragment.literal("ab"),
            Fragment.OPAQUE,
            Fragment.literal("cd")
        ));
        assertEquals(new Fragment(List.of("ab", "cd"), true, true), folded);
        assertFalse(folded.isPure());
    }

    @Test
    void zeroWidthFragmentsAreTransparent() {
        assertEquals(Fragment.literal("abcd"), FragmentFolder.fold(List.of(
            Fragment.TRANSPARENT,
            Fragment.literal("ab"),
            Fragment.TRANSPARENT,
            Fragment.literal("cd")
        )));
    }

    @Test
    void passesInteriorSubstringsThrough() {
        final Fragment middle = new Fragment(List.of("c", "d", "e"), true, true);
        assertEquals(new Fragment(List.of("abc", "d", "efg"), true, true), FragmentFolder.fold(List.of(
            Fragment.literal("ab"),
            middle,
            Fragment.literal("fg")
        )));
    }

    @Test
    void edgesDescribeTheOutermostSubstrings() {
        final Fragment openRight = new Fragment(List.of("cd"), true, false);
        assertEquals(new Fragment(List.of("abcd"), true, false),
            FragmentFolder.fold(List.of(Fragment.literal("ab"), openRight)));

        // Something unknown ahead of the first substring
        assertEquals(new Fragment(List.of("ab"), false, true),
            FragmentFolder.fold(List.of(Fragment.TRANSPARENT, Fragment.OPAQUE, Fragment.literal("ab"))));

        // Something unknown after the last substring
        assertEquals(new Fragment(List.of("ab"), true, false),
            FragmentFolder.fold(List.of(Fragment.literal("ab"), Fragment.OPAQUE, Fragment.TRANSPARENT)));
    }

    @Test
    void emptyInputIsTransparent() {
        assertEquals(Fragment.TRANSPARENT, FragmentFolder.fold(List.of()));
        assertEquals(Fragment.TRANSPARENT, FragmentFolder.fold(List.of(Fragment.TRANSPARENT, Fragment.TRANSPARENT)));
        assertEquals(Fragment.OPAQUE, FragmentFolder.fold(List.of(Fragment.TRANSPARENT, Fragment.OPAQUE)));
    }

    @Test
    void fragmentsRejectEmptySubstrings() {
        assertThrows(IllegalArgumentException.class, () -> new Fragment(List.of("a", ""), true, true));
    }
}
