package org.Aayush.citeproc.disambiguation;

import org.Aayush.citeproc.eval.DisambiguationHints;
import org.Aayush.citeproc.eval.NameHint;
import org.Aayush.citeproc.reference.Name;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Hint Table Tests")
class HintTableTest {
    private static final Name DOE = Name.of("Doe", "John");

    @Test
    @DisplayName("Et-al: counts only rise")
    void testEtAlCountsRise() {
        HintTable hints = new HintTable();
        assertTrue(hints.raiseEtAlNames("a", 2));
        assertFalse(hints.raiseEtAlNames("a", 2));
        assertFalse(hints.raiseEtAlNames("a", 1));
        assertTrue(hints.raiseEtAlNames("a", 3));
        assertEquals(3, hints.hintsFor("a").getEtAlNames());
    }

    @Test
    @DisplayName("Names: weaker hints never replace stronger ones")
    void testNameHintStrength() {
        HintTable hints = new HintTable();
        assertTrue(hints.upgradeNameHint("a", DOE, NameHint.ADD_INITIALS_IF_PRIMARY));
        assertTrue(hints.upgradeNameHint("a", DOE, NameHint.ADD_INITIALS));
        assertTrue(hints.upgradeNameHint("a", DOE, NameHint.ADD_GIVEN_NAME));
        assertFalse(hints.upgradeNameHint("a", DOE, NameHint.ADD_INITIALS));
        assertFalse(hints.upgradeNameHint("a", DOE, NameHint.ADD_GIVEN_NAME_IF_PRIMARY));
        assertEquals(NameHint.ADD_GIVEN_NAME, hints.hintsFor("a").nameHint(DOE));
        assertNull(hints.hintsFor("b").nameHint(DOE));
    }

    @Test
    @DisplayName("Flags: disambiguate is set once and never cleared")
    void testDisambiguateFlag() {
        HintTable hints = new HintTable();
        assertTrue(hints.markDisambiguate("a"));
        assertFalse(hints.markDisambiguate("a"));
        assertTrue(hints.hintsFor("a").isDisambiguate());
    }

    @Test
    @DisplayName("Snapshot: untouched references get the shared empty hints")
    void testEmptySnapshot() {
        assertSame(DisambiguationHints.NONE, new HintTable().hintsFor("a"));
    }

    @Test
    @DisplayName("Snapshot: bibliography keeps only the year suffix")
    void testBibliographySubset() {
        HintTable hints = new HintTable();
        hints.assignYearSuffix("a", 2);
        hints.raiseEtAlNames("a", 3);
        hints.upgradeNameHint("a", DOE, NameHint.ADD_GIVEN_NAME);

        DisambiguationHints bibliography = hints.hintsFor("a").forBibliography();
        assertEquals(2, bibliography.getYearSuffix());
        assertNull(bibliography.getEtAlNames());
        assertNull(bibliography.nameHint(DOE));
        assertSame(DisambiguationHints.NONE, new HintTable().hintsFor("b").forBibliography());
    }
}
