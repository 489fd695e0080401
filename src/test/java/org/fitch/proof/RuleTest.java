package org.fitch.proof;

import org.junit.Test;

import static org.junit.Assert.*;

public class RuleTest {

    @Test
    public void acceptsSymbolAndWordSpellings() {
        assertEquals(Rule.AND_INTRO, Rule.lookup("∧ Intro"));
        assertEquals(Rule.AND_INTRO, Rule.lookup("and intro"));
        assertEquals(Rule.AND_INTRO, Rule.lookup("&I"));
        assertEquals(Rule.OR_ELIM, Rule.lookup("∨E"));
        assertEquals(Rule.IMPLIES_ELIM, Rule.lookup("->Elim"));
        assertEquals(Rule.IFF_INTRO, Rule.lookup("<-> Introduction"));
        assertEquals(Rule.NOT_ELIM, Rule.lookup("~E"));
        assertEquals(Rule.BOTTOM_ELIM, Rule.lookup("⊥ Elim"));
        assertEquals(Rule.FORALL_INTRO, Rule.lookup("∀ I"));
        assertEquals(Rule.EXISTS_ELIM, Rule.lookup("exists elim"));
    }

    @Test
    public void doubleNegationAndReiteration() {
        assertEquals(Rule.DOUBLE_NOT_ELIM, Rule.lookup("¬¬ Elim"));
        assertEquals(Rule.DOUBLE_NOT_ELIM, Rule.lookup("DNE"));
        assertEquals(Rule.REIT, Rule.lookup("Reit"));
        assertEquals(Rule.REIT, Rule.lookup("reiteration"));
    }

    @Test
    public void ignoresCaseAndWhitespace() {
        assertEquals(Rule.IMPLIES_INTRO, Rule.lookup("  IMPLIES   INTRO "));
    }

    @Test
    public void unknownNamesAreNull() {
        assertNull(Rule.lookup("Modus Ponens"));
        assertNull(Rule.lookup(null));
    }

    @Test
    public void displayNamesCoverEveryRule() {
        assertEquals(Rule.values().length, Rule.displayNames().size());
        assertEquals("¬¬ Elim", Rule.DOUBLE_NOT_ELIM.toString());
    }
}
