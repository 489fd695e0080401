package org.fitch.checker;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ProofResultTest {

    @Test
    public void emptyErrorListIsCorrect() {
        assertTrue(ProofResult.fromErrors(List.of()).isCorrect());
        assertEquals(ProofResult.Outcome.ERROR,
                ProofResult.fromErrors(List.of(CheckError.global("x"))).getOutcome());
    }

    @Test
    public void errorResultNeedsErrors() {
        assertThrows(IllegalArgumentException.class, () -> ProofResult.errors(List.of()));
    }

    @Test
    public void fatalCarriesItsMessage() {
        ProofResult fatal = ProofResult.fatal("broken");
        assertTrue(fatal.isFatal());
        assertFalse(fatal.isCorrect());
        assertEquals("broken", fatal.getFatalMessage());
        assertTrue(fatal.getErrors().isEmpty());
        assertThrows(IllegalStateException.class, () -> ProofResult.correct().getFatalMessage());
    }

    @Test
    public void resultsCompareByValue() {
        assertEquals(ProofResult.errors(List.of(new CheckError(2, 2, "a"))),
                ProofResult.errors(List.of(new CheckError(2, 2, "a"))));
        assertNotEquals(ProofResult.fatal("a"), ProofResult.fatal("b"));
    }
}
