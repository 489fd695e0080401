package org.fitch.support;

import org.fitch.checker.CheckError;
import org.fitch.checker.ProofResult;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ErrorReportTest {

    private static final List<CheckError> ERRORS = List.of(
            new CheckError(12, 10, "second"),
            CheckError.global("Missing premise: Q"),
            new CheckError(3, 2, "first"));

    @Test
    public void rendersPlainEntriesInNaturalOrder() {
        assertEquals("Line 2: first\n\nLine 10: second\n\nMissing premise: Q", ErrorReport.render(ERRORS, false));
    }

    @Test
    public void verboseEntriesNameTheTextLine() {
        assertEquals("Line 3: (Fitch line 2) first\n\nLine 12: (Fitch line 10) second\n\nMissing premise: Q",
                ErrorReport.render(ERRORS, true));
    }

    @Test
    public void unnumberedLineKeepsItsTextLine() {
        CheckError unnumbered = new CheckError(5, null, "Unnumbered line (text line 5): Line number is missing");

        assertFalse(unnumbered.isGlobal());
        assertEquals("Unnumbered line (text line 5): Line number is missing", ErrorReport.formatPlain(unnumbered));
        assertEquals("Line 5: Unnumbered line (text line 5): Line number is missing",
                ErrorReport.formatVerbose(unnumbered));
        assertEquals("Line 3: (Fitch line 2) first\n\nLine 5: Unnumbered line (text line 5): Line number is missing",
                ErrorReport.render(List.of(unnumbered, new CheckError(3, 2, "first")), true));
    }

    @Test
    public void globalErrorsHaveNoLine() {
        assertThrows(IllegalArgumentException.class, () -> new CheckError(0, 4, "no text line"));
        assertTrue(CheckError.global("Missing premise: Q").isGlobal());
    }

    @Test
    public void rendersCorrectAndFatalResults() {
        assertEquals("The proof is correct!", ErrorReport.render(ProofResult.correct(), false));
        assertEquals("Fatal error: The proof is empty", ErrorReport.render(ProofResult.fatal("The proof is empty"), true));
    }

    @Test
    public void rendersErrorResult() {
        ProofResult result = ProofResult.errors(List.of(new CheckError(2, 2, "oops")));
        assertEquals("Line 2: oops", ErrorReport.render(result, false));
    }
}
