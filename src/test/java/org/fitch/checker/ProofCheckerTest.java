package org.fitch.checker;

import org.fitch.proof.ProofLine;
import org.junit.Test;

import java.util.List;

import static org.fitch.checker.CheckerTestSupport.*;
import static org.junit.Assert.*;

public class ProofCheckerTest {

    //region VISIBILITÀ DELLE CITAZIONI

    @Test
    public void rejectsCitationOfLineInsideClosedSubproof() {
        assertErrorOnLine(5, "Line 2 is inside a closed subproof and cannot be cited here",
                "1 | P        [Premise]",
                "2 | | Q      [Assumption]",
                "3 | | Q      [Reit: 2]",
                "4 | Q → Q    [→ Intro: 2-3]",
                "5 | Q        [Reit: 2]");
    }

    @Test
    public void rejectsCitationOfSiblingSubproofLine() {
        assertErrorOnLine(4, "Line 2 is inside a closed subproof",
                "1 | P ∨ Q    [Premise]",
                "2 | | P      [Assumption]",
                "3 | | Q      [Assumption]",
                "4 | | P      [Reit: 2]",
                "5 | Q → P    [→ Intro: 3-4]");
    }

    @Test
    public void linesOfEnclosingSubproofsStayVisible() {
        assertCorrect(
                "1 | P            [Premise]",
                "2 | | Q          [Assumption]",
                "3 | | | R        [Assumption]",
                "4 | | | Q        [Reit: 2]",
                "5 | | | P        [Reit: 1]",
                "6 | | R → P      [→ Intro: 3-5]",
                "7 | Q → R → P    [→ Intro: 2-6]");
    }

    @Test
    public void rejectsCitationOfLaterLine() {
        assertErrorOnLine(2, "Line 3 comes after this line and cannot be cited",
                "1 | P    [Premise]",
                "2 | P    [Reit: 3]",
                "3 | P    [Reit: 1]");
    }

    @Test
    public void rejectsSelfCitation() {
        assertErrorOnLine(2, "A line cannot cite itself",
                "1 | P    [Premise]",
                "2 | P    [Reit: 2]");
    }

    @Test
    public void rejectsCitationOfMissingLine() {
        assertErrorOnLine(2, "Line 9 does not exist",
                "1 | P    [Premise]",
                "2 | P    [Reit: 9]");
    }

    @Test
    public void rejectsRangeThatIsNotASubproof() {
        assertErrorOnLine(3, "Lines 1-2 do not form a subproof",
                "1 | P        [Premise]",
                "2 | Q        [Premise]",
                "3 | P → Q    [→ Intro: 1-2]");
    }

    @Test
    public void rejectsRangeEndingBeforeSubproofEnds() {
        assertErrorOnLine(5, "Lines 2-3 do not form a subproof",
                "1 | Q          [Premise]",
                "2 | | P        [Assumption]",
                "3 | | Q        [Reit: 1]",
                "4 | | Q        [Reit: 3]",
                "5 | P → Q      [→ Intro: 2-3]");
    }

    @Test
    public void rejectsCitationOfSubproofNestedInClosedSubproof() {
        assertErrorOnLine(6, "The subproof 3-3 is inside a closed subproof",
                "1 | Q            [Premise]",
                "2 | | P          [Assumption]",
                "3 | | | R        [Assumption]",
                "4 | | R → R      [→ Intro: 3-3]",
                "5 | P → R → R    [→ Intro: 2-4]",
                "6 | R → R        [→ Intro: 3-3]");
    }

    @Test
    public void rejectsRangeEndingInsideUndischargedNestedSubproof() {
        assertErrorOnLine(4, "Lines 1-3 do not form a subproof",
                "1 | | P          [Assumption]",
                "2 | | | ¬P       [Assumption]",
                "3 | | | ⊥        [⊥ Intro: 1, 2]",
                "4 | ¬P           [¬ Intro: 1-3]");
    }

    @Test
    public void nestedAssumptionCannotBeDischargedThroughOuterSubproof() {
        List<CheckError> errors = check(
                "1 | P            [Premise]",
                "2 | | Q          [Assumption]",
                "3 | | | R        [Assumption]",
                "4 | | | R        [Reit: 3]",
                "5 | Q → R        [→ Intro: 2-4]");

        assertEquals(1, errors.size());
        assertEquals(Integer.valueOf(5), errors.get(0).getFitchLine());
        assertTrue(errors.get(0).getText().contains("Lines 2-4 do not form a subproof"));
    }

    @Test
    public void subproofEndingAfterClosedNestedSubproofIsCitable() {
        assertCorrect(
                "1 | P            [Premise]",
                "2 | | Q          [Assumption]",
                "3 | | | R        [Assumption]",
                "4 | | | R        [Reit: 3]",
                "5 | | R → R      [→ Intro: 3-4]",
                "6 | Q → R → R    [→ Intro: 2-5]");
    }

    //endregion

    //region NUMERAZIONE

    @Test
    public void reportsNumberNotMatchingPosition() {
        List<CheckError> errors = check(
                "1 | P    [Premise]",
                "3 | P    [Reit: 1]");
        assertEquals(1, errors.size());
        assertEquals(Integer.valueOf(3), errors.get(0).getFitchLine());
        assertEquals("The stated line number 3 does not match its position in the proof (expected 2)",
                errors.get(0).getText());
    }

    @Test
    public void reportsMissingNumberWithTextLine() {
        List<CheckError> errors = check(
                "1 | P    [Premise]",
                "  | P    [Reit: 1]");
        assertEquals(1, errors.size());
        assertNull(errors.get(0).getFitchLine());
        assertFalse(errors.get(0).isGlobal());
        assertEquals(2, errors.get(0).getRealLine());
        assertEquals("Unnumbered line (text line 2): Line number is missing (expected 2)", errors.get(0).getText());
    }

    @Test
    public void reportsDuplicateNumbersOnce() {
        assertGlobalError("Line number 1 is used 2 times",
                "1 | P    [Premise]",
                "1 | P    [Reit: 1]");
        long duplicates = check(
                "1 | P    [Premise]",
                "1 | P    [Reit: 1]",
                "1 | P    [Reit: 1]").stream().filter(e -> e.getText().contains("is used")).count();
        assertEquals(1, duplicates);
    }

    @Test
    public void duplicateNumberCitesTheLastEarlierLine() {
        List<CheckError> errors = check(
                "1 | P      [Premise]",
                "2 | Q      [Premise]",
                "2 | P ∧ Q  [∧ Intro: 1, 2]",
                "4 | Q      [∧ Elim: 2]");
        for (CheckError error : errors) {
            assertFalse(error.toString(), error.getText().contains("∧ Elim"));
        }
    }

    //endregion

    //region PREMESSE, ASSUNZIONI E STRUTTURA

    @Test
    public void premiseMustPrecedeOtherLines() {
        assertErrorOnLine(3, "Premises must come before all other lines",
                "1 | P        [Premise]",
                "2 | P        [Reit: 1]",
                "3 | Q        [Premise]");
    }

    @Test
    public void premiseCannotBeInsideSubproof() {
        assertErrorOnLine(3, "A premise cannot be inside a subproof",
                "1 | P        [Premise]",
                "2 | | Q      [Assumption]",
                "3 | | R      [Premise]",
                "4 | Q → R    [→ Intro: 2-3]");
    }

    @Test
    public void premiseAndAssumptionDoNotCite() {
        assertErrorOnLine(2, "A premise does not cite other lines",
                "1 | P    [Premise]",
                "2 | Q    [Premise: 1]");
        assertErrorOnLine(2, "An assumption does not cite other lines",
                "1 | P        [Premise]",
                "2 | | Q      [Assumption: 1]",
                "3 | Q → Q    [→ Intro: 2-2]");
    }

    @Test
    public void assumptionMustOpenSubproof() {
        assertErrorOnLine(1, "An assumption must open a new subproof",
                "1 | P    [Assumption]");
    }

    @Test
    public void subproofMustStartWithAssumption() {
        assertErrorOnLine(2, "A subproof must start with an assumption",
                "1 | P ∧ Q    [Premise]",
                "2 | | P      [∧ Elim: 1]",
                "3 | P        [∧ Elim: 1]");
    }

    @Test
    public void proofMustNotEndInsideSubproof() {
        assertGlobalError("The proof ends inside a subproof",
                "1 | P        [Premise]",
                "2 | | Q      [Assumption]");
    }

    @Test
    public void unknownRuleIsReportedOnItsLine() {
        assertErrorOnLine(2, "Unknown rule 'Modus Ponens'",
                "1 | P    [Premise]",
                "2 | P    [Modus Ponens: 1]");
    }

    @Test
    public void wholeSubproofCannotBeCitedFromInside() {
        List<CheckError> errors = check(
                "1 | | P      [Assumption]",
                "2 | | P      [Reit: 1]",
                "3 | | P → P  [→ Intro: 1-2]",
                "4 | P → P    [→ Intro: 1-3]");
        assertTrue(errors.toString(), errors.stream().anyMatch(e -> e.getText().contains("1-2")));
    }

    //endregion

    //region PROPRIETÀ GENERALI

    @Test
    public void collectsEveryIndependentDefect() {
        List<CheckError> errors = check(
                "1 | P        [Premise]",
                "2 | Q        [Reit: 1]",
                "3 | R        [∧ Elim: 1]",
                "4 | P        [Reit: 7]");
        assertEquals(3, errors.size());
    }

    @Test
    public void checkingIsIdempotent() {
        List<ProofLine> lines = parse(
                "1 | P        [Premise]",
                "2 | Q        [Reit: 1]",
                "3 | | R      [Assumption]");
        assertEquals(ProofChecker.check(lines), ProofChecker.check(lines));
    }

    @Test
    public void emptyLineListIsAGlobalError() {
        List<CheckError> errors = ProofChecker.check(List.of());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).isGlobal());
    }

    //endregion
}
