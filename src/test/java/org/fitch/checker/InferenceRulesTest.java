package org.fitch.checker;

import org.junit.Test;

import static org.fitch.checker.CheckerTestSupport.*;

public class InferenceRulesTest {

    //region REIT E CONGIUNZIONE

    @Test
    public void reitCopiesACitedLine() {
        assertCorrect(
                "1 | P    [Premise]",
                "2 | P    [Reit: 1]");
    }

    @Test
    public void reitRejectsADifferentFormula() {
        assertErrorOnLine(2, "The reiterated formula Q does not match the formula of line 1 (P)",
                "1 | P    [Premise]",
                "2 | Q    [Reit: 1]");
    }

    @Test
    public void andIntroAcceptsConjunctsInEitherOrder() {
        assertCorrect(
                "1 | P      [Premise]",
                "2 | Q      [Premise]",
                "3 | Q ∧ P  [∧ Intro: 1, 2]");
    }

    @Test
    public void andIntroWithOneLineNeedsEqualConjuncts() {
        assertCorrect(
                "1 | P      [Premise]",
                "2 | P ∧ P  [∧ Intro: 1]");
        assertErrorOnLine(2, "single cited line",
                "1 | P      [Premise]",
                "2 | P ∧ Q  [∧ Intro: 1]");
    }

    @Test
    public void andIntroRejectsWrongConjuncts() {
        assertErrorOnLine(3, "do not match the cited formulas",
                "1 | P      [Premise]",
                "2 | Q      [Premise]",
                "3 | P ∧ R  [∧ Intro: 1, 2]");
    }

    @Test
    public void andIntroWithoutCitations() {
        assertErrorOnLine(3, "expects one or two lines, but cites nothing",
                "1 | P      [Premise]",
                "2 | Q      [Premise]",
                "3 | P ∧ Q  [∧ Intro]");
    }

    @Test
    public void andElimTakesEitherConjunct() {
        assertCorrect(
                "1 | P ∧ Q  [Premise]",
                "2 | P      [∧ Elim: 1]",
                "3 | Q      [∧ Elim: 1]");
    }

    @Test
    public void andElimRejectsAFormulaThatIsNotAConjunct() {
        assertErrorOnLine(2, "R is not a conjunct of P ∧ Q",
                "1 | P ∧ Q  [Premise]",
                "2 | R      [∧ Elim: 1]");
    }

    @Test
    public void andElimNeedsAConjunction() {
        assertErrorOnLine(2, "needs a conjunction",
                "1 | P ∨ Q  [Premise]",
                "2 | P      [∧ Elim: 1]");
    }

    //endregion

    //region DISGIUNZIONE

    @Test
    public void orIntroAddsEitherDisjunct() {
        assertCorrect(
                "1 | P      [Premise]",
                "2 | P ∨ Q  [∨ Intro: 1]",
                "3 | Q ∨ P  [∨ Intro: 1]");
    }

    @Test
    public void orIntroRejectsUnrelatedDisjunction() {
        assertErrorOnLine(2, "Neither disjunct",
                "1 | P      [Premise]",
                "2 | Q ∨ R  [∨ Intro: 1]");
    }

    @Test
    public void orElimWithTwoSiblingSubproofs() {
        assertCorrect(
                "1 | P ∨ Q      [Premise]",
                "2 | | P        [Assumption]",
                "3 | | Q ∨ P    [∨ Intro: 2]",
                "4 | | Q        [Assumption]",
                "5 | | Q ∨ P    [∨ Intro: 4]",
                "6 | Q ∨ P      [∨ Elim: 1, 4-5, 2-3]");
    }

    @Test
    public void orElimRejectsSubproofWithDifferentConclusion() {
        assertErrorOnLine(6, "ends with P, not with Q ∨ P",
                "1 | P ∨ Q      [Premise]",
                "2 | | P        [Assumption]",
                "3 | | P        [Reit: 2]",
                "4 | | Q        [Assumption]",
                "5 | | Q ∨ P    [∨ Intro: 4]",
                "6 | Q ∨ P      [∨ Elim: 1, 2-3, 4-5]");
    }

    @Test
    public void orElimRejectsWrongAssumptions() {
        assertErrorOnLine(6, "must assume P and Q",
                "1 | P ∨ Q      [Premise]",
                "2 | | P        [Assumption]",
                "3 | | P ∨ R    [∨ Intro: 2]",
                "4 | | R        [Assumption]",
                "5 | | P ∨ R    [∨ Intro: 4]",
                "6 | P ∨ R      [∨ Elim: 1, 2-3, 4-5]");
    }

    @Test
    public void orElimNeedsOneLineAndTwoSubproofs() {
        assertErrorOnLine(4, "expects one line and two subproofs",
                "1 | P ∨ Q      [Premise]",
                "2 | | P        [Assumption]",
                "3 | | P        [Reit: 2]",
                "4 | P          [∨ Elim: 1, 2-3]");
    }

    //endregion

    //region IMPLICAZIONE E BICONDIZIONALE

    @Test
    public void impliesIntroDischargesTheAssumption() {
        assertCorrect(
                "1 | Q        [Premise]",
                "2 | | P      [Assumption]",
                "3 | | Q      [Reit: 1]",
                "4 | P → Q    [→ Intro: 2-3]");
    }

    @Test
    public void impliesIntroRejectsWrongConsequent() {
        assertErrorOnLine(4, "The consequent of P → R does not match the last line",
                "1 | Q        [Premise]",
                "2 | | P      [Assumption]",
                "3 | | Q      [Reit: 1]",
                "4 | P → R    [→ Intro: 2-3]");
    }

    @Test
    public void impliesIntroRejectsWrongAntecedent() {
        assertErrorOnLine(4, "The antecedent of R → Q",
                "1 | Q        [Premise]",
                "2 | | P      [Assumption]",
                "3 | | Q      [Reit: 1]",
                "4 | R → Q    [→ Intro: 2-3]");
    }

    @Test
    public void impliesIntroWithOneLineSubproof() {
        assertCorrect(
                "1 | | P      [Assumption]",
                "2 | P → P    [→ Intro: 1-1]");
    }

    @Test
    public void impliesIntroNeedsASubproof() {
        assertErrorOnLine(2, "needs a subproof, but line 1 was cited",
                "1 | Q        [Premise]",
                "2 | P → Q    [→ Intro: 1]");
    }

    @Test
    public void impliesElimInEitherCitationOrder() {
        assertCorrect(
                "1 | P → Q    [Premise]",
                "2 | P        [Premise]",
                "3 | Q        [→ Elim: 2, 1]",
                "4 | Q        [→ Elim: 1, 2]");
    }

    @Test
    public void impliesElimRejectsWrongConclusion() {
        assertErrorOnLine(3, "R is not the consequent of P → Q",
                "1 | P → Q    [Premise]",
                "2 | P        [Premise]",
                "3 | R        [→ Elim: 1, 2]");
    }

    @Test
    public void impliesElimNeedsTheAntecedent() {
        assertErrorOnLine(3, "needs an implication and its antecedent",
                "1 | P → Q    [Premise]",
                "2 | Q        [Premise]",
                "3 | P        [→ Elim: 1, 2]");
    }

    @Test
    public void iffIntroWithTwoSubproofs() {
        assertCorrect(
                "1 | P → Q      [Premise]",
                "2 | Q → P      [Premise]",
                "3 | | P        [Assumption]",
                "4 | | Q        [→ Elim: 1, 3]",
                "5 | | Q        [Assumption]",
                "6 | | P        [→ Elim: 2, 5]",
                "7 | P ↔ Q      [↔ Intro: 3-4, 5-6]",
                "8 | Q ↔ P      [↔ Intro: 3-4, 5-6]");
    }

    @Test
    public void iffIntroRejectsMismatchedSubproofs() {
        assertErrorOnLine(7, "↔ Intro for P ↔ R",
                "1 | P → Q      [Premise]",
                "2 | Q → P      [Premise]",
                "3 | | P        [Assumption]",
                "4 | | Q        [→ Elim: 1, 3]",
                "5 | | Q        [Assumption]",
                "6 | | P        [→ Elim: 2, 5]",
                "7 | P ↔ R      [↔ Intro: 3-4, 5-6]");
    }

    @Test
    public void iffElimInBothDirections() {
        assertCorrect(
                "1 | P ↔ Q    [Premise]",
                "2 | Q        [Premise]",
                "3 | P        [↔ Elim: 1, 2]",
                "4 | Q        [↔ Elim: 3, 1]");
    }

    @Test
    public void iffElimRejectsWrongSide() {
        assertErrorOnLine(3, "does not follow by ↔ Elim",
                "1 | P ↔ Q    [Premise]",
                "2 | Q        [Premise]",
                "3 | Q        [↔ Elim: 1, 2]");
    }

    //endregion

    //region NEGAZIONE E CONTRADDIZIONE

    @Test
    public void notIntroFromContradiction() {
        assertCorrect(
                "1 | P → Q      [Premise]",
                "2 | ¬Q         [Premise]",
                "3 | | P        [Assumption]",
                "4 | | Q        [→ Elim: 1, 3]",
                "5 | | ⊥        [¬ Elim: 4, 2]",
                "6 | ¬P         [¬ Intro: 3-5]");
    }

    @Test
    public void notIntroNeedsSubproofEndingInBottom() {
        assertErrorOnLine(4, "must end with ⊥",
                "1 | Q          [Premise]",
                "2 | | P        [Assumption]",
                "3 | | Q        [Reit: 1]",
                "4 | ¬P         [¬ Intro: 2-3]");
    }

    @Test
    public void bottomIntroAndNotElimShareTheirShape() {
        assertCorrect(
                "1 | P          [Premise]",
                "2 | ¬P         [Premise]",
                "3 | ⊥          [⊥ Intro: 1, 2]",
                "4 | ⊥          [¬ Elim: 2, 1]");
    }

    @Test
    public void contradictionMustConcludeBottom() {
        assertErrorOnLine(3, "must conclude ⊥",
                "1 | P          [Premise]",
                "2 | ¬P         [Premise]",
                "3 | Q          [¬ Elim: 1, 2]");
    }

    @Test
    public void contradictionNeedsComplementaryFormulas() {
        assertErrorOnLine(3, "are not of the form A and ¬A",
                "1 | P          [Premise]",
                "2 | ¬Q         [Premise]",
                "3 | ⊥          [⊥ Intro: 1, 2]");
    }

    @Test
    public void doubleNegationElim() {
        assertCorrect(
                "1 | ¬¬P        [Premise]",
                "2 | P          [¬¬ Elim: 1]");
        assertErrorOnLine(2, "does not give ¬P",
                "1 | ¬¬P        [Premise]",
                "2 | ¬P         [¬¬ Elim: 1]");
    }

    @Test
    public void bottomElimConcludesAnything() {
        assertCorrect(
                "1 | ⊥          [Premise]",
                "2 | Q ∧ ¬Q     [⊥ Elim: 1]");
        assertErrorOnLine(2, "⊥ Elim needs ⊥",
                "1 | P          [Premise]",
                "2 | Q          [⊥ Elim: 1]");
    }

    //endregion

    //region QUANTIFICATORI

    @Test
    public void forAllElimInstantiates() {
        assertCorrect(
                "1 | ∀x (P(x) → Q(x))  [Premise]",
                "2 | P(a) → Q(a)       [∀ Elim: 1]");
        assertErrorOnLine(2, "is not an instance of",
                "1 | ∀x (P(x) → Q(x))  [Premise]",
                "2 | P(a) → Q(b)       [∀ Elim: 1]");
    }

    @Test
    public void forAllIntroOverAnArbitraryName() {
        assertCorrect(
                "1 | ∀x (P(x) ∧ Q(x))  [Premise]",
                "2 | P(a) ∧ Q(a)       [∀ Elim: 1]",
                "3 | P(a)              [∧ Elim: 2]",
                "4 | ∀x P(x)           [∀ Intro: 3]");
    }

    @Test
    public void forAllIntroRejectsNameFromAPremise() {
        assertErrorOnLine(2, "cannot generalize over 'a'",
                "1 | P(a)      [Premise]",
                "2 | ∀x P(x)   [∀ Intro: 1]");
    }

    @Test
    public void forAllIntroRejectsNameFromAnOpenAssumption() {
        assertErrorOnLine(3, "occurs free in P(a)",
                "1 | | P(a)      [Assumption]",
                "2 | | P(a)      [Reit: 1]",
                "3 | | ∀x P(x)   [∀ Intro: 2]",
                "4 | P(a) → ∀x P(x) [→ Intro: 1-3]");
    }

    @Test
    public void forAllIntroAcceptsNameFromAClosedAssumption() {
        assertCorrect(
                "1 | | P(a)          [Assumption]",
                "2 | P(a) → P(a)     [→ Intro: 1-1]",
                "3 | ∀x (P(x) → P(x)) [∀ Intro: 2]");
    }

    @Test
    public void existsIntroGeneralizes() {
        assertCorrect(
                "1 | R(a, a)       [Premise]",
                "2 | ∃x R(x, a)    [∃ Intro: 1]",
                "3 | ∃x R(x, x)    [∃ Intro: 1]");
        assertErrorOnLine(2, "is not an instance of",
                "1 | P(a)          [Premise]",
                "2 | ∃x Q(x)       [∃ Intro: 1]");
    }

    @Test
    public void existsElimWithFreshName() {
        assertCorrect(
                "1 | ∃x P(x)             [Premise]",
                "2 | ∀x (P(x) → Q)       [Premise]",
                "3 | | P(c)              [Assumption]",
                "4 | | P(c) → Q          [∀ Elim: 2]",
                "5 | | Q                 [→ Elim: 4, 3]",
                "6 | Q                   [∃ Elim: 1, 3-5]");
    }

    @Test
    public void existsElimRejectsNameInConclusion() {
        assertErrorOnLine(5, "needs a fresh name",
                "1 | ∃x P(x)     [Premise]",
                "2 | Q(c)        [Premise]",
                "3 | | P(c)      [Assumption]",
                "4 | | Q(c)      [Reit: 2]",
                "5 | Q(c)        [∃ Elim: 1, 3-4]");
    }

    @Test
    public void existsElimRejectsNameFromEarlierLine() {
        assertErrorOnLine(5, "occurs free in R(c)",
                "1 | ∃x P(x)     [Premise]",
                "2 | R(c)        [Premise]",
                "3 | | P(c)      [Assumption]",
                "4 | | ∃x P(x)   [Reit: 1]",
                "5 | ∃x P(x)     [∃ Elim: 1, 3-4]");
    }

    @Test
    public void existsElimRejectsWrongAssumption() {
        assertErrorOnLine(5, "is not an instance of ∃x P(x)",
                "1 | ∃x P(x)     [Premise]",
                "2 | Q           [Premise]",
                "3 | | R(c)      [Assumption]",
                "4 | | Q         [Reit: 2]",
                "5 | Q           [∃ Elim: 1, 3-4]");
    }

    //endregion
}
