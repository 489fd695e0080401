package org.fitch.checker;

import org.fitch.formula.Formula;
import org.fitch.formula.Formula.Type;
import org.fitch.formula.InstanceMatcher;
import org.fitch.proof.ProofLine;
import org.fitch.proof.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * VALIDATORE REGOLE - Controllo della forma richiesta da ciascuna regola di inferenza
 *
 * Riceve la riga corrente e le citazioni già risolte (visibilità verificata dal
 * checker) e controlla che formula e citazioni abbiano la forma prevista dalla
 * regola. L'ordine delle citazioni è libero: ogni regola cerca il ruolo di
 * ciascun elemento citato.
 *
 * Ogni violazione produce una {@link RuleViolation} con un messaggio che
 * riporta la forma attesa e quella trovata.
 */
final class RuleValidator {

    private static final Logger LOGGER = Logger.getLogger(RuleValidator.class.getName());

    private final List<ProofLine> lines;
    private final Scope scope;

    RuleValidator(List<ProofLine> lines, Scope scope) {
        this.lines = lines;
        this.scope = scope;
    }

    //region PUNTO DI INGRESSO

    /**
     * Verifica la riga corrente rispetto alla regola indicata.
     *
     * @param rule regola citata nella giustificazione
     * @param current riga da verificare
     * @param cited citazioni risolte, nell'ordine scritto dall'autore
     * @throws RuleViolation se la riga non rispetta la regola
     */
    void validate(Rule rule, ProofLine current, List<CitedItem> cited) throws RuleViolation {
        Formula phi = current.getFormula();
        LOGGER.finest("Verifica " + rule + " per " + phi + " con " + cited.size() + " citazioni");

        switch (rule) {
            case REIT -> checkReit(phi, cited);
            case AND_INTRO -> checkAndIntro(phi, cited);
            case AND_ELIM -> checkAndElim(phi, cited);
            case OR_INTRO -> checkOrIntro(phi, cited);
            case OR_ELIM -> checkOrElim(phi, cited);
            case IMPLIES_INTRO -> checkImpliesIntro(phi, cited);
            case IMPLIES_ELIM -> checkImpliesElim(phi, cited);
            case IFF_INTRO -> checkIffIntro(phi, cited);
            case IFF_ELIM -> checkIffElim(phi, cited);
            case NOT_INTRO -> checkNotIntro(phi, cited);
            case NOT_ELIM, BOTTOM_INTRO -> checkContradiction(rule, phi, cited);
            case DOUBLE_NOT_ELIM -> checkDoubleNotElim(phi, cited);
            case BOTTOM_ELIM -> checkBottomElim(cited);
            case FORALL_INTRO -> checkForAllIntro(phi, cited);
            case FORALL_ELIM -> checkForAllElim(phi, cited);
            case EXISTS_INTRO -> checkExistsIntro(phi, cited);
            case EXISTS_ELIM -> checkExistsElim(phi, cited);
        }
    }

    //endregion

    //region REITERAZIONE E CONGIUNZIONE

    private void checkReit(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem source = singleLine(Rule.REIT, cited);
        if (!phi.equals(source.formula())) {
            throw new RuleViolation("The reiterated formula " + phi + " does not match the formula of "
                    + source.describe() + " (" + source.formula() + ")");
        }
    }

    private void checkAndIntro(Formula phi, List<CitedItem> cited) throws RuleViolation {
        requireLines(Rule.AND_INTRO, cited);
        if (cited.isEmpty() || cited.size() > 2) {
            throw countViolation(Rule.AND_INTRO, "one or two lines", cited);
        }
        requireType(Rule.AND_INTRO, phi, Type.AND, "a conjunction");

        Formula left = phi.getLeft();
        Formula right = phi.getRight();
        if (cited.size() == 1) {
            Formula only = cited.get(0).formula();
            if (!left.equals(only) || !right.equals(only)) {
                throw new RuleViolation("∧ Intro with a single cited line needs both conjuncts of " + phi
                        + " to be " + only);
            }
            return;
        }

        Formula a = cited.get(0).formula();
        Formula b = cited.get(1).formula();
        boolean inOrder = left.equals(a) && right.equals(b);
        boolean swapped = left.equals(b) && right.equals(a);
        if (!inOrder && !swapped) {
            throw new RuleViolation("The conjuncts of " + phi + " do not match the cited formulas "
                    + a + " and " + b);
        }
    }

    private void checkAndElim(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem source = singleLine(Rule.AND_ELIM, cited);
        Formula conjunction = source.formula();
        if (!conjunction.is(Type.AND)) {
            throw new RuleViolation("∧ Elim needs a conjunction, but " + source.describe() + " is " + conjunction);
        }
        if (!phi.equals(conjunction.getLeft()) && !phi.equals(conjunction.getRight())) {
            throw new RuleViolation(phi + " is not a conjunct of " + conjunction);
        }
    }

    //endregion

    //region DISGIUNZIONE

    private void checkOrIntro(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem source = singleLine(Rule.OR_INTRO, cited);
        requireType(Rule.OR_INTRO, phi, Type.OR, "a disjunction");
        if (!phi.getLeft().equals(source.formula()) && !phi.getRight().equals(source.formula())) {
            throw new RuleViolation("Neither disjunct of " + phi + " matches " + source.describe()
                    + " (" + source.formula() + ")");
        }
    }

    private void checkOrElim(Formula phi, List<CitedItem> cited) throws RuleViolation {
        List<CitedItem> singles = linesOf(cited);
        List<CitedItem> boxes = boxesOf(cited);
        if (singles.size() != 1 || boxes.size() != 2) {
            throw countViolation(Rule.OR_ELIM, "one line and two subproofs", cited);
        }

        CitedItem source = singles.get(0);
        Formula disjunction = source.formula();
        if (!disjunction.is(Type.OR)) {
            throw new RuleViolation("∨ Elim needs a disjunction, but " + source.describe() + " is " + disjunction);
        }

        CitedItem first = boxes.get(0);
        CitedItem second = boxes.get(1);
        Formula left = disjunction.getLeft();
        Formula right = disjunction.getRight();
        boolean inOrder = first.assumption().equals(left) && second.assumption().equals(right);
        boolean swapped = first.assumption().equals(right) && second.assumption().equals(left);
        if (!inOrder && !swapped) {
            throw new RuleViolation("The subproofs of ∨ Elim must assume " + left + " and " + right
                    + ", but they assume " + first.assumption() + " and " + second.assumption());
        }

        for (CitedItem box : boxes) {
            if (!box.conclusion().equals(phi)) {
                throw new RuleViolation("The " + box.describe() + " ends with " + box.conclusion()
                        + ", not with " + phi);
            }
        }
    }

    //endregion

    //region IMPLICAZIONE E BICONDIZIONALE

    private void checkImpliesIntro(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem box = singleBox(Rule.IMPLIES_INTRO, cited);
        requireType(Rule.IMPLIES_INTRO, phi, Type.IMPLIES, "an implication");

        if (!phi.getLeft().equals(box.assumption())) {
            throw new RuleViolation("The antecedent of " + phi + " does not match the assumption of the "
                    + box.describe() + " (" + box.assumption() + ")");
        }
        if (!phi.getRight().equals(box.conclusion())) {
            throw new RuleViolation("The consequent of " + phi + " does not match the last line of the "
                    + box.describe() + " (" + box.conclusion() + ")");
        }
    }

    private void checkImpliesElim(Formula phi, List<CitedItem> cited) throws RuleViolation {
        List<Formula> formulas = twoLines(Rule.IMPLIES_ELIM, cited);

        Formula implication = null;
        for (int i = 0; i < 2; i++) {
            Formula candidate = formulas.get(i);
            Formula other = formulas.get(1 - i);
            if (candidate.is(Type.IMPLIES) && candidate.getLeft().equals(other)) {
                implication = candidate;
                break;
            }
        }

        if (implication == null) {
            throw new RuleViolation("→ Elim needs an implication and its antecedent, but found "
                    + formulas.get(0) + " and " + formulas.get(1));
        }
        if (!implication.getRight().equals(phi)) {
            throw new RuleViolation(phi + " is not the consequent of " + implication);
        }
    }

    private void checkIffIntro(Formula phi, List<CitedItem> cited) throws RuleViolation {
        List<CitedItem> boxes = boxesOf(cited);
        if (boxes.size() != 2 || cited.size() != 2) {
            throw countViolation(Rule.IFF_INTRO, "two subproofs", cited);
        }
        requireType(Rule.IFF_INTRO, phi, Type.IFF, "a biconditional");

        Formula a = phi.getLeft();
        Formula b = phi.getRight();
        boolean inOrder = proves(boxes.get(0), a, b) && proves(boxes.get(1), b, a);
        boolean swapped = proves(boxes.get(0), b, a) && proves(boxes.get(1), a, b);
        if (!inOrder && !swapped) {
            throw new RuleViolation("↔ Intro for " + phi + " needs one subproof from " + a + " to " + b
                    + " and one from " + b + " to " + a);
        }
    }

    private static boolean proves(CitedItem box, Formula from, Formula to) {
        return box.assumption().equals(from) && box.conclusion().equals(to);
    }

    private void checkIffElim(Formula phi, List<CitedItem> cited) throws RuleViolation {
        List<Formula> formulas = twoLines(Rule.IFF_ELIM, cited);

        boolean foundBiconditional = false;
        for (int i = 0; i < 2; i++) {
            Formula candidate = formulas.get(i);
            Formula other = formulas.get(1 - i);
            if (!candidate.is(Type.IFF)) {
                continue;
            }
            foundBiconditional = true;
            if ((candidate.getLeft().equals(other) && candidate.getRight().equals(phi))
                    || (candidate.getRight().equals(other) && candidate.getLeft().equals(phi))) {
                return;
            }
        }

        if (!foundBiconditional) {
            throw new RuleViolation("↔ Elim needs a biconditional, but found " + formulas.get(0)
                    + " and " + formulas.get(1));
        }
        throw new RuleViolation(phi + " does not follow by ↔ Elim from " + formulas.get(0)
                + " and " + formulas.get(1));
    }

    //endregion

    //region NEGAZIONE E CONTRADDIZIONE

    private void checkNotIntro(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem box = singleBox(Rule.NOT_INTRO, cited);
        requireType(Rule.NOT_INTRO, phi, Type.NOT, "a negation");

        if (!phi.getOperand().equals(box.assumption())) {
            throw new RuleViolation(phi + " is not the negation of the assumption of the " + box.describe()
                    + " (" + box.assumption() + ")");
        }
        if (!box.conclusion().is(Type.BOTTOM)) {
            throw new RuleViolation("The " + box.describe() + " must end with ⊥, but ends with " + box.conclusion());
        }
    }

    private void checkContradiction(Rule rule, Formula phi, List<CitedItem> cited) throws RuleViolation {
        List<Formula> formulas = twoLines(rule, cited);
        if (!phi.is(Type.BOTTOM)) {
            throw new RuleViolation(rule + " must conclude ⊥, but found " + phi);
        }

        Formula a = formulas.get(0);
        Formula b = formulas.get(1);
        boolean contradiction = (a.is(Type.NOT) && a.getOperand().equals(b))
                || (b.is(Type.NOT) && b.getOperand().equals(a));
        if (!contradiction) {
            throw new RuleViolation(a + " and " + b + " are not of the form A and ¬A");
        }
    }

    private void checkDoubleNotElim(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem source = singleLine(Rule.DOUBLE_NOT_ELIM, cited);
        Formula formula = source.formula();
        if (!formula.is(Type.NOT) || !formula.getOperand().is(Type.NOT)) {
            throw new RuleViolation("¬¬ Elim needs a double negation, but " + source.describe() + " is " + formula);
        }
        if (!formula.getOperand().getOperand().equals(phi)) {
            throw new RuleViolation("Removing the double negation from " + formula + " does not give " + phi);
        }
    }

    private void checkBottomElim(List<CitedItem> cited) throws RuleViolation {
        CitedItem source = singleLine(Rule.BOTTOM_ELIM, cited);
        if (!source.formula().is(Type.BOTTOM)) {
            throw new RuleViolation("⊥ Elim needs ⊥, but " + source.describe() + " is " + source.formula());
        }
    }

    //endregion

    //region QUANTIFICATORI

    private void checkForAllIntro(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem source = singleLine(Rule.FORALL_INTRO, cited);
        requireType(Rule.FORALL_INTRO, phi, Type.FORALL, "a universal formula");

        InstanceMatcher.Match match = InstanceMatcher.match(phi.getBody(), phi.getVariable(), source.formula());
        if (!match.matches()) {
            throw new RuleViolation(source.formula() + " on " + source.describe() + " is not an instance of "
                    + phi.getBody() + " for " + phi.getVariable());
        }
        if (!match.hasTerm()) {
            return;
        }

        String term = match.getTerm();
        List<Formula> premises = premiseFormulas();
        List<Formula> assumptions = openAssumptionFormulas();
        if (!FreshnessConditions.isFreshForUniversalIntro(term, phi, premises, assumptions)) {
            Formula witness = FreshnessConditions.firstOccurrence(term,
                    FreshnessConditions.universalIntroContext(phi, premises, assumptions));
            throw new RuleViolation("∀ Intro cannot generalize over '" + term + "': it is not arbitrary,"
                    + " because it occurs free in " + witness);
        }
    }

    private void checkForAllElim(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem source = singleLine(Rule.FORALL_ELIM, cited);
        Formula universal = source.formula();
        if (!universal.is(Type.FORALL)) {
            throw new RuleViolation("∀ Elim needs a universal formula, but " + source.describe() + " is " + universal);
        }

        InstanceMatcher.Match match = InstanceMatcher.match(universal.getBody(), universal.getVariable(), phi);
        if (!match.matches()) {
            throw new RuleViolation(phi + " is not an instance of " + universal);
        }
    }

    private void checkExistsIntro(Formula phi, List<CitedItem> cited) throws RuleViolation {
        CitedItem source = singleLine(Rule.EXISTS_INTRO, cited);
        requireType(Rule.EXISTS_INTRO, phi, Type.EXISTS, "an existential formula");

        InstanceMatcher.Match match = InstanceMatcher.match(phi.getBody(), phi.getVariable(), source.formula());
        if (!match.matches()) {
            throw new RuleViolation(source.formula() + " on " + source.describe() + " is not an instance of "
                    + phi.getBody() + " for " + phi.getVariable());
        }
    }

    private void checkExistsElim(Formula phi, List<CitedItem> cited) throws RuleViolation {
        List<CitedItem> singles = linesOf(cited);
        List<CitedItem> boxes = boxesOf(cited);
        if (singles.size() != 1 || boxes.size() != 1) {
            throw countViolation(Rule.EXISTS_ELIM, "one line and one subproof", cited);
        }

        CitedItem source = singles.get(0);
        CitedItem box = boxes.get(0);
        Formula existential = source.formula();
        if (!existential.is(Type.EXISTS)) {
            throw new RuleViolation("∃ Elim needs an existential formula, but " + source.describe()
                    + " is " + existential);
        }

        InstanceMatcher.Match match = InstanceMatcher.match(existential.getBody(), existential.getVariable(),
                box.assumption());
        if (!match.matches()) {
            throw new RuleViolation("The assumption of the " + box.describe() + " (" + box.assumption()
                    + ") is not an instance of " + existential);
        }
        if (!box.conclusion().equals(phi)) {
            throw new RuleViolation("The " + box.describe() + " ends with " + box.conclusion()
                    + ", not with " + phi);
        }
        if (!match.hasTerm()) {
            return;
        }

        String term = match.getTerm();
        List<Formula> outside = new ArrayList<>();
        for (int index : scope.linesVisibleFrom(box.getBox())) {
            outside.add(lines.get(index).getFormula());
        }
        if (!FreshnessConditions.isFreshForExistentialElim(term, phi, existential, outside)) {
            Formula witness = FreshnessConditions.firstOccurrence(term,
                    FreshnessConditions.existentialElimContext(phi, existential, outside));
            throw new RuleViolation("∃ Elim needs a fresh name in the assumption of the " + box.describe()
                    + ", but '" + term + "' occurs free in " + witness);
        }
    }

    //endregion

    //region CONTESTO DELLA RIGA CORRENTE

    private List<Formula> premiseFormulas() {
        List<Formula> premises = new ArrayList<>();
        for (ProofLine line : lines) {
            if (line.getJustification().isPremise()) {
                premises.add(line.getFormula());
            }
        }
        return premises;
    }

    private List<Formula> openAssumptionFormulas() {
        List<Formula> assumptions = new ArrayList<>();
        for (Box box : scope.getOpenBoxes()) {
            assumptions.add(lines.get(box.getFirstIndex()).getFormula());
        }
        return assumptions;
    }

    //endregion

    //region FORMA DELLE CITAZIONI

    private static CitedItem singleLine(Rule rule, List<CitedItem> cited) throws RuleViolation {
        if (cited.size() != 1) {
            throw countViolation(rule, "one line", cited);
        }
        requireLines(rule, cited);
        return cited.get(0);
    }

    private static CitedItem singleBox(Rule rule, List<CitedItem> cited) throws RuleViolation {
        if (cited.size() != 1) {
            throw countViolation(rule, "one subproof", cited);
        }
        CitedItem item = cited.get(0);
        if (!item.isBox()) {
            throw new RuleViolation(rule + " needs a subproof, but " + item.describe() + " was cited");
        }
        return item;
    }

    private static List<Formula> twoLines(Rule rule, List<CitedItem> cited) throws RuleViolation {
        if (cited.size() != 2) {
            throw countViolation(rule, "two lines", cited);
        }
        requireLines(rule, cited);
        return List.of(cited.get(0).formula(), cited.get(1).formula());
    }

    private static void requireLines(Rule rule, List<CitedItem> cited) throws RuleViolation {
        for (CitedItem item : cited) {
            if (item.isBox()) {
                throw new RuleViolation(rule + " cannot cite the " + item.describe() + "; it needs single lines");
            }
        }
    }

    private static void requireType(Rule rule, Formula phi, Type expected, String description) throws RuleViolation {
        if (!phi.is(expected)) {
            throw new RuleViolation(rule + " must conclude " + description + ", but found " + phi);
        }
    }

    private static RuleViolation countViolation(Rule rule, String expected, List<CitedItem> cited) {
        List<String> described = new ArrayList<>();
        for (CitedItem item : cited) {
            described.add(item.describe());
        }
        String found = described.isEmpty() ? "nothing" : String.join(", ", described);
        return new RuleViolation(rule + " expects " + expected + ", but cites " + found);
    }

    private static List<CitedItem> linesOf(List<CitedItem> cited) {
        List<CitedItem> result = new ArrayList<>();
        for (CitedItem item : cited) {
            if (!item.isBox()) {
                result.add(item);
            }
        }
        return result;
    }

    private static List<CitedItem> boxesOf(List<CitedItem> cited) {
        List<CitedItem> result = new ArrayList<>();
        for (CitedItem item : cited) {
            if (item.isBox()) {
                result.add(item);
            }
        }
        return result;
    }

    //endregion
}
