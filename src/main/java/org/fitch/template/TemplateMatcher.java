package org.fitch.template;

import org.fitch.checker.CheckError;
import org.fitch.formula.ExpressionParser;
import org.fitch.formula.Formula;
import org.fitch.formula.FormulaParseException;
import org.fitch.formula.VariableNames;
import org.fitch.proof.ProofLine;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * CONFRONTO CON MODELLO - Verifica che la dimostrazione risolva l'esercizio richiesto
 *
 * Il modello è la lista ordinata delle formule attese: tutte tranne l'ultima sono
 * le premesse richieste, l'ultima è la conclusione. Il confronto usa l'uguaglianza
 * strutturale delle formule ed è indipendente dalla correttezza logica delle righe,
 * che il checker verifica separatamente.
 *
 * REGOLE:
 * • Le premesse della dimostrazione devono essere esattamente quelle attese, nello stesso ordine
 * • L'ultima riga deve essere la conclusione attesa, fuori da ogni sottoprova
 * • Righe intermedie non previste dal modello sono ammesse
 */
public final class TemplateMatcher {

    private static final Logger LOGGER = Logger.getLogger(TemplateMatcher.class.getName());

    private final List<Formula> expectedPremises;
    private final Formula expectedConclusion;

    private TemplateMatcher(List<Formula> expectedPremises, Formula expectedConclusion) {
        this.expectedPremises = List.copyOf(expectedPremises);
        this.expectedConclusion = expectedConclusion;
    }

    /**
     * Prepara il modello analizzando ogni formula.
     *
     * Una voce non analizzabile rende fatale l'intera operazione: un modello
     * parziale produrrebbe valutazioni sbagliate.
     *
     * @param templateTexts formule attese, premesse poi conclusione
     * @param variables variabili ammesse
     * @return modello pronto per il confronto
     * @throws TemplateException se il modello è vuoto o una voce non è una formula valida
     */
    public static TemplateMatcher prepare(List<String> templateTexts, VariableNames variables) throws TemplateException {
        if (templateTexts == null || templateTexts.isEmpty()) {
            throw new TemplateException("The template is empty");
        }

        List<Formula> formulas = new ArrayList<>();
        for (String text : templateTexts) {
            try {
                formulas.add(ExpressionParser.parse(text, variables));
            } catch (FormulaParseException e) {
                throw new TemplateException("Some sentences in the template could not be parsed: "
                        + e.getMessage(), e);
            }
        }

        Formula conclusion = formulas.remove(formulas.size() - 1);
        LOGGER.fine("Modello preparato: " + formulas.size() + " premesse, conclusione " + conclusion);
        return new TemplateMatcher(formulas, conclusion);
    }

    /**
     * Confronta la dimostrazione con il modello.
     *
     * @param lines righe della dimostrazione
     * @return difetti rispetto al modello, lista vuota se conforme
     */
    public List<CheckError> match(List<ProofLine> lines) {
        List<CheckError> errors = new ArrayList<>();
        matchPremises(lines, errors);
        matchConclusion(lines, errors);
        return errors;
    }

    public List<Formula> getExpectedPremises() {
        return expectedPremises;
    }

    public Formula getExpectedConclusion() {
        return expectedConclusion;
    }

    private void matchPremises(List<ProofLine> lines, List<CheckError> errors) {
        List<ProofLine> premises = new ArrayList<>();
        for (ProofLine line : lines) {
            if (line.getJustification().isPremise()) {
                premises.add(line);
            }
        }

        int common = Math.min(premises.size(), expectedPremises.size());
        for (int i = 0; i < common; i++) {
            Formula expected = expectedPremises.get(i);
            ProofLine actual = premises.get(i);
            if (!actual.getFormula().equals(expected)) {
                errors.add(CheckError.at(actual, "Premise " + actual.getFormula()
                        + " does not match the required premise " + expected));
            }
        }

        for (int i = common; i < expectedPremises.size(); i++) {
            errors.add(CheckError.global("Missing premise: " + expectedPremises.get(i)));
        }
        for (int i = common; i < premises.size(); i++) {
            ProofLine extra = premises.get(i);
            errors.add(CheckError.at(extra, "Premise " + extra.getFormula() + " is not allowed by the exercise"));
        }
    }

    private void matchConclusion(List<ProofLine> lines, List<CheckError> errors) {
        ProofLine last = lines.isEmpty() ? null : lines.get(lines.size() - 1);
        if (last == null || last.getDepth() != 0 || !last.getFormula().equals(expectedConclusion)) {
            errors.add(CheckError.global("The proof does not end with the required conclusion: " + expectedConclusion));
        }
    }
}
