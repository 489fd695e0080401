package org.fitch;

import org.fitch.checker.CheckError;
import org.fitch.checker.ProofChecker;
import org.fitch.checker.ProofResult;
import org.fitch.formula.ExpressionParser;
import org.fitch.formula.Formula;
import org.fitch.formula.FormulaParseException;
import org.fitch.formula.VariableNames;
import org.fitch.optionalfeatures.LatexExporter;
import org.fitch.optionalfeatures.LineNumberFixer;
import org.fitch.optionalfeatures.ProofFormatter;
import org.fitch.proof.ProofLine;
import org.fitch.proof.ProofParseException;
import org.fitch.proof.ProofParser;
import org.fitch.support.ErrorReport;
import org.fitch.template.TemplateException;
import org.fitch.template.TemplateMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * VERIFICATORE FITCH - Punto di ingresso programmatico
 *
 * Collega le fasi della pipeline:
 * 1. Configurazione delle variabili ammesse ({@link VariableNames})
 * 2. Analisi della struttura ({@link ProofParser})
 * 3. Verifica riga per riga ({@link ProofChecker})
 * 4. Confronto opzionale con il modello dell'esercizio ({@link TemplateMatcher})
 *
 * Nessuna eccezione esce dai metodi check: ogni errore di analisi o di
 * configurazione diventa un risultato FATAL.
 */
public final class FitchProof {

    private static final Logger LOGGER = Logger.getLogger(FitchProof.class.getName());

    private FitchProof() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region VERIFICA

    /**
     * Verifica completa di una dimostrazione, senza modello.
     *
     * @param proofText testo della dimostrazione
     * @param variableConfiguration nomi di variabile ammessi separati da virgole, es. "x,y,z"
     */
    public static ProofResult check(String proofText, String variableConfiguration) {
        return checkWithTemplate(proofText, null, variableConfiguration);
    }

    /**
     * Verifica più confronto con il modello: gli errori del modello si sommano
     * a quelli della verifica.
     *
     * @param templateTexts formule attese (premesse poi conclusione), null per nessun modello
     */
    public static ProofResult checkWithTemplate(String proofText, List<String> templateTexts,
                                                String variableConfiguration) {
        try {
            VariableNames variables = VariableNames.parse(variableConfiguration);
            TemplateMatcher template = templateTexts == null ? null : TemplateMatcher.prepare(templateTexts, variables);

            List<ProofLine> lines = new ProofParser(variables).parse(proofText);
            List<CheckError> errors = new ArrayList<>(ProofChecker.check(lines));
            if (template != null) {
                errors.addAll(template.match(lines));
            }

            ProofResult result = ProofResult.fromErrors(errors);
            LOGGER.info("Verifica completata: " + result.getOutcome() + " (" + errors.size() + " errori)");
            return result;

        } catch (ProofParseException | TemplateException | FormulaParseException | IllegalArgumentException e) {
            LOGGER.fine("Verifica interrotta: " + e.getMessage());
            return ProofResult.fatal(e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore inatteso durante la verifica", e);
            return ProofResult.fatal("Internal error: " + e.getMessage());
        }
    }

    /**
     * Verifica con le variabili predefinite x, y, z, u, v, w.
     */
    public static boolean isCorrect(String proofText) {
        return check(proofText, VariableNames.DEFAULT_CONFIGURATION).isCorrect();
    }

    /**
     * Analizza una singola formula.
     *
     * @throws FormulaParseException se il testo non è una formula ben formata
     * @throws IllegalArgumentException se la configurazione delle variabili non è valida
     */
    public static Formula parseExpression(String text, String variableConfiguration) {
        return ExpressionParser.parse(text, VariableNames.parse(variableConfiguration));
    }

    //endregion

    //region RISULTATI TESTUALI

    public static String checkProof(String proofText, String variableConfiguration) {
        return ErrorReport.render(check(proofText, variableConfiguration), false);
    }

    public static String checkProofVerbose(String proofText, String variableConfiguration) {
        return ErrorReport.render(check(proofText, variableConfiguration), true);
    }

    public static String checkProofWithTemplate(String proofText, List<String> templateTexts,
                                                String variableConfiguration) {
        return ErrorReport.render(checkWithTemplate(proofText, templateTexts, variableConfiguration), false);
    }

    //endregion

    //region TRASFORMAZIONI

    /**
     * Impaginazione canonica; se il testo non è analizzabile lo restituisce invariato.
     */
    public static String formatProof(String proofText, String variableConfiguration) {
        try {
            return new ProofFormatter().format(parse(proofText, variableConfiguration));
        } catch (ProofParseException | IllegalArgumentException e) {
            LOGGER.warning("Formattazione non eseguita: " + e.getMessage());
            return proofText;
        }
    }

    /**
     * Rinumera le righe e le citazioni; se il testo non è analizzabile lo restituisce invariato.
     */
    public static String fixLineNumbers(String proofText, String variableConfiguration) {
        try {
            List<ProofLine> fixed = new LineNumberFixer().fix(parse(proofText, variableConfiguration));
            return new ProofFormatter().format(fixed);
        } catch (ProofParseException | IllegalArgumentException e) {
            LOGGER.warning("Correzione numerazione non eseguita: " + e.getMessage());
            return proofText;
        }
    }

    /**
     * @throws ProofParseException se il testo non è analizzabile
     * @throws IllegalArgumentException se la configurazione delle variabili non è valida
     */
    public static String toLatex(String proofText, String variableConfiguration) throws ProofParseException {
        return new LatexExporter().export(parse(proofText, variableConfiguration));
    }

    private static List<ProofLine> parse(String proofText, String variableConfiguration) throws ProofParseException {
        return new ProofParser(VariableNames.parse(variableConfiguration)).parse(proofText);
    }

    //endregion
}
