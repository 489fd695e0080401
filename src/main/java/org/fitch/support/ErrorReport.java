package org.fitch.support;

import org.fitch.checker.CheckError;
import org.fitch.checker.ProofResult;

import java.util.ArrayList;
import java.util.List;

/**
 * REPORT ERRORI - Rendering testuale di un {@link ProofResult}
 *
 * FORMATI:
 * • Semplice: "testo" per gli errori globali, "Line n: testo" per quelli di riga
 * • Dettagliato: "Line r: (Fitch line n) testo", con r riga reale del file
 *
 * Le voci sono ordinate in modo naturale sul testo già formattato e separate
 * da una riga vuota.
 */
public final class ErrorReport {

    public static final String CORRECT_MESSAGE = "The proof is correct!";
    public static final String FATAL_PREFIX = "Fatal error: ";

    private static final String ENTRY_SEPARATOR = "\n\n";

    private ErrorReport() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Rende un risultato completo: messaggio di successo, errori ordinati o errore fatale.
     *
     * @param result esito della verifica
     * @param verbose true per includere la riga reale del testo
     */
    public static String render(ProofResult result, boolean verbose) {
        return switch (result.getOutcome()) {
            case CORRECT -> CORRECT_MESSAGE;
            case FATAL -> FATAL_PREFIX + result.getFatalMessage();
            case ERROR -> render(result.getErrors(), verbose);
        };
    }

    public static String render(List<CheckError> errors, boolean verbose) {
        List<String> entries = new ArrayList<>();
        for (CheckError error : errors) {
            entries.add(verbose ? formatVerbose(error) : formatPlain(error));
        }
        entries.sort(NaturalOrderComparator.INSTANCE);
        return String.join(ENTRY_SEPARATOR, entries);
    }

    /**
     * Le righe non numerate non hanno numero Fitch: il testo dell'errore nomina già la riga reale.
     */
    public static String formatPlain(CheckError error) {
        if (error.getFitchLine() == null) {
            return error.getText();
        }
        return "Line " + error.getFitchLine() + ": " + error.getText();
    }

    public static String formatVerbose(CheckError error) {
        if (error.isGlobal()) {
            return error.getText();
        }
        if (error.getFitchLine() == null) {
            return "Line " + error.getRealLine() + ": " + error.getText();
        }
        return "Line " + error.getRealLine() + ": (Fitch line " + error.getFitchLine() + ") " + error.getText();
    }
}
