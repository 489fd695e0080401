package org.fitch.formula;

/**
 * Errore di sintassi o di uso delle variabili in un'espressione logica.
 */
public class FormulaParseException extends RuntimeException {

    private final String text;

    public FormulaParseException(String message, String text) {
        super(message);
        this.text = text;
    }

    /** Testo dell'espressione che non è stato possibile analizzare. */
    public String getText() {
        return text;
    }
}
