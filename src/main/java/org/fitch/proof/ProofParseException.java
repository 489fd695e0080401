package org.fitch.proof;

/**
 * La struttura della dimostrazione non può essere ricostruita dal testo.
 *
 * Segnala un errore fatale: riga senza forma riconoscibile, formula non valida,
 * citazioni illeggibili o annidamento incoerente.
 */
public class ProofParseException extends Exception {

    private final int realLine;

    public ProofParseException(String message, int realLine) {
        super(message);
        this.realLine = realLine;
    }

    public ProofParseException(String message, int realLine, Throwable cause) {
        super(message, cause);
        this.realLine = realLine;
    }

    /** Riga del testo (a partire da 1) in cui è stato rilevato il problema, 0 se globale. */
    public int getRealLine() {
        return realLine;
    }
}
