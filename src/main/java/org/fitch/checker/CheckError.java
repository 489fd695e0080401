package org.fitch.checker;

import org.fitch.proof.ProofLine;

import java.util.Objects;

/**
 * Difetto rilevato durante la verifica.
 *
 * Gli errori di riga portano sia la riga reale nel testo sia il numero Fitch
 * scritto dall'autore, che manca sulle righe non numerate; gli errori globali
 * (premessa mancante, conclusione del modello non raggiunta) non hanno né
 * riga reale né numero Fitch.
 */
public final class CheckError {

    private static final int GLOBAL_REAL_LINE = 0;

    private final int realLine;
    private final Integer fitchLine;
    private final String text;

    public CheckError(int realLine, Integer fitchLine, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Testo dell'errore non può essere vuoto");
        }
        if (realLine < 0 || (realLine == 0 && fitchLine != null)) {
            throw new IllegalArgumentException("Riga reale " + realLine + " non valida per la riga Fitch " + fitchLine);
        }
        this.realLine = realLine;
        this.fitchLine = fitchLine;
        this.text = text;
    }

    /**
     * Errore relativo a una riga. Se la riga non ha numero la diagnosi
     * nomina la riga reale del testo.
     */
    public static CheckError at(ProofLine line, String text) {
        if (line.hasDisplayedNumber()) {
            return new CheckError(line.getRealLineNumber(), line.getDisplayedNumber(), text);
        }
        return new CheckError(line.getRealLineNumber(), null,
                "Unnumbered line (text line " + line.getRealLineNumber() + "): " + text);
    }

    public static CheckError global(String text) {
        return new CheckError(GLOBAL_REAL_LINE, null, text);
    }

    public int getRealLine() {
        return realLine;
    }

    /** Numero Fitch della riga, null per gli errori globali e per le righe non numerate. */
    public Integer getFitchLine() {
        return fitchLine;
    }

    public boolean isGlobal() {
        return realLine == GLOBAL_REAL_LINE;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        CheckError other = (CheckError) obj;
        return realLine == other.realLine && Objects.equals(fitchLine, other.fitchLine) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(realLine, fitchLine, text);
    }

    @Override
    public String toString() {
        return fitchLine == null ? text : "Line " + fitchLine + ": " + text;
    }
}
