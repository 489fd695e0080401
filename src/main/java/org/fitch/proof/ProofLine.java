package org.fitch.proof;

import org.fitch.formula.Formula;

import java.util.Map;

/**
 * Riga di una dimostrazione Fitch dopo l'analisi strutturale.
 *
 * Conserva sia il numero scritto dall'autore, che può mancare o essere sbagliato,
 * sia la riga reale nel testo, usata nei messaggi diagnostici.
 */
public final class ProofLine {

    /** Numero scritto dall'autore, null se assente */
    private final Integer displayedNumber;

    /** Posizione nel testo originale, a partire da 1 */
    private final int realLineNumber;

    private final Formula formula;
    private final Justification justification;

    /** Numero di sottoprove aperte che racchiudono la riga */
    private final int depth;

    public ProofLine(Integer displayedNumber, int realLineNumber, Formula formula,
                     Justification justification, int depth) {
        if (formula == null || justification == null) {
            throw new IllegalArgumentException("Formula e giustificazione sono obbligatorie");
        }
        if (realLineNumber < 1 || depth < 0) {
            throw new IllegalArgumentException("Riga reale " + realLineNumber + " o profondità " + depth + " non valida");
        }
        this.displayedNumber = displayedNumber;
        this.realLineNumber = realLineNumber;
        this.formula = formula;
        this.justification = justification;
        this.depth = depth;
    }

    public boolean hasDisplayedNumber() {
        return displayedNumber != null;
    }

    /**
     * @return numero scritto dall'autore, oppure null se mancante
     */
    public Integer getDisplayedNumber() {
        return displayedNumber;
    }

    public int getRealLineNumber() {
        return realLineNumber;
    }

    public Formula getFormula() {
        return formula;
    }

    public Justification getJustification() {
        return justification;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Copia con nuovo numero visualizzato e citazioni aggiornate dalla mappa.
     */
    public ProofLine renumber(int newNumber, Map<Integer, Integer> mapping) {
        return new ProofLine(newNumber, realLineNumber, formula, justification.renumber(mapping), depth);
    }

    @Override
    public String toString() {
        return (displayedNumber != null ? displayedNumber : "?") + " " + "| ".repeat(depth + 1)
                + formula + " [" + justification + "]";
    }
}
