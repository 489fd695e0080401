package org.fitch.proof;

import java.util.Map;
import java.util.Objects;

/**
 * Riferimento citato in una giustificazione: una riga singola ("3") oppure
 * un intervallo che denota una sottoprova chiusa ("2-5").
 *
 * I numeri sono quelli scritti dall'autore, non le posizioni nel testo.
 */
public final class Citation {

    private final int start;
    private final int end;
    private final boolean range;

    private Citation(int start, int end, boolean range) {
        if (start < 0 || end < 0) {
            throw new IllegalArgumentException("Numero di riga citato negativo: " + start + "-" + end);
        }
        this.start = start;
        this.end = end;
        this.range = range;
    }

    public static Citation line(int number) {
        return new Citation(number, number, false);
    }

    public static Citation range(int start, int end) {
        return new Citation(start, end, true);
    }

    public boolean isRange() {
        return range;
    }

    /**
     * Numero della riga citata.
     *
     * @throws IllegalStateException se la citazione è un intervallo
     */
    public int getLine() {
        if (range) {
            throw new IllegalStateException("La citazione " + this + " è un intervallo");
        }
        return start;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Applica una rinumerazione; i numeri assenti dalla mappa restano invariati.
     */
    public Citation renumber(Map<Integer, Integer> mapping) {
        int newStart = mapping.getOrDefault(start, start);
        int newEnd = mapping.getOrDefault(end, end);
        return range ? range(newStart, newEnd) : line(newStart);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Citation other = (Citation) obj;
        return start == other.start && end == other.end && range == other.range;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, range);
    }

    @Override
    public String toString() {
        return range ? start + "-" + end : String.valueOf(start);
    }
}
