package org.fitch.checker;

import org.fitch.formula.Formula;
import org.fitch.proof.Citation;
import org.fitch.proof.ProofLine;

/**
 * Citazione risolta: una riga visibile oppure una sottoprova chiusa.
 */
final class CitedItem {

    private final Citation citation;
    private final ProofLine line;
    private final Box box;
    private final ProofLine first;
    private final ProofLine last;

    private CitedItem(Citation citation, ProofLine line, Box box, ProofLine first, ProofLine last) {
        this.citation = citation;
        this.line = line;
        this.box = box;
        this.first = first;
        this.last = last;
    }

    static CitedItem line(Citation citation, ProofLine line) {
        return new CitedItem(citation, line, null, null, null);
    }

    static CitedItem box(Citation citation, Box box, ProofLine first, ProofLine last) {
        return new CitedItem(citation, null, box, first, last);
    }

    boolean isBox() {
        return box != null;
    }

    Citation getCitation() {
        return citation;
    }

    /** Formula della riga citata. */
    Formula formula() {
        if (line == null) {
            throw new IllegalStateException("La citazione " + citation + " è una sottoprova");
        }
        return line.getFormula();
    }

    Box getBox() {
        return box;
    }

    /** Assunzione che apre la sottoprova citata. */
    Formula assumption() {
        if (box == null) {
            throw new IllegalStateException("La citazione " + citation + " non è una sottoprova");
        }
        return first.getFormula();
    }

    /** Ultima formula derivata nella sottoprova citata. */
    Formula conclusion() {
        if (box == null) {
            throw new IllegalStateException("La citazione " + citation + " non è una sottoprova");
        }
        return last.getFormula();
    }

    String describe() {
        return box != null ? "subproof " + citation : "line " + citation;
    }
}
