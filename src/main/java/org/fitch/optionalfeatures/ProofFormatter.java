package org.fitch.optionalfeatures;

import org.fitch.proof.ProofLine;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * FORMATTATORE DIMOSTRAZIONI - Impaginazione canonica di una dimostrazione Fitch
 *
 * Produce un testo che il parser rilegge ottenendo le stesse righe:
 *
 *   1 | P ∧ Q        [Premise]
 *     |---
 *   2 | | R          [Assumption]
 *     | |---
 *   3 | | P          [∧ Elim: 1]
 *   4 | R → P        [→ Intro: 2-3]
 *
 * REGOLE DI IMPAGINAZIONE:
 * • Numeri allineati a destra su una colonna comune
 * • Una barra di margine più una barra "| " per ogni livello di sottoprova
 * • Separatore "|---" dopo l'ultima premessa e dopo ogni assunzione
 * • Giustificazioni allineate e con il nome canonico della regola
 */
public class ProofFormatter {

    private static final Logger LOGGER = Logger.getLogger(ProofFormatter.class.getName());

    private static final String BAR = "| ";
    private static final String SEPARATOR = "|---";
    private static final int JUSTIFICATION_GAP = 2;

    /**
     * Impagina le righe analizzate.
     *
     * @param lines righe della dimostrazione
     * @return testo formattato, una riga per riga di dimostrazione più i separatori
     */
    public String format(List<ProofLine> lines) {
        int numberWidth = numberColumnWidth(lines);
        int formulaColumn = formulaColumnWidth(lines);
        int lastPremise = lastPremiseIndex(lines);

        List<String> rows = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            ProofLine line = lines.get(index);
            rows.add(formatLine(line, numberWidth, formulaColumn));

            if (index == lastPremise) {
                rows.add(separatorRow(numberWidth, 0));
            } else if (line.getJustification().isAssumption()) {
                rows.add(separatorRow(numberWidth, line.getDepth()));
            }
        }

        LOGGER.fine("Dimostrazione formattata: " + lines.size() + " righe");
        return String.join("\n", rows);
    }

    //region COSTRUZIONE RIGHE

    private static String formatLine(ProofLine line, int numberWidth, int formulaColumn) {
        String number = line.hasDisplayedNumber() ? String.valueOf(line.getDisplayedNumber()) : "";
        String body = bars(line.getDepth()) + line.getFormula();

        StringBuilder row = new StringBuilder();
        row.append(" ".repeat(numberWidth - number.length())).append(number).append(' ');
        row.append(body);
        row.append(" ".repeat(formulaColumn - body.length() + JUSTIFICATION_GAP));
        row.append('[').append(line.getJustification()).append(']');
        return row.toString();
    }

    private static String separatorRow(int numberWidth, int depth) {
        return " ".repeat(numberWidth + 1) + BAR.repeat(depth) + SEPARATOR;
    }

    private static String bars(int depth) {
        return BAR.repeat(depth + 1);
    }

    //endregion

    //region MISURE COLONNE

    private static int numberColumnWidth(List<ProofLine> lines) {
        int width = 1;
        for (ProofLine line : lines) {
            if (line.hasDisplayedNumber()) {
                width = Math.max(width, String.valueOf(line.getDisplayedNumber()).length());
            }
        }
        return width;
    }

    private static int formulaColumnWidth(List<ProofLine> lines) {
        int width = 0;
        for (ProofLine line : lines) {
            width = Math.max(width, bars(line.getDepth()).length() + line.getFormula().toString().length());
        }
        return width;
    }

    /**
     * Indice dell'ultima riga del blocco iniziale di premesse, -1 se il blocco è vuoto.
     */
    private static int lastPremiseIndex(List<ProofLine> lines) {
        int last = -1;
        for (int index = 0; index < lines.size(); index++) {
            if (!lines.get(index).getJustification().isPremise()) {
                break;
            }
            last = index;
        }
        return last;
    }

    //endregion
}
