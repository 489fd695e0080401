package org.fitch.optionalfeatures;

import org.fitch.proof.ProofLine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * CORREZIONE NUMERAZIONE - Rinumera le righe da 1 a n preservando il significato delle citazioni
 *
 * Ogni citazione viene riscritta attraverso la mappa vecchio numero -> nuovo numero.
 * Con numeri duplicati una citazione indica l'ultima riga precedente con quel numero,
 * come nel checker; le citazioni in avanti usano la prima occorrenza.
 * Le citazioni verso numeri inesistenti restano invariate e il checker le segnalerà.
 */
public class LineNumberFixer {

    private static final Logger LOGGER = Logger.getLogger(LineNumberFixer.class.getName());

    /**
     * @param lines righe con numerazione eventualmente errata o mancante
     * @return nuove righe numerate 1..n con citazioni aggiornate
     */
    public List<ProofLine> fix(List<ProofLine> lines) {
        Map<Integer, Integer> firstOccurrence = new HashMap<>();
        for (int index = 0; index < lines.size(); index++) {
            ProofLine line = lines.get(index);
            if (line.hasDisplayedNumber()) {
                firstOccurrence.putIfAbsent(line.getDisplayedNumber(), index + 1);
            }
        }

        Map<Integer, Integer> seenSoFar = new HashMap<>();
        List<ProofLine> fixed = new ArrayList<>();
        int changed = 0;

        for (int index = 0; index < lines.size(); index++) {
            ProofLine line = lines.get(index);
            int newNumber = index + 1;

            Map<Integer, Integer> mapping = new HashMap<>(firstOccurrence);
            mapping.putAll(seenSoFar);
            fixed.add(line.renumber(newNumber, mapping));

            if (!line.hasDisplayedNumber() || line.getDisplayedNumber() != newNumber) {
                changed++;
            }
            if (line.hasDisplayedNumber()) {
                seenSoFar.put(line.getDisplayedNumber(), newNumber);
            }
        }

        LOGGER.fine("Numerazione corretta: " + changed + " righe rinumerate");
        return fixed;
    }
}
