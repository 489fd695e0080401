package org.fitch.checker;

import org.fitch.proof.Citation;
import org.fitch.proof.Justification;
import org.fitch.proof.ProofLine;
import org.fitch.proof.Rule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * CHECKER - Verifica riga per riga di una dimostrazione Fitch
 *
 * Percorre le righe in ordine mantenendo lo {@link Scope} delle sottoprove aperte
 * e accumula tutti i difetti trovati, senza fermarsi al primo.
 *
 * PIPELINE PER OGNI RIGA:
 * 1. Aggiornamento dello stack delle sottoprove (apertura, chiusura, sorelle)
 * 2. Controlli strutturali su premesse e assunzioni
 * 3. Risoluzione delle citazioni per numero scritto dall'autore, con verifica
 *    di esistenza, precedenza e visibilità
 * 4. Controllo della forma richiesta dalla regola ({@link RuleValidator})
 *
 * CONTROLLI GLOBALI:
 * • Numerazione: numeri mancanti, fuori sequenza o duplicati
 * • Dimostrazione che termina dentro una sottoprova
 *
 * Ogni istanza verifica una sola dimostrazione; il checker è rientrante perché
 * tutto lo stato vive nella singola chiamata a {@link #check}.
 */
public final class ProofChecker {

    private static final Logger LOGGER = Logger.getLogger(ProofChecker.class.getName());

    private ProofChecker() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTO DI INGRESSO

    /**
     * Verifica una dimostrazione già analizzata.
     *
     * @param lines righe della dimostrazione nell'ordine del documento
     * @return errori rilevati, lista vuota se la dimostrazione è corretta
     */
    public static List<CheckError> check(List<ProofLine> lines) {
        List<CheckError> errors = new ArrayList<>();
        if (lines.isEmpty()) {
            errors.add(CheckError.global("The proof is empty"));
            return errors;
        }

        checkNumbering(lines, errors);

        Map<Integer, List<Integer>> indicesByNumber = indexByDisplayedNumber(lines);
        Scope scope = new Scope();
        RuleValidator validator = new RuleValidator(lines, scope);
        boolean seenNonPremise = false;

        for (int index = 0; index < lines.size(); index++) {
            ProofLine line = lines.get(index);
            Justification justification = line.getJustification();
            Scope.Transition transition = scope.advance(index, line.getDepth(), justification.isAssumption());

            if (transition == Scope.Transition.OPENED_WITHOUT_ASSUMPTION) {
                errors.add(CheckError.at(line, "A subproof must start with an assumption, but this line is justified by "
                        + justification.getRuleName()));
            }

            switch (justification.getKind()) {
                case PREMISE -> checkPremise(line, seenNonPremise, errors);
                case ASSUMPTION -> checkAssumption(line, transition, errors);
                case RULE -> checkRuleLine(line, index, lines, indicesByNumber, scope, validator, errors);
            }

            if (!justification.isPremise()) {
                seenNonPremise = true;
            }
        }

        if (lines.get(lines.size() - 1).getDepth() > 0) {
            errors.add(CheckError.global("The proof ends inside a subproof; the last line must not be in a box"));
        }

        LOGGER.fine("Verifica completata: " + lines.size() + " righe, " + errors.size() + " errori");
        return errors;
    }

    //endregion

    //region NUMERAZIONE

    /**
     * Il numero scritto deve coincidere con la posizione della riga (a partire da 1).
     */
    private static void checkNumbering(List<ProofLine> lines, List<CheckError> errors) {
        Map<Integer, Integer> occurrences = new LinkedHashMap<>();

        for (int index = 0; index < lines.size(); index++) {
            ProofLine line = lines.get(index);
            int expected = index + 1;

            if (!line.hasDisplayedNumber()) {
                errors.add(CheckError.at(line, "Line number is missing (expected " + expected + ")"));
                continue;
            }

            int stated = line.getDisplayedNumber();
            occurrences.merge(stated, 1, Integer::sum);
            if (stated != expected) {
                errors.add(CheckError.at(line, "The stated line number " + stated
                        + " does not match its position in the proof (expected " + expected + ")"));
            }
        }

        for (Map.Entry<Integer, Integer> entry : occurrences.entrySet()) {
            if (entry.getValue() > 1) {
                errors.add(CheckError.global("Line number " + entry.getKey() + " is used "
                        + entry.getValue() + " times"));
            }
        }
    }

    private static Map<Integer, List<Integer>> indexByDisplayedNumber(List<ProofLine> lines) {
        Map<Integer, List<Integer>> indices = new HashMap<>();
        for (int index = 0; index < lines.size(); index++) {
            ProofLine line = lines.get(index);
            if (line.hasDisplayedNumber()) {
                indices.computeIfAbsent(line.getDisplayedNumber(), n -> new ArrayList<>()).add(index);
            }
        }
        return indices;
    }

    //endregion

    //region PREMESSE E ASSUNZIONI

    private static void checkPremise(ProofLine line, boolean seenNonPremise, List<CheckError> errors) {
        if (line.getDepth() > 0) {
            errors.add(CheckError.at(line, "A premise cannot be inside a subproof"));
        }
        if (seenNonPremise) {
            errors.add(CheckError.at(line, "Premises must come before all other lines"));
        }
        if (!line.getJustification().getCitations().isEmpty()) {
            errors.add(CheckError.at(line, "A premise does not cite other lines"));
        }
    }

    private static void checkAssumption(ProofLine line, Scope.Transition transition, List<CheckError> errors) {
        if (transition == Scope.Transition.ASSUMPTION_OUTSIDE_BOX) {
            errors.add(CheckError.at(line, "An assumption must open a new subproof"));
        }
        if (!line.getJustification().getCitations().isEmpty()) {
            errors.add(CheckError.at(line, "An assumption does not cite other lines"));
        }
    }

    //endregion

    //region RIGHE GIUSTIFICATE DA REGOLE

    private static void checkRuleLine(ProofLine line, int index, List<ProofLine> lines,
                                      Map<Integer, List<Integer>> indicesByNumber, Scope scope,
                                      RuleValidator validator, List<CheckError> errors) {
        Justification justification = line.getJustification();
        Rule rule = justification.getRule();
        if (rule == null) {
            errors.add(CheckError.at(line, "Unknown rule '" + justification.getRuleName() + "'"));
            return;
        }

        List<CitedItem> cited = new ArrayList<>();
        boolean resolved = true;
        for (Citation citation : justification.getCitations()) {
            try {
                cited.add(resolve(citation, index, lines, indicesByNumber, scope));
            } catch (RuleViolation e) {
                errors.add(CheckError.at(line, e.getMessage()));
                resolved = false;
            }
        }
        if (!resolved) {
            return;
        }

        try {
            validator.validate(rule, line, cited);
        } catch (RuleViolation e) {
            LOGGER.finest("Riga " + line.getDisplayedNumber() + " non valida: " + e.getMessage());
            errors.add(CheckError.at(line, e.getMessage()));
        }
    }

    //endregion

    //region RISOLUZIONE CITAZIONI

    /**
     * Risolve una citazione contro le righe già processate.
     *
     * @throws RuleViolation se il riferimento non esiste, non precede la riga
     *         corrente o non è visibile da essa
     */
    private static CitedItem resolve(Citation citation, int currentIndex, List<ProofLine> lines,
                                     Map<Integer, List<Integer>> indicesByNumber, Scope scope) throws RuleViolation {
        if (!citation.isRange()) {
            int target = resolveNumber(citation.getLine(), currentIndex, indicesByNumber);
            if (!scope.isLineVisible(target, currentIndex)) {
                throw new RuleViolation("Line " + citation.getLine()
                        + " is inside a closed subproof and cannot be cited here");
            }
            return CitedItem.line(citation, lines.get(target));
        }

        int first = resolveNumber(citation.getStart(), currentIndex, indicesByNumber);
        int last = resolveNumber(citation.getEnd(), currentIndex, indicesByNumber);
        Box box = scope.findBox(first, last);
        if (box == null) {
            throw new RuleViolation("Lines " + citation + " do not form a subproof");
        }
        if (scope.endsInsideNestedBox(box)) {
            throw new RuleViolation("Lines " + citation + " do not form a subproof: line " + citation.getEnd()
                    + " is inside a nested subproof that was never discharged");
        }
        if (!box.isClosed()) {
            throw new RuleViolation("The subproof " + citation + " is still open and cannot be cited as a whole");
        }
        if (!scope.isBoxVisible(box, currentIndex)) {
            throw new RuleViolation("The subproof " + citation + " is inside a closed subproof and cannot be cited here");
        }
        return CitedItem.box(citation, box, lines.get(first), lines.get(last));
    }

    /**
     * Traduce un numero scritto dall'autore nella posizione di una riga precedente.
     * Con numeri duplicati vale l'ultima occorrenza prima della riga corrente.
     */
    private static int resolveNumber(int number, int currentIndex, Map<Integer, List<Integer>> indicesByNumber)
            throws RuleViolation {
        List<Integer> candidates = indicesByNumber.get(number);
        if (candidates == null) {
            throw new RuleViolation("Line " + number + " does not exist");
        }

        int resolved = -1;
        for (int candidate : candidates) {
            if (candidate < currentIndex) {
                resolved = candidate;
            }
        }
        if (resolved >= 0) {
            return resolved;
        }
        if (candidates.contains(currentIndex)) {
            throw new RuleViolation("A line cannot cite itself (line " + number + ")");
        }
        throw new RuleViolation("Line " + number + " comes after this line and cannot be cited");
    }

    //endregion
}
