package org.fitch.checker;

import org.fitch.formula.Formula;

import java.util.ArrayList;
import java.util.List;

/**
 * CONDIZIONI DI FRESCHEZZA - Predicati sulle istanze arbitrarie dei quantificatori
 *
 * Tenuti separati dal confronto strutturale delle regole: una regola sui
 * quantificatori può avere la forma giusta ed essere comunque scorretta perché
 * il termine istanziato non è arbitrario.
 *
 * • ∀ Intro: il termine c non compare libero nella conclusione, nelle premesse
 *   né nelle assunzioni delle sottoprove aperte
 * • ∃ Elim: il termine c non compare libero nella conclusione, nella formula
 *   esistenziale citata né in alcuna riga precedente visibile dalla sottoprova
 */
public final class FreshnessConditions {

    private FreshnessConditions() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param term termine che sostituisce la variabile quantificata
     * @param conclusion formula ∀x ψ introdotta
     * @param premises formule delle premesse
     * @param openAssumptions assunzioni delle sottoprove aperte alla riga corrente
     * @return true se il termine è arbitrario
     */
    public static boolean isFreshForUniversalIntro(String term, Formula conclusion,
                                                   List<Formula> premises, List<Formula> openAssumptions) {
        return firstOccurrence(term, universalIntroContext(conclusion, premises, openAssumptions)) == null;
    }

    /**
     * @param term termine introdotto dall'assunzione della sottoprova
     * @param conclusion formula derivata dalla sottoprova e riportata fuori
     * @param existential formula ∃x ψ citata
     * @param outsideLines formule delle righe precedenti visibili dalla sottoprova
     * @return true se il termine è arbitrario
     */
    public static boolean isFreshForExistentialElim(String term, Formula conclusion, Formula existential,
                                                    List<Formula> outsideLines) {
        return firstOccurrence(term, existentialElimContext(conclusion, existential, outsideLines)) == null;
    }

    static List<Formula> universalIntroContext(Formula conclusion, List<Formula> premises,
                                               List<Formula> openAssumptions) {
        List<Formula> context = new ArrayList<>();
        context.add(conclusion);
        context.addAll(premises);
        context.addAll(openAssumptions);
        return context;
    }

    static List<Formula> existentialElimContext(Formula conclusion, Formula existential, List<Formula> outsideLines) {
        List<Formula> context = new ArrayList<>();
        context.add(conclusion);
        context.add(existential);
        context.addAll(outsideLines);
        return context;
    }

    /**
     * Prima formula del contesto in cui il termine compare libero.
     *
     * @return formula trovata, oppure null se il termine non compare
     */
    static Formula firstOccurrence(String term, List<Formula> context) {
        for (Formula formula : context) {
            if (formula.occursFree(term)) {
                return formula;
            }
        }
        return null;
    }
}
