package org.fitch.formula;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RICONOSCIMENTO ISTANZE - Verifica che una formula sia un'istanza ψ[x:=t] di un'altra
 *
 * Usato dalle regole sui quantificatori: invece di indovinare il termine t e poi
 * sostituire, percorre in parallelo il corpo ψ e la formula candidata e ricava t
 * dalle posizioni in cui ψ contiene x libera.
 *
 * REGOLE DEL CONFRONTO:
 * • Ogni occorrenza libera di x nel corpo deve corrispondere allo stesso termine t
 * • Le occorrenze di x legate da un quantificatore interno restano x
 * • t non deve essere catturato da un quantificatore interno (∀t ... x ...)
 * • Tutto il resto deve coincidere strutturalmente
 *
 * Il candidato può contenere t anche in posizioni dove il corpo ha già t: il
 * confronto accetta quindi generalizzazioni parziali, come richiesto da ∃ Intro.
 */
public final class InstanceMatcher {

    private static final Logger LOGGER = Logger.getLogger(InstanceMatcher.class.getName());

    private InstanceMatcher() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Esito del confronto tra corpo quantificato e istanza candidata.
     */
    public static final class Match {

        private static final Match FAILED = new Match(false, null);
        private static final Match VACUOUS = new Match(true, null);

        private final boolean matches;
        private final String term;

        private Match(boolean matches, String term) {
            this.matches = matches;
            this.term = term;
        }

        /** true se il candidato è un'istanza del corpo */
        public boolean matches() {
            return matches;
        }

        /** true se il corpo contiene x libera e il termine è stato determinato */
        public boolean hasTerm() {
            return term != null;
        }

        /**
         * Termine sostituito alla variabile.
         *
         * @throws IllegalStateException se il confronto è fallito o la quantificazione è vacua
         */
        public String getTerm() {
            if (term == null) {
                throw new IllegalStateException("Nessun termine istanziato");
            }
            return term;
        }
    }

    /**
     * Confronta il corpo di un quantificatore con una sua possibile istanza.
     *
     * @param body corpo ψ del quantificatore
     * @param variable variabile x legata dal quantificatore
     * @param candidate formula da riconoscere come ψ[x:=t]
     * @return esito del confronto con l'eventuale termine t
     */
    public static Match match(Formula body, String variable, Formula candidate) {
        MatchState state = new MatchState(variable);
        boolean matches = walk(body, candidate, new HashSet<>(), state);

        if (!matches) {
            LOGGER.finest("Nessuna istanza di " + body + " per " + variable + " in " + candidate);
            return Match.FAILED;
        }
        return state.term == null ? Match.VACUOUS : new Match(true, state.term);
    }

    private static boolean walk(Formula pattern, Formula candidate, Set<String> bound, MatchState state) {
        if (pattern.getType() != candidate.getType()) {
            return false;
        }

        return switch (pattern.getType()) {
            case BOTTOM -> true;
            case ATOM -> matchAtom(pattern, candidate, bound, state);
            case NOT -> walk(pattern.getOperand(), candidate.getOperand(), bound, state);
            case AND, OR, IMPLIES, IFF -> walk(pattern.getLeft(), candidate.getLeft(), bound, state)
                    && walk(pattern.getRight(), candidate.getRight(), bound, state);
            case FORALL, EXISTS -> {
                // Nessuna alfa-conversione: la variabile legata deve essere la stessa
                if (!pattern.getVariable().equals(candidate.getVariable())) {
                    yield false;
                }
                Set<String> inner = new HashSet<>(bound);
                inner.add(pattern.getVariable());
                yield walk(pattern.getBody(), candidate.getBody(), inner, state);
            }
        };
    }

    private static boolean matchAtom(Formula pattern, Formula candidate, Set<String> bound, MatchState state) {
        if (!pattern.getPredicate().equals(candidate.getPredicate())) {
            return false;
        }

        List<String> patternArgs = pattern.getArguments();
        List<String> candidateArgs = candidate.getArguments();
        if (patternArgs.size() != candidateArgs.size()) {
            return false;
        }

        for (int i = 0; i < patternArgs.size(); i++) {
            String expected = patternArgs.get(i);
            String actual = candidateArgs.get(i);

            boolean freeOccurrence = expected.equals(state.variable) && !bound.contains(expected);
            if (!freeOccurrence) {
                if (!expected.equals(actual)) {
                    return false;
                }
                continue;
            }

            // Cattura: il termine verrebbe legato da un quantificatore interno
            if (bound.contains(actual)) {
                return false;
            }
            if (state.term == null) {
                state.term = actual;
            } else if (!state.term.equals(actual)) {
                return false;
            }
        }
        return true;
    }

    private static final class MatchState {
        final String variable;
        String term;

        MatchState(String variable) {
            this.variable = variable;
        }
    }
}
