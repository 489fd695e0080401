package org.fitch.checker;

import java.util.List;
import java.util.Objects;

/**
 * RISULTATO VERIFICA - Esito immutabile di una verifica di dimostrazione
 *
 * Tre esiti mutuamente esclusivi:
 * • CORRECT: ogni riga è giustificata correttamente
 * • ERROR: la struttura è valida ma almeno una riga fallisce la verifica
 * • FATAL: il testo (o la configurazione) non è riducibile a una struttura
 *
 * La lista degli errori è sempre completa: la verifica non si ferma al primo difetto.
 */
public final class ProofResult {

    public enum Outcome {
        CORRECT,
        ERROR,
        FATAL
    }

    private static final ProofResult CORRECT = new ProofResult(Outcome.CORRECT, List.of(), null);

    private final Outcome outcome;
    private final List<CheckError> errors;
    private final String fatalMessage;

    private ProofResult(Outcome outcome, List<CheckError> errors, String fatalMessage) {
        this.outcome = outcome;
        this.errors = errors;
        this.fatalMessage = fatalMessage;
    }

    //region FACTORY METHODS

    public static ProofResult correct() {
        return CORRECT;
    }

    /**
     * Risultato per una dimostrazione con difetti.
     *
     * @param errors difetti rilevati (non null, non vuota)
     * @throws IllegalArgumentException se la lista è vuota: una verifica senza
     *         difetti deve usare {@link #correct()}
     */
    public static ProofResult errors(List<CheckError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("Risultato ERROR richiede almeno un errore");
        }
        return new ProofResult(Outcome.ERROR, List.copyOf(errors), null);
    }

    /**
     * Correct se la lista è vuota, altrimenti Error.
     */
    public static ProofResult fromErrors(List<CheckError> errors) {
        return errors.isEmpty() ? correct() : errors(errors);
    }

    public static ProofResult fatal(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Risultato FATAL richiede un messaggio");
        }
        return new ProofResult(Outcome.FATAL, List.of(), message);
    }

    //endregion

    //region ACCESSO

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isCorrect() {
        return outcome == Outcome.CORRECT;
    }

    public boolean isFatal() {
        return outcome == Outcome.FATAL;
    }

    public List<CheckError> getErrors() {
        return errors;
    }

    /**
     * @throws IllegalStateException se il risultato non è FATAL
     */
    public String getFatalMessage() {
        if (outcome != Outcome.FATAL) {
            throw new IllegalStateException("Risultato " + outcome + " non ha messaggio fatale");
        }
        return fatalMessage;
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        ProofResult other = (ProofResult) obj;
        return outcome == other.outcome && errors.equals(other.errors)
                && Objects.equals(fatalMessage, other.fatalMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, errors, fatalMessage);
    }

    @Override
    public String toString() {
        return switch (outcome) {
            case CORRECT -> "CORRECT";
            case ERROR -> "ERROR" + errors;
            case FATAL -> "FATAL[" + fatalMessage + "]";
        };
    }
}
