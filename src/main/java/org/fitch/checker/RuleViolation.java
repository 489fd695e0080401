package org.fitch.checker;

/**
 * Una riga non rispetta la forma richiesta dalla regola citata.
 * Il messaggio è il testo dell'errore mostrato all'autore.
 */
class RuleViolation extends Exception {

    RuleViolation(String message) {
        super(message);
    }
}
