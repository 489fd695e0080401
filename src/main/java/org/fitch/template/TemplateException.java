package org.fitch.template;

/**
 * Il modello dell'esercizio non è utilizzabile: vuoto o con formule non valide.
 */
public class TemplateException extends Exception {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
