package org.fitch.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Insieme dei nomi riconosciuti come variabili.
 *
 * Ogni identificatore che non appartiene all'insieme è trattato come simbolo di
 * predicato o costante. La configurazione testuale è una lista separata da virgole,
 * ad esempio "x, y, z".
 */
public final class VariableNames {

    private static final Logger LOGGER = Logger.getLogger(VariableNames.class.getName());

    /** Variabili usate quando il chiamante non ne specifica altre */
    public static final String DEFAULT_CONFIGURATION = "x,y,z,u,v,w";

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_']*");

    private final Set<String> names;

    private VariableNames(Set<String> names) {
        this.names = Collections.unmodifiableSet(names);
    }

    /**
     * Analizza la configurazione testuale delle variabili ammesse.
     *
     * @param configuration lista separata da virgole, spazi ammessi
     * @return insieme di variabili validato
     * @throws IllegalArgumentException se la lista è vuota o contiene nomi non validi
     */
    public static VariableNames parse(String configuration) {
        if (configuration == null || configuration.isBlank()) {
            throw new IllegalArgumentException("Invalid variable name configuration: no variable names given");
        }

        Set<String> names = new LinkedHashSet<>();
        for (String entry : configuration.split(",", -1)) {
            String name = entry.trim();
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid variable name configuration: '" + name
                        + "' is not a valid variable name");
            }
            names.add(name);
        }

        LOGGER.fine("Variabili ammesse: " + names);
        return new VariableNames(names);
    }

    public static VariableNames of(String... names) {
        return parse(String.join(",", names));
    }

    public static VariableNames defaults() {
        return parse(DEFAULT_CONFIGURATION);
    }

    public boolean isVariable(String identifier) {
        return names.contains(identifier);
    }

    public Set<String> asSet() {
        return names;
    }

    @Override
    public String toString() {
        return String.join(",", names);
    }
}
