package org.fitch.proof;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Giustificazione di una riga: premessa, assunzione oppure regola con citazioni.
 *
 * Il nome della regola è conservato così come scritto: un nome sconosciuto non
 * impedisce l'analisi della dimostrazione ma produce un errore di riga nel checker.
 */
public final class Justification {

    public enum Kind {
        PREMISE,
        ASSUMPTION,
        RULE
    }

    private final Kind kind;
    private final String ruleName;
    private final Rule rule;
    private final List<Citation> citations;

    private Justification(Kind kind, String ruleName, Rule rule, List<Citation> citations) {
        if (citations == null || citations.contains(null)) {
            throw new IllegalArgumentException("Lista citazioni non valida: " + citations);
        }
        this.kind = kind;
        this.ruleName = ruleName;
        this.rule = rule;
        this.citations = List.copyOf(citations);
    }

    public static Justification premise() {
        return new Justification(Kind.PREMISE, "Premise", null, List.of());
    }

    public static Justification assumption() {
        return new Justification(Kind.ASSUMPTION, "Assumption", null, List.of());
    }

    /**
     * Premessa o assunzione che cita comunque delle righe: la struttura viene
     * conservata e il checker segnala le citazioni superflue.
     */
    static Justification of(Kind kind, String name, List<Citation> citations) {
        if (kind == Kind.RULE) {
            return rule(name, citations);
        }
        return new Justification(kind, kind == Kind.PREMISE ? "Premise" : "Assumption", null, citations);
    }

    /**
     * Crea una giustificazione per regola, risolvendo il nome tramite {@link Rule#lookup}.
     */
    public static Justification rule(String ruleName, List<Citation> citations) {
        if (ruleName == null) {
            throw new IllegalArgumentException("Nome regola null");
        }
        return new Justification(Kind.RULE, ruleName.trim(), Rule.lookup(ruleName), citations);
    }

    public static Justification rule(Rule rule, Citation... citations) {
        return new Justification(Kind.RULE, rule.getDisplayName(), rule, List.of(citations));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isPremise() {
        return kind == Kind.PREMISE;
    }

    public boolean isAssumption() {
        return kind == Kind.ASSUMPTION;
    }

    /** Nome come scritto dall'autore. */
    public String getRuleName() {
        return ruleName;
    }

    /** Regola riconosciuta, null per premesse, assunzioni e nomi sconosciuti. */
    public Rule getRule() {
        return rule;
    }

    public List<Citation> getCitations() {
        return citations;
    }

    /**
     * Stessa giustificazione con le citazioni rinumerate.
     */
    public Justification renumber(Map<Integer, Integer> mapping) {
        List<Citation> renumbered = new ArrayList<>();
        for (Citation citation : citations) {
            renumbered.add(citation.renumber(mapping));
        }
        return new Justification(kind, ruleName, rule, renumbered);
    }

    /**
     * Forma canonica, ad esempio "∧ Elim: 1" o "→ Intro: 2-4".
     * Le regole sconosciute mantengono il nome originale.
     */
    @Override
    public String toString() {
        String name = rule != null ? rule.getDisplayName() : ruleName;
        if (citations.isEmpty()) {
            return name;
        }
        List<String> rendered = new ArrayList<>();
        for (Citation citation : citations) {
            rendered.add(citation.toString());
        }
        return name + ": " + String.join(", ", rendered);
    }
}
