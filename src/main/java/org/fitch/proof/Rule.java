package org.fitch.proof;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REGOLE DI INFERENZA - Insieme fisso delle regole di deduzione naturale in stile Fitch
 *
 * Ogni regola ha un nome canonico, usato nei messaggi e dal formattatore, e un
 * insieme di alias accettati nel testo della dimostrazione. Il confronto ignora
 * maiuscole e spazi: "∧ Intro", "and intro" e "&I" indicano la stessa regola.
 */
public enum Rule {

    AND_INTRO("∧ Intro"),
    AND_ELIM("∧ Elim"),
    OR_INTRO("∨ Intro"),
    OR_ELIM("∨ Elim"),
    IMPLIES_INTRO("→ Intro"),
    IMPLIES_ELIM("→ Elim"),
    IFF_INTRO("↔ Intro"),
    IFF_ELIM("↔ Elim"),
    NOT_INTRO("¬ Intro"),
    NOT_ELIM("¬ Elim"),
    DOUBLE_NOT_ELIM("¬¬ Elim"),
    BOTTOM_INTRO("⊥ Intro"),
    BOTTOM_ELIM("⊥ Elim"),
    FORALL_INTRO("∀ Intro"),
    FORALL_ELIM("∀ Elim"),
    EXISTS_INTRO("∃ Intro"),
    EXISTS_ELIM("∃ Elim"),
    REIT("Reit");

    private static final List<String> INTRO_SUFFIXES = List.of("intro", "i", "introduction");
    private static final List<String> ELIM_SUFFIXES = List.of("elim", "e", "elimination");

    private static final Map<String, Rule> BY_ALIAS = buildAliasTable();

    private final String displayName;

    Rule(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Cerca la regola corrispondente al nome scritto dall'autore.
     *
     * @param name nome come compare nella giustificazione
     * @return regola riconosciuta, oppure null se il nome è sconosciuto
     */
    public static Rule lookup(String name) {
        if (name == null) {
            return null;
        }
        return BY_ALIAS.get(normalize(name));
    }

    static String normalize(String name) {
        return name.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return displayName;
    }

    //region TABELLA ALIAS

    private static Map<String, Rule> buildAliasTable() {
        Map<String, Rule> table = new HashMap<>();

        registerPair(table, AND_INTRO, AND_ELIM, "∧", "&", "/\\", "and", "conj", "conjunction");
        registerPair(table, OR_INTRO, OR_ELIM, "∨", "\\/", "or", "disj", "disjunction");
        registerPair(table, IMPLIES_INTRO, IMPLIES_ELIM, "→", "->", "=>", "imp", "impl", "implies",
                "implication", "cond", "conditional");
        registerPair(table, IFF_INTRO, IFF_ELIM, "↔", "<->", "<=>", "iff", "bicond", "biconditional");
        registerPair(table, NOT_INTRO, NOT_ELIM, "¬", "~", "!", "not", "neg", "negation");
        registerPair(table, BOTTOM_INTRO, BOTTOM_ELIM, "⊥", "_|_", "bot", "bottom", "contradiction", "falsum");
        registerPair(table, FORALL_INTRO, FORALL_ELIM, "∀", "forall", "all", "univ", "universal");
        registerPair(table, EXISTS_INTRO, EXISTS_ELIM, "∃", "exists", "exist", "existential");

        for (String prefix : List.of("¬¬", "~~", "!!", "notnot", "doubleneg", "doublenegation")) {
            for (String suffix : ELIM_SUFFIXES) {
                register(table, prefix + suffix, DOUBLE_NOT_ELIM);
            }
        }
        register(table, "dne", DOUBLE_NOT_ELIM);

        for (String alias : List.of("reit", "reiteration", "r", "rep", "repeat", "repetition")) {
            register(table, alias, REIT);
        }
        return table;
    }

    private static void registerPair(Map<String, Rule> table, Rule intro, Rule elim, String... prefixes) {
        for (String prefix : prefixes) {
            for (String suffix : INTRO_SUFFIXES) {
                register(table, prefix + suffix, intro);
            }
            for (String suffix : ELIM_SUFFIXES) {
                register(table, prefix + suffix, elim);
            }
        }
    }

    private static void register(Map<String, Rule> table, String alias, Rule rule) {
        Rule previous = table.put(normalize(alias), rule);
        if (previous != null && previous != rule) {
            throw new IllegalStateException("Alias '" + alias + "' assegnato sia a " + previous + " che a " + rule);
        }
    }

    //endregion

    /**
     * Nomi canonici di tutte le regole, per i messaggi di aiuto.
     */
    public static List<String> displayNames() {
        List<String> names = new ArrayList<>();
        for (Rule rule : values()) {
            names.add(rule.displayName);
        }
        return names;
    }
}
