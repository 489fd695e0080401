package org.fitch.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * FORMULA - Albero immutabile di una formula della logica dei predicati
 *
 * Rappresenta le formule del calcolo di deduzione naturale come albero tipizzato,
 * con un nodo per ciascun connettivo e un'etichetta {@link Type} che ne distingue
 * la variante. Il confronto è strutturale: due formule sono uguali solo se hanno
 * la stessa forma, gli stessi nomi e le stesse variabili legate.
 *
 * VARIANTI:
 * • ATOM: predicato con eventuali argomenti (P, R(a, x))
 * • NOT: negazione (¬A)
 * • AND, OR, IMPLIES, IFF: connettivi binari
 * • FORALL, EXISTS: quantificatori con variabile legata
 * • BOTTOM: contraddizione (⊥)
 *
 * L'alfa-equivalenza NON è considerata: ∀x P(x) e ∀y P(y) sono formule diverse.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati nell'albero della formula.
     */
    public enum Type {
        ATOM,       // P, P(a, x)
        NOT,        // ¬A
        AND,        // A ∧ B
        OR,         // A ∨ B
        IMPLIES,    // A → B
        IFF,        // A ↔ B
        FORALL,     // ∀x A
        EXISTS,     // ∃x A
        BOTTOM      // ⊥
    }

    /** Livelli di precedenza usati per la stampa con parentesi minime */
    private static final int PREC_IFF = 1;
    private static final int PREC_IMPLIES = 2;
    private static final int PREC_OR = 3;
    private static final int PREC_AND = 4;
    private static final int PREC_UNARY = 5;
    private static final int PREC_ATOM = 6;

    private static final Formula BOTTOM_INSTANCE = new Formula(Type.BOTTOM, null, List.of(), null, null);

    private final Type type;

    /** Nome del predicato (ATOM) oppure variabile legata (FORALL, EXISTS) */
    private final String name;

    /** Argomenti del predicato, lista vuota per atomi proposizionali */
    private final List<String> arguments;

    /** Operando sinistro, unico operando per NOT e corpo per i quantificatori */
    private final Formula left;

    /** Operando destro dei connettivi binari */
    private final Formula right;

    private final int hash;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String name, List<String> arguments, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.arguments = arguments;
        this.left = left;
        this.right = right;
        this.hash = computeHash();
    }

    /**
     * Crea un atomo proposizionale o un predicato applicato a dei termini.
     *
     * @param predicate nome del predicato (non null, non vuoto)
     * @param arguments termini argomento (eventualmente vuota)
     * @throws IllegalArgumentException se il nome è vuoto o un argomento è null
     */
    public static Formula atom(String predicate, List<String> arguments) {
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("Nome del predicato non può essere null o vuoto");
        }
        if (arguments == null || arguments.contains(null)) {
            throw new IllegalArgumentException("Argomenti del predicato non validi: " + arguments);
        }
        return new Formula(Type.ATOM, predicate, List.copyOf(arguments), null, null);
    }

    public static Formula atom(String predicate, String... arguments) {
        return atom(predicate, List.of(arguments));
    }

    public static Formula not(Formula operand) {
        return new Formula(Type.NOT, null, List.of(), requireOperand(operand), null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    public static Formula forAll(String variable, Formula body) {
        return quantifier(Type.FORALL, variable, body);
    }

    public static Formula exists(String variable, Formula body) {
        return quantifier(Type.EXISTS, variable, body);
    }

    public static Formula bottom() {
        return BOTTOM_INSTANCE;
    }

    private static Formula binary(Type type, Formula left, Formula right) {
        return new Formula(type, null, List.of(), requireOperand(left), requireOperand(right));
    }

    private static Formula quantifier(Type type, String variable, Formula body) {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("Variabile quantificata non può essere null o vuota");
        }
        return new Formula(type, variable, List.of(), requireOperand(body), null);
    }

    private static Formula requireOperand(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando della formula non può essere null");
        }
        return operand;
    }

    //endregion

    //region ACCESSO AI COMPONENTI

    public Type getType() {
        return type;
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    /**
     * Nome del predicato per gli atomi.
     *
     * @throws IllegalStateException se il nodo non è un atomo
     */
    public String getPredicate() {
        requireType(Type.ATOM);
        return name;
    }

    public List<String> getArguments() {
        requireType(Type.ATOM);
        return arguments;
    }

    /**
     * Variabile legata di un quantificatore.
     *
     * @throws IllegalStateException se il nodo non è un quantificatore
     */
    public String getVariable() {
        if (!isQuantifier()) {
            throw new IllegalStateException("Nodo " + type + " non è un quantificatore");
        }
        return name;
    }

    /** Operando di una negazione. */
    public Formula getOperand() {
        requireType(Type.NOT);
        return left;
    }

    /** Corpo di un quantificatore. */
    public Formula getBody() {
        if (!isQuantifier()) {
            throw new IllegalStateException("Nodo " + type + " non è un quantificatore");
        }
        return left;
    }

    public Formula getLeft() {
        requireBinary();
        return left;
    }

    public Formula getRight() {
        requireBinary();
        return right;
    }

    public boolean isQuantifier() {
        return type == Type.FORALL || type == Type.EXISTS;
    }

    public boolean isBinary() {
        return type == Type.AND || type == Type.OR || type == Type.IMPLIES || type == Type.IFF;
    }

    private void requireType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Atteso nodo " + expected + ", trovato " + type);
        }
    }

    private void requireBinary() {
        if (!isBinary()) {
            throw new IllegalStateException("Nodo " + type + " non è un connettivo binario");
        }
    }

    //endregion

    //region NOMI LIBERI

    /**
     * Raccoglie i nomi che compaiono liberi come argomenti di predicati: costanti
     * e variabili non legate da un quantificatore che le racchiude.
     *
     * @return insieme dei nomi liberi in ordine di apparizione
     */
    public Set<String> freeNames() {
        Set<String> names = new LinkedHashSet<>();
        collectFreeNames(new HashSet<>(), names);
        return Collections.unmodifiableSet(names);
    }

    /**
     * Verifica se un nome compare libero nella formula.
     */
    public boolean occursFree(String termName) {
        return freeNames().contains(termName);
    }

    private void collectFreeNames(Set<String> bound, Set<String> names) {
        switch (type) {
            case ATOM -> {
                for (String argument : arguments) {
                    if (!bound.contains(argument)) {
                        names.add(argument);
                    }
                }
            }
            case NOT -> left.collectFreeNames(bound, names);
            case AND, OR, IMPLIES, IFF -> {
                left.collectFreeNames(bound, names);
                right.collectFreeNames(bound, names);
            }
            case FORALL, EXISTS -> {
                Set<String> inner = new HashSet<>(bound);
                inner.add(name);
                left.collectFreeNames(inner, names);
            }
            case BOTTOM -> { /* nessun nome */ }
        }
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale: stessi nodi, stessi nomi, stesso ordine degli operandi.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type || this.hash != other.hash) return false;

        return switch (type) {
            case ATOM -> name.equals(other.name) && arguments.equals(other.arguments);
            case NOT -> left.equals(other.left);
            case AND, OR, IMPLIES, IFF -> left.equals(other.left) && right.equals(other.right);
            case FORALL, EXISTS -> name.equals(other.name) && left.equals(other.left);
            case BOTTOM -> true;
        };
    }

    @Override
    public int hashCode() {
        return hash;
    }

    private int computeHash() {
        int result = type.hashCode();
        switch (type) {
            case ATOM -> result = 31 * (31 * result + name.hashCode()) + arguments.hashCode();
            case NOT -> result = 31 * result + left.hashCode();
            case AND, OR, IMPLIES, IFF -> result = 31 * (31 * result + left.hashCode()) + right.hashCode();
            case FORALL, EXISTS -> result = 31 * (31 * result + name.hashCode()) + left.hashCode();
            case BOTTOM -> { /* hash del solo tipo */ }
        }
        return result;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione con connettivi Unicode e parentesi minime.
     *
     * La stringa prodotta, riletta da {@link ExpressionParser}, restituisce una
     * formula uguale a questa: ∧ e ∨ associano a sinistra, → e ↔ a destra.
     *
     * @return formula in notazione leggibile, ad esempio "∀x (P(x) → Q(x))"
     */
    @Override
    public String toString() {
        return render(Notation.UNICODE);
    }

    /**
     * Rappresentazione LaTeX della formula, con le stesse regole di parentesi.
     */
    public String toLatex() {
        return render(Notation.LATEX);
    }

    private String render(Notation notation) {
        StringBuilder out = new StringBuilder();
        appendTo(out, notation);
        return out.toString();
    }

    private void appendTo(StringBuilder out, Notation notation) {
        switch (type) {
            case ATOM -> {
                out.append(notation == Notation.LATEX ? latexName(name) : name);
                if (!arguments.isEmpty()) {
                    List<String> rendered = new ArrayList<>();
                    for (String argument : arguments) {
                        rendered.add(notation == Notation.LATEX ? latexName(argument) : argument);
                    }
                    out.append('(').append(String.join(", ", rendered)).append(')');
                }
            }
            case BOTTOM -> out.append(notation.bottom);
            case NOT -> {
                out.append(notation.not);
                appendOperand(out, notation, left, left.precedence() < PREC_UNARY);
            }
            case FORALL, EXISTS -> {
                out.append(type == Type.FORALL ? notation.forAll : notation.exists)
                        .append(notation == Notation.LATEX ? latexName(name) : name)
                        .append(' ');
                appendOperand(out, notation, left, left.precedence() < PREC_UNARY);
            }
            case AND, OR, IMPLIES, IFF -> {
                int own = precedence();
                boolean rightAssociative = type == Type.IMPLIES || type == Type.IFF;

                // Lo stesso operatore sul lato "sbagliato" richiede parentesi
                boolean leftParens = left.precedence() < own || (rightAssociative && left.precedence() == own);
                boolean rightParens = right.precedence() < own || (!rightAssociative && right.precedence() == own);

                appendOperand(out, notation, left, leftParens);
                out.append(' ').append(notation.binary(type)).append(' ');
                appendOperand(out, notation, right, rightParens);
            }
        }
    }

    private static void appendOperand(StringBuilder out, Notation notation, Formula operand, boolean parens) {
        if (parens) {
            out.append('(');
            operand.appendTo(out, notation);
            out.append(')');
        } else {
            operand.appendTo(out, notation);
        }
    }

    private int precedence() {
        return switch (type) {
            case IFF -> PREC_IFF;
            case IMPLIES -> PREC_IMPLIES;
            case OR -> PREC_OR;
            case AND -> PREC_AND;
            case NOT, FORALL, EXISTS -> PREC_UNARY;
            case ATOM, BOTTOM -> PREC_ATOM;
        };
    }

    private static String latexName(String identifier) {
        return identifier.replace("_", "\\_");
    }

    /**
     * Simboli dei connettivi per ciascuna notazione di output.
     */
    private enum Notation {
        UNICODE("¬", "∧", "∨", "→", "↔", "∀", "∃", "⊥"),
        LATEX("\\neg ", "\\land", "\\lor", "\\to", "\\leftrightarrow", "\\forall ", "\\exists ", "\\bot");

        final String not;
        final String and;
        final String or;
        final String implies;
        final String iff;
        final String forAll;
        final String exists;
        final String bottom;

        Notation(String not, String and, String or, String implies, String iff,
                 String forAll, String exists, String bottom) {
            this.not = not;
            this.and = and;
            this.or = or;
            this.implies = implies;
            this.iff = iff;
            this.forAll = forAll;
            this.exists = exists;
            this.bottom = bottom;
        }

        String binary(Type type) {
            return switch (type) {
                case AND -> and;
                case OR -> or;
                case IMPLIES -> implies;
                case IFF -> iff;
                default -> throw new IllegalStateException("Connettivo non binario: " + type);
            };
        }
    }

    //endregion
}
