package org.fitch.proof;

import org.fitch.formula.ExpressionParser;
import org.fitch.formula.Formula;
import org.fitch.formula.FormulaParseException;
import org.fitch.formula.VariableNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PARSER STRUTTURA DIMOSTRAZIONE - Dal testo Fitch alla sequenza di {@link ProofLine}
 *
 * Ogni riga di testo significativa ha la forma:
 *
 *   [numero] [barre] formula [giustificazione]
 *
 *   1 | P ∧ Q        [Premise]
 *     |---
 *   2 | | R          [Assumption]
 *   3 | | P          [∧ Elim: 1]
 *   4 | R → P        [→ Intro: 2-3]
 *
 * REGOLE DI SEGMENTAZIONE:
 * • Righe vuote e separatori (solo barre, '-', '_') vengono ignorati
 * • La profondità è il numero di barre; se tutte le righe hanno la barra di
 *   margine, questa non conta come livello
 * • La giustificazione è il testo tra le ultime parentesi quadre; in alternativa
 *   sono ammesse le parentesi tonde finali, se il contenuto ha la forma di una
 *   giustificazione e non di una sottoformula
 * • Le citazioni sono numeri singoli o intervalli "a-b" separati da virgole
 *
 * ERRORI FATALI:
 * • Riga senza forma riconoscibile, formula non valida, citazione illeggibile
 * • Profondità che aumenta di più di un livello tra due righe consecutive
 * • Dimostrazione vuota
 *
 * Le citazioni a righe inesistenti NON sono errori di parsing: vengono lasciate
 * al checker, che le segnala riga per riga.
 */
public final class ProofParser {

    private static final Logger LOGGER = Logger.getLogger(ProofParser.class.getName());

    private static final Pattern SEPARATOR_ROW = Pattern.compile("[\\s|_\\-]*");

    private static final Pattern PROOF_ROW = Pattern.compile(
            "\\s*(?:(\\d+)\\s*\\.?)?\\s*((?:\\|\\s*)*)([^\\[\\]]*?)\\s*\\[([^\\[\\]]*)]\\s*");

    /** Forma alternativa con la giustificazione tra parentesi tonde: "2. P ∨ Q (∨ Intro: 1)" */
    private static final Pattern PAREN_ROW = Pattern.compile(
            "\\s*(?:(\\d+)\\s*\\.?)?\\s*((?:\\|\\s*)*)(.*?)\\s*\\(([^()\\[\\]]*)\\)\\s*");

    private static final Pattern SINGLE_CITATION = Pattern.compile("\\d+");
    private static final Pattern RANGE_CITATION = Pattern.compile("(\\d+)\\s*[-–]\\s*(\\d+)");

    /** Nome di regola seguito da citazioni senza i due punti: "∧ Elim 1, 2" */
    private static final Pattern TRAILING_CITATIONS = Pattern.compile("(.*?\\D)\\s+(\\d[\\d\\s,\\-–]*)");

    private static final Set<String> PREMISE_NAMES = Set.of("premise", "premiss", "pr");
    private static final Set<String> ASSUMPTION_NAMES = Set.of("assumption", "assume", "ass", "hyp", "hypothesis");

    private final VariableNames variables;

    public ProofParser(VariableNames variables) {
        if (variables == null) {
            throw new IllegalArgumentException("Insieme di variabili null");
        }
        this.variables = variables;
    }

    //region PUNTO DI INGRESSO

    /**
     * Analizza l'intero testo della dimostrazione.
     *
     * @param proofText testo completo, una riga di dimostrazione per riga di testo
     * @return righe della dimostrazione nell'ordine del documento
     * @throws ProofParseException se il testo non può essere ridotto a una struttura valida
     */
    public List<ProofLine> parse(String proofText) throws ProofParseException {
        if (proofText == null) {
            throw new ProofParseException("The proof is empty", 0);
        }

        List<RawRow> rows = segmentRows(proofText);
        if (rows.isEmpty()) {
            throw new ProofParseException("The proof is empty", 0);
        }

        // La barra di margine conta solo se usata in tutte le righe
        boolean marginBar = rows.stream().allMatch(row -> row.bars > 0);

        List<ProofLine> lines = new ArrayList<>();
        int previousDepth = 0;
        for (RawRow row : rows) {
            int depth = marginBar ? row.bars - 1 : row.bars;
            if (depth > previousDepth + 1) {
                throw new ProofParseException("Line " + row.realLine + " opens more than one subproof at once"
                        + " (depth " + previousDepth + " to " + depth + ")", row.realLine);
            }

            Formula formula = parseFormula(row);
            Justification justification = parseJustification(row);
            lines.add(new ProofLine(row.number, row.realLine, formula, justification, depth));
            previousDepth = depth;
        }

        LOGGER.fine("Dimostrazione analizzata: " + lines.size() + " righe");
        return lines;
    }

    //endregion

    //region SEGMENTAZIONE RIGHE

    private List<RawRow> segmentRows(String proofText) throws ProofParseException {
        List<RawRow> rows = new ArrayList<>();
        String[] textLines = proofText.split("\\r?\\n", -1);

        for (int i = 0; i < textLines.length; i++) {
            int realLine = i + 1;
            String text = textLines[i];

            if (SEPARATOR_ROW.matcher(text).matches()) {
                continue;
            }

            Matcher matcher = PROOF_ROW.matcher(text);
            if (!matcher.matches()) {
                matcher = PAREN_ROW.matcher(text);
                if (matcher.matches() && !isParenthesizedJustification(matcher, text)) {
                    LOGGER.finest("Parentesi finali della riga " + realLine + " non sono una giustificazione");
                    matcher = null;
                }
            }
            if (matcher == null || !matcher.matches() || matcher.group(3).isBlank()) {
                throw new ProofParseException("Could not parse line " + realLine + ": expected"
                        + " '<number> | <formula> [<justification>]' but found '" + text.trim() + "'", realLine);
            }

            Integer number = parseNumber(matcher.group(1), realLine);
            int bars = countBars(matcher.group(2));
            rows.add(new RawRow(realLine, number, bars, matcher.group(3).trim(), matcher.group(4).trim()));
        }
        return rows;
    }

    private static Integer parseNumber(String digits, int realLine) throws ProofParseException {
        if (digits == null) {
            return null;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ProofParseException("Line number '" + digits + "' on line " + realLine + " is too large",
                    realLine, e);
        }
    }

    private static int countBars(String barText) {
        int bars = 0;
        for (char c : barText.toCharArray()) {
            if (c == '|') {
                bars++;
            }
        }
        return bars;
    }

    //endregion

    //region FORMULE E GIUSTIFICAZIONI

    private Formula parseFormula(RawRow row) throws ProofParseException {
        try {
            return ExpressionParser.parse(row.formulaText, variables);
        } catch (FormulaParseException e) {
            throw new ProofParseException("Line " + row.realLine + ": " + e.getMessage(), row.realLine, e);
        }
    }

    /**
     * Separa nome e citazioni e classifica la giustificazione.
     */
    private Justification parseJustification(RawRow row) throws ProofParseException {
        String text = row.justificationText;
        if (text.isEmpty()) {
            throw new ProofParseException("Line " + row.realLine + " has an empty justification", row.realLine);
        }

        String[] parts = splitJustification(text);
        String name = parts[0];
        String citationText = parts[1];

        if (name.isEmpty()) {
            throw new ProofParseException("Line " + row.realLine + " has a justification without a rule name",
                    row.realLine);
        }

        List<Citation> citations = parseCitations(citationText, row.realLine);
        return Justification.of(classify(name), name, citations);
    }

    /**
     * Divide la giustificazione in nome della regola e testo delle citazioni.
     */
    private static String[] splitJustification(String text) {
        int colon = text.indexOf(':');
        if (colon >= 0) {
            return new String[] {text.substring(0, colon).trim(), text.substring(colon + 1).trim()};
        }
        Matcher trailing = TRAILING_CITATIONS.matcher(text);
        if (trailing.matches()) {
            return new String[] {trailing.group(1).trim(), trailing.group(2).trim()};
        }
        return new String[] {text.trim(), ""};
    }

    /**
     * Decide se le parentesi tonde finali contengono una giustificazione e non gli
     * argomenti o una sottoformula della formula.
     *
     * Sono una giustificazione se contengono i due punti, un nome seguito da
     * citazioni o un nome noto. Altrimenti solo se sono separate dalla formula da
     * uno spazio e il contenuto non è una formula né una lista di argomenti: in
     * questo caso il nome sconosciuto arriva al checker come errore di riga.
     */
    private boolean isParenthesizedJustification(Matcher matcher, String text) {
        String content = matcher.group(4).trim();
        if (content.isEmpty()) {
            return false;
        }
        if (content.indexOf(':') >= 0 || TRAILING_CITATIONS.matcher(content).matches() || isKnownName(content)) {
            return true;
        }

        int beforeParenthesis = matcher.start(4) - 2;
        boolean separated = beforeParenthesis >= 0 && Character.isWhitespace(text.charAt(beforeParenthesis));
        return separated && content.indexOf(',') < 0 && !isFormula(content);
    }

    private static boolean isKnownName(String content) {
        return classify(content) != Justification.Kind.RULE || Rule.lookup(content) != null;
    }

    private boolean isFormula(String text) {
        try {
            ExpressionParser.parse(text, variables);
            return true;
        } catch (FormulaParseException e) {
            LOGGER.finest("'" + text + "' non è una formula: " + e.getMessage());
            return false;
        }
    }

    private static Justification.Kind classify(String name) {
        String normalized = Rule.normalize(name);
        if (PREMISE_NAMES.contains(normalized)) {
            return Justification.Kind.PREMISE;
        }
        if (ASSUMPTION_NAMES.contains(normalized)) {
            return Justification.Kind.ASSUMPTION;
        }
        return Justification.Kind.RULE;
    }

    private static List<Citation> parseCitations(String text, int realLine) throws ProofParseException {
        List<Citation> citations = new ArrayList<>();
        if (text.isEmpty()) {
            return citations;
        }

        for (String part : text.split(",", -1)) {
            String item = part.trim();
            Matcher range = RANGE_CITATION.matcher(item);
            try {
                if (SINGLE_CITATION.matcher(item).matches()) {
                    citations.add(Citation.line(Integer.parseInt(item)));
                } else if (range.matches()) {
                    citations.add(Citation.range(Integer.parseInt(range.group(1)), Integer.parseInt(range.group(2))));
                } else {
                    throw new ProofParseException("Could not parse citation '" + item + "' on line " + realLine,
                            realLine);
                }
            } catch (NumberFormatException e) {
                throw new ProofParseException("Citation '" + item + "' on line " + realLine + " is too large",
                        realLine, e);
            }
        }
        return citations;
    }

    //endregion

    /**
     * Riga di testo segmentata ma non ancora interpretata.
     */
    private record RawRow(int realLine, Integer number, int bars, String formulaText, String justificationText) {}
}
