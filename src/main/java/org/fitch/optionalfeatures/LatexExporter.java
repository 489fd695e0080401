package org.fitch.optionalfeatures;

import org.fitch.proof.Citation;
import org.fitch.proof.Justification;
import org.fitch.proof.ProofLine;
import org.fitch.proof.Rule;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * ESPORTAZIONE LATEX - Dimostrazione nel formato del pacchetto fitch
 *
 *   \begin{nd}
 *     \hypo{1}{P \land Q}
 *     \open
 *     \hypo{2}{R}
 *     \have{3}{P} \by{$\land$E}{1}
 *     \close
 *     \have{4}{R \to P} \by{$\to$I}{2-3}
 *   \end{nd}
 *
 * Premesse e assunzioni diventano \hypo, le altre righe \have. Ogni ingresso in
 * una sottoprova apre un \open, ogni uscita un \close; un'assunzione allo stesso
 * livello della riga precedente chiude la sottoprova sorella e ne apre una nuova.
 */
public class LatexExporter {

    private static final Logger LOGGER = Logger.getLogger(LatexExporter.class.getName());

    private static final String INDENT = "  ";

    private static final Map<Rule, String> RULE_LABELS = new EnumMap<>(Rule.class);

    static {
        RULE_LABELS.put(Rule.AND_INTRO, "$\\land$I");
        RULE_LABELS.put(Rule.AND_ELIM, "$\\land$E");
        RULE_LABELS.put(Rule.OR_INTRO, "$\\lor$I");
        RULE_LABELS.put(Rule.OR_ELIM, "$\\lor$E");
        RULE_LABELS.put(Rule.IMPLIES_INTRO, "$\\to$I");
        RULE_LABELS.put(Rule.IMPLIES_ELIM, "$\\to$E");
        RULE_LABELS.put(Rule.IFF_INTRO, "$\\leftrightarrow$I");
        RULE_LABELS.put(Rule.IFF_ELIM, "$\\leftrightarrow$E");
        RULE_LABELS.put(Rule.NOT_INTRO, "$\\neg$I");
        RULE_LABELS.put(Rule.NOT_ELIM, "$\\neg$E");
        RULE_LABELS.put(Rule.DOUBLE_NOT_ELIM, "$\\neg\\neg$E");
        RULE_LABELS.put(Rule.BOTTOM_INTRO, "$\\bot$I");
        RULE_LABELS.put(Rule.BOTTOM_ELIM, "$\\bot$E");
        RULE_LABELS.put(Rule.FORALL_INTRO, "$\\forall$I");
        RULE_LABELS.put(Rule.FORALL_ELIM, "$\\forall$E");
        RULE_LABELS.put(Rule.EXISTS_INTRO, "$\\exists$I");
        RULE_LABELS.put(Rule.EXISTS_ELIM, "$\\exists$E");
        RULE_LABELS.put(Rule.REIT, "R");
    }

    /**
     * @param lines righe della dimostrazione
     * @return corpo LaTeX dall'apertura alla chiusura dell'ambiente nd
     */
    public String export(List<ProofLine> lines) {
        StringBuilder latex = new StringBuilder("\\begin{nd}\n");
        int depth = 0;

        for (int index = 0; index < lines.size(); index++) {
            ProofLine line = lines.get(index);
            Justification justification = line.getJustification();

            while (depth > line.getDepth()) {
                appendCommand(latex, depth, "\\close");
                depth--;
            }
            if (justification.isAssumption() && depth == line.getDepth() && depth > 0) {
                appendCommand(latex, depth, "\\close");
                appendCommand(latex, depth, "\\open");
            }
            while (depth < line.getDepth()) {
                depth++;
                appendCommand(latex, depth, "\\open");
            }

            appendCommand(latex, depth, renderLine(line, index + 1));
        }

        while (depth > 0) {
            appendCommand(latex, depth, "\\close");
            depth--;
        }
        latex.append("\\end{nd}\n");

        LOGGER.fine("Esportazione LaTeX completata: " + lines.size() + " righe");
        return latex.toString();
    }

    private static void appendCommand(StringBuilder latex, int depth, String command) {
        latex.append(INDENT.repeat(depth + 1)).append(command).append('\n');
    }

    private static String renderLine(ProofLine line, int position) {
        int label = line.hasDisplayedNumber() ? line.getDisplayedNumber() : position;
        Justification justification = line.getJustification();
        String formula = line.getFormula().toLatex();

        if (justification.isPremise() || justification.isAssumption()) {
            return "\\hypo{" + label + "}{" + formula + "}";
        }
        return "\\have{" + label + "}{" + formula + "} \\by{" + ruleLabel(justification) + "}{"
                + references(justification.getCitations()) + "}";
    }

    private static String ruleLabel(Justification justification) {
        Rule rule = justification.getRule();
        if (rule != null) {
            return RULE_LABELS.get(rule);
        }
        return escape(justification.getRuleName());
    }

    private static String references(List<Citation> citations) {
        List<String> rendered = new ArrayList<>();
        for (Citation citation : citations) {
            rendered.add(citation.toString());
        }
        return String.join(",", rendered);
    }

    /** Caratteri speciali di LaTeX nei nomi di regola sconosciuti. */
    private static String escape(String text) {
        return text.replace("\\", "\\textbackslash{}")
                .replace("_", "\\_")
                .replace("&", "\\&")
                .replace("%", "\\%")
                .replace("$", "\\$")
                .replace("#", "\\#");
    }
}
