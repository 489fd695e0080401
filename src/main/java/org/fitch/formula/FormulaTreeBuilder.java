package org.fitch.formula;

import org.fitch.antlr.FitchFormulaBaseVisitor;
import org.fitch.antlr.FitchFormulaParser.AndContext;
import org.fitch.antlr.FitchFormulaParser.AtomicContext;
import org.fitch.antlr.FitchFormulaParser.BottomContext;
import org.fitch.antlr.FitchFormulaParser.ExistsContext;
import org.fitch.antlr.FitchFormulaParser.ForallContext;
import org.fitch.antlr.FitchFormulaParser.FormulaContext;
import org.fitch.antlr.FitchFormulaParser.IffContext;
import org.fitch.antlr.FitchFormulaParser.ImpliesContext;
import org.fitch.antlr.FitchFormulaParser.NotContext;
import org.fitch.antlr.FitchFormulaParser.OrContext;
import org.fitch.antlr.FitchFormulaParser.ParContext;
import org.fitch.antlr.FitchFormulaParser.PredicateContext;
import org.fitch.antlr.FitchFormulaParser.TermContext;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO FORMULE - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa il visitor della grammatica FitchFormula trasformando ogni contesto
 * nel nodo corrispondente, con precedenze e associatività già risolte dalla grammatica.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Bicondizionale (↔): associativo a destra
 * - Implicazione (→): associativo a destra
 * - Disgiunzione (∨): associativo a sinistra
 * - Congiunzione (∧): associativo a sinistra
 * - Negazione (¬) e quantificatori (∀, ∃): prefissi sull'operando immediato
 * - Atomi, ⊥ e parentesi
 *
 * CLASSIFICAZIONE IDENTIFICATORI:
 * - Un identificatore è una variabile solo se appartiene a {@link VariableNames}
 * - Le variabili non possono essere usate come predicati né come formule
 * - I quantificatori possono legare solo variabili
 */
class FormulaTreeBuilder extends FitchFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    private final VariableNames variables;
    private final String sourceText;

    FormulaTreeBuilder(VariableNames variables, String sourceText) {
        this.variables = variables;
        this.sourceText = sourceText;
    }

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.biconditional());
        LOGGER.finest("Formula costruita: " + formula);
        return formula;
    }

    //endregion

    //region CONNETTIVI BINARI

    /**
     * Gestisce il bicondizionale, associativo a destra: A ↔ B ↔ C = A ↔ (B ↔ C).
     */
    @Override
    public Formula visitIff(IffContext ctx) {
        Formula left = visit(ctx.implication());
        if (ctx.IFF() == null) {
            return left;
        }
        return Formula.iff(left, visit(ctx.biconditional()));
    }

    /**
     * Gestisce l'implicazione, associativa a destra: A → B → C = A → (B → C).
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }
        return Formula.implies(antecedent, visit(ctx.implication()));
    }

    /**
     * Gestisce le disgiunzioni, ripiegate a sinistra: A ∨ B ∨ C = (A ∨ B) ∨ C.
     */
    @Override
    public Formula visitOr(OrContext ctx) {
        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = Formula.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    /**
     * Gestisce le congiunzioni, ripiegate a sinistra come le disgiunzioni.
     */
    @Override
    public Formula visitAnd(AndContext ctx) {
        Formula result = visit(ctx.unary(0));
        for (int i = 1; i < ctx.unary().size(); i++) {
            result = Formula.and(result, visit(ctx.unary(i)));
        }
        return result;
    }

    //endregion

    //region OPERATORI PREFISSI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.unary()));
    }

    @Override
    public Formula visitForall(ForallContext ctx) {
        String variable = requireBindableVariable(ctx.IDENTIFIER().getText());
        return Formula.forAll(variable, visit(ctx.unary()));
    }

    @Override
    public Formula visitExists(ExistsContext ctx) {
        String variable = requireBindableVariable(ctx.IDENTIFIER().getText());
        return Formula.exists(variable, visit(ctx.unary()));
    }

    @Override
    public Formula visitAtomic(AtomicContext ctx) {
        return visit(ctx.atom());
    }

    //endregion

    //region ATOMI E PARENTESI

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public Formula visitBottom(BottomContext ctx) {
        return Formula.bottom();
    }

    /**
     * Gestisce predicati e atomi proposizionali.
     * Il nome del predicato non può essere una variabile ammessa.
     */
    @Override
    public Formula visitPredicate(PredicateContext ctx) {
        String predicate = ctx.IDENTIFIER().getText();
        if (variables.isVariable(predicate)) {
            throw new FormulaParseException("'" + predicate + "' is a variable and cannot be used as a predicate"
                    + " in '" + sourceText + "'", sourceText);
        }

        List<String> arguments = new ArrayList<>();
        for (TermContext term : ctx.term()) {
            arguments.add(term.IDENTIFIER().getText());
        }
        return Formula.atom(predicate, arguments);
    }

    //endregion

    private String requireBindableVariable(String name) {
        if (!variables.isVariable(name)) {
            throw new FormulaParseException("'" + name + "' is not an allowed variable name (allowed: "
                    + variables + ") in '" + sourceText + "'", sourceText);
        }
        return name;
    }
}
