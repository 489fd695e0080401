package org.fitch.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.fitch.antlr.FitchFormulaLexer;
import org.fitch.antlr.FitchFormulaParser;

import java.util.logging.Logger;

/**
 * PARSER ESPRESSIONI LOGICHE - Dal testo all'albero {@link Formula}
 *
 * Pipeline: Lexing -> Parsing -> Visitor. Lexer e parser sono generati dalla
 * grammatica FitchFormula; gli errori di sintassi non vengono recuperati ma
 * interrompono l'analisi con una {@link FormulaParseException}.
 *
 * Funzione pura: nessuno stato condiviso tra invocazioni.
 */
public final class ExpressionParser {

    private static final Logger LOGGER = Logger.getLogger(ExpressionParser.class.getName());

    private ExpressionParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte il testo di un'espressione in un albero di formula.
     *
     * @param text espressione, ad esempio "∀x (P(x) → Q(x))"
     * @param variables nomi ammessi come variabili
     * @return formula costruita
     * @throws FormulaParseException se il testo non è una formula ben formata
     */
    public static Formula parse(String text, VariableNames variables) {
        if (text == null || text.isBlank()) {
            throw new FormulaParseException("Empty formula", text);
        }

        CharStream input = CharStreams.fromString(text);
        FitchFormulaLexer lexer = new FitchFormulaLexer(input);
        FailFastErrorListener errorListener = new FailFastErrorListener(text);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        FitchFormulaParser parser = new FitchFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaTreeBuilder(variables, text).visit(tree);

        LOGGER.fine("Espressione analizzata: '" + text + "' -> " + formula);
        return formula;
    }

    /**
     * Listener che trasforma il primo errore di lexer o parser in eccezione.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        private final String text;

        FailFastErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            throw new FormulaParseException("Could not parse formula '" + text + "' at position "
                    + (charPositionInLine + 1) + ": " + msg, text);
        }
    }
}
