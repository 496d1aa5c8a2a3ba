package org.truthtable.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.truthtable.antlr.PropositionalFormulaLexer;
import org.truthtable.antlr.PropositionalFormulaParser;
import org.truthtable.syntax.Alphabet;
import org.truthtable.syntax.Formula;
import org.truthtable.syntax.Parenthesis;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Punto di ingresso per la conversione testo -> {@link Formula}
 *
 * PIPELINE:
 * 1. Controllo alfabeto: ogni carattere deve appartenere a [a-z0-9&|><()-]
 * 2. Controllo bilanciamento parentesi
 * 3. Lexing e parsing ANTLR, con fallimento immediato al primo errore
 * 4. Visita del parse tree e costruzione dell'albero della formula
 *
 * Gli spazi non fanno parte dell'alfabeto e vengono rifiutati: la rimozione
 * degli spazi, quando desiderata, è compito di chi legge le righe di input.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Analizza una formula nella notazione di superficie.
     *
     * @param text formula da analizzare
     * @return albero della formula
     * @throws FormulaSyntaxException se il testo non è una formula ben formata
     */
    public static Formula parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new FormulaSyntaxException("Formula vuota", String.valueOf(text));
        }

        int rejected = Alphabet.firstRejectedChar(text);
        if (rejected >= 0) {
            throw new FormulaSyntaxException("Carattere non ammesso '" + text.charAt(rejected) + "'",
                    text, rejected);
        }

        if (!Parenthesis.isBalanced(text)) {
            throw new FormulaSyntaxException("Parentesi non bilanciate", text);
        }

        LOGGER.fine("Parsing formula: " + text);

        SyntaxErrorListener errorListener = new SyntaxErrorListener(text);

        PropositionalFormulaLexer lexer = new PropositionalFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        PropositionalFormulaParser parser = new PropositionalFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        return new FormulaTreeVisitor(text).visit(tree);
    }

    /**
     * Variante che non lancia eccezioni, per controlli di validità.
     */
    public static boolean isWellFormed(String text) {
        try {
            parse(text);
            return true;
        } catch (FormulaSyntaxException e) {
            return false;
        }
    }
}
