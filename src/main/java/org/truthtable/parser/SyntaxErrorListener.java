package org.truthtable.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.logging.Logger;

/**
 * Listener ANTLR che trasforma ogni errore di lexer o parser in {@link FormulaSyntaxException}.
 * Sostituisce i listener di default, che stamperebbero su console e tenterebbero il recupero.
 */
class SyntaxErrorListener extends BaseErrorListener {

    private static final Logger LOGGER = Logger.getLogger(SyntaxErrorListener.class.getName());

    private final String text;

    SyntaxErrorListener(String text) {
        this.text = text;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        LOGGER.fine("Errore di sintassi in colonna " + charPositionInLine + ": " + msg);
        throw new FormulaSyntaxException("Formula malformata: " + msg, text, charPositionInLine);
    }
}
