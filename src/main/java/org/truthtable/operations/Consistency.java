package org.truthtable.operations;

import org.truthtable.semantics.Interpreter;
import org.truthtable.semantics.TruthTable;
import org.truthtable.syntax.Formula;

import java.util.List;
import java.util.logging.Logger;

/**
 * Verifica se un insieme di formule è consistente, cioè se esiste almeno una riga
 * della tabella condivisa in cui tutte le formule valgono vero.
 *
 * Riga di input: C,[formula1,formula2,...]
 */
public class Consistency extends Operation {

    private static final Logger LOGGER = Logger.getLogger(Consistency.class.getName());

    public static final String SYMBOL = "C";

    @Override
    public String symbol() {
        return SYMBOL;
    }

    /**
     * L'unico argomento è l'insieme tra parentesi quadre.
     */
    @Override
    public List<String> parseArguments(String line) {
        return splitSet(argumentsOf(line));
    }

    @Override
    public OperationResult perform(List<String> arguments) {
        return evaluate(parseFormulaSet(arguments));
    }

    /**
     * L'insieme vuoto è consistente: la tabella ha una sola riga, vacuamente soddisfatta.
     */
    public DecisionResult evaluate(List<Formula> formulas) {
        TruthTable table = Interpreter.buildTable(formulas);
        boolean consistent = !table.commonModels().isEmpty();

        LOGGER.fine("Insieme " + formulas + " consistente: " + consistent);
        return new DecisionResult(consistent, table);
    }
}
