package org.truthtable.operations;

import org.truthtable.parser.FormulaParser;
import org.truthtable.semantics.Interpreter;
import org.truthtable.semantics.TruthTable;
import org.truthtable.syntax.Formula;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Verifica se due formule sono semanticamente equivalenti: stessa tabella condivisa,
 * stessi insiemi di modelli (entrambe le inclusioni).
 *
 * Riga di input: EQ,formula1,formula2
 */
public class SemanticEquivalence extends Operation {

    private static final Logger LOGGER = Logger.getLogger(SemanticEquivalence.class.getName());

    public static final String SYMBOL = "EQ";

    @Override
    public String symbol() {
        return SYMBOL;
    }

    @Override
    public OperationResult perform(List<String> arguments) {
        requireArgumentCount(arguments, 2);
        return evaluate(arguments.get(0), arguments.get(1));
    }

    public DecisionResult evaluate(String first, String second) {
        return evaluate(FormulaParser.parse(first), FormulaParser.parse(second));
    }

    public DecisionResult evaluate(Formula first, Formula second) {
        TruthTable table = Interpreter.buildTable(first, second);

        // Per colonna e non per formula: le due formule possono coincidere
        Set<Integer> firstModels = table.modelsOf(0);
        Set<Integer> secondModels = table.modelsOf(1);
        boolean equivalent = secondModels.containsAll(firstModels) && firstModels.containsAll(secondModels);

        LOGGER.fine(first + " equivalente a " + second + ": " + equivalent);
        return new DecisionResult(equivalent, table);
    }
}
