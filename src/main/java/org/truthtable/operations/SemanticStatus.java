package org.truthtable.operations;

import org.truthtable.parser.FormulaParser;
import org.truthtable.semantics.Interpreter;
import org.truthtable.semantics.TruthTable;
import org.truthtable.syntax.Formula;

import java.util.List;
import java.util.logging.Logger;

/**
 * Verifica lo stato semantico di una formula: tautologia, contraddizione o contingenza.
 *
 * Riga di input: S,formula
 */
public class SemanticStatus extends Operation {

    private static final Logger LOGGER = Logger.getLogger(SemanticStatus.class.getName());

    public static final String SYMBOL = "S";

    @Override
    public String symbol() {
        return SYMBOL;
    }

    @Override
    public OperationResult perform(List<String> arguments) {
        requireArgumentCount(arguments, 1);
        return evaluate(arguments.get(0));
    }

    public StatusResult evaluate(String formula) {
        return evaluate(FormulaParser.parse(formula));
    }

    public StatusResult evaluate(Formula formula) {
        TruthTable table = Interpreter.buildTable(formula);
        FormulaStatus status = classify(table.column(0));
        LOGGER.fine("Stato di " + formula + ": " + status);
        return new StatusResult(status, table);
    }

    /**
     * Classifica una colonna di valori: tautologia se solo veri, contraddizione se solo falsi,
     * contingenza altrimenti (colonna vuota inclusa).
     */
    public static FormulaStatus classify(List<Boolean> values) {
        boolean anyTrue = values.contains(Boolean.TRUE);
        boolean anyFalse = values.contains(Boolean.FALSE);

        if (anyTrue && !anyFalse) {
            return FormulaStatus.TAUTOLOGY;
        }
        if (anyFalse && !anyTrue) {
            return FormulaStatus.CONTRADICTION;
        }
        return FormulaStatus.CONTINGENCY;
    }
}
