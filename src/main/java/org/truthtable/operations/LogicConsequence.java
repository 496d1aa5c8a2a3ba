package org.truthtable.operations;

import org.truthtable.parser.FormulaParser;
import org.truthtable.semantics.Interpreter;
import org.truthtable.semantics.TruthTable;
import org.truthtable.syntax.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CONSEGUENZA LOGICA - Verifica se una formula segue da un insieme di premesse
 *
 * CASI:
 * - Premesse vuote: la formula è conseguenza sse è una tautologia, valutata sulla
 *   sua sola tabella
 * - Altrimenti: tabella condivisa su premesse e conclusione; la formula è conseguenza
 *   sse ogni riga che soddisfa tutte le premesse soddisfa anche la conclusione
 *
 * Riga di input: CL,[premessa1,premessa2,...],formula
 */
public class LogicConsequence extends Operation {

    private static final Logger LOGGER = Logger.getLogger(LogicConsequence.class.getName());

    public static final String SYMBOL = "CL";

    @Override
    public String symbol() {
        return SYMBOL;
    }

    /**
     * Restituisce gli elementi dell'insieme seguiti dalla conclusione come ultimo argomento.
     *
     * @throws IllegalArgumentException se manca l'insieme tra parentesi o la conclusione
     */
    @Override
    public List<String> parseArguments(String line) {
        String body = argumentsOf(line);
        int setEnd = body.lastIndexOf(SET_CLOSE);
        if (setEnd < 0 || setEnd + 1 >= body.length() || body.charAt(setEnd + 1) != ARGUMENT_SEPARATOR) {
            throw new IllegalArgumentException("Riga " + SYMBOL + " senza insieme di premesse o conclusione: " + line);
        }

        List<String> arguments = new ArrayList<>(splitSet(body.substring(0, setEnd + 1)));
        arguments.add(body.substring(setEnd + 2));
        return arguments;
    }

    @Override
    public OperationResult perform(List<String> arguments) {
        if (arguments.size() < 2) {
            throw new IllegalArgumentException("L'operazione " + SYMBOL + " richiede premesse e conclusione: " + arguments);
        }
        List<Formula> premises = parseFormulaSet(arguments.subList(0, arguments.size() - 1));
        Formula conclusion = FormulaParser.parse(arguments.get(arguments.size() - 1));
        return evaluate(premises, conclusion);
    }

    public DecisionResult evaluate(List<Formula> premises, Formula conclusion) {
        if (premises.isEmpty()) {
            return evaluateFromEmptySet(conclusion);
        }

        List<Formula> tracked = new ArrayList<>(premises);
        tracked.add(conclusion);
        TruthTable table = Interpreter.buildTable(tracked);

        Set<Integer> premiseModels = table.commonModels(premises);
        Set<Integer> conclusionModels = table.modelsOf(tracked.size() - 1);
        boolean consequence = conclusionModels.containsAll(premiseModels);

        LOGGER.fine(conclusion + " conseguenza di " + premises + ": " + consequence);
        return new DecisionResult(consequence, table);
    }

    /**
     * Conseguenza dell'insieme vuoto: la formula deve essere vera in ogni riga della propria tabella.
     */
    private DecisionResult evaluateFromEmptySet(Formula conclusion) {
        TruthTable table = Interpreter.buildTable(conclusion);
        boolean tautology = table.modelsOf(0).equals(table.allRows());

        LOGGER.fine(conclusion + " conseguenza dell'insieme vuoto: " + tautology);
        return new DecisionResult(tautology, table);
    }
}
