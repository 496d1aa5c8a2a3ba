package org.truthtable.operations;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Smista le righe di input verso l'operazione indicata dal simbolo iniziale.
 *
 * Prima dello smistamento la riga viene privata di tutti gli spazi: il parser delle
 * formule non li accetta.
 */
public class OperationDispatcher {

    private static final Logger LOGGER = Logger.getLogger(OperationDispatcher.class.getName());

    private final Map<String, Operation> operations = new LinkedHashMap<>();

    /**
     * Dispatcher con le quattro operazioni standard: S, EQ, C, CL.
     */
    public OperationDispatcher() {
        register(new SemanticStatus());
        register(new SemanticEquivalence());
        register(new Consistency());
        register(new LogicConsequence());
    }

    /**
     * @throws IllegalArgumentException se il simbolo è già registrato
     */
    public final void register(Operation operation) {
        if (operations.putIfAbsent(operation.symbol(), operation) != null) {
            throw new IllegalArgumentException("Operazione già registrata: " + operation.symbol());
        }
    }

    public Set<String> symbols() {
        return Collections.unmodifiableSet(operations.keySet());
    }

    /**
     * Esegue una riga di input.
     *
     * @param line riga nella forma SIMBOLO,argomenti
     * @return risultato dell'operazione
     * @throws IllegalArgumentException se il simbolo è sconosciuto o gli argomenti sono errati
     * @throws org.truthtable.parser.FormulaSyntaxException se una formula è malformata
     */
    public OperationResult execute(String line) {
        if (line == null) {
            throw new IllegalArgumentException("Riga di input null");
        }
        String normalized = removeWhitespace(line);
        String symbol = symbolOf(normalized);

        Operation operation = operations.get(symbol);
        if (operation == null) {
            throw new IllegalArgumentException("Operazione sconosciuta: '" + symbol + "'");
        }

        LOGGER.fine("Esecuzione " + symbol + ": " + normalized);
        return operation.execute(normalized);
    }

    private static String symbolOf(String line) {
        int separator = line.indexOf(Operation.ARGUMENT_SEPARATOR);
        return separator < 0 ? line : line.substring(0, separator);
    }

    private static String removeWhitespace(String line) {
        StringBuilder builder = new StringBuilder(line.length());
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (!Character.isWhitespace(c)) {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
