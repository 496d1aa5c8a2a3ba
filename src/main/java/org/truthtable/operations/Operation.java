package org.truthtable.operations;

import org.truthtable.parser.FormulaParser;
import org.truthtable.parser.FormulaSyntaxException;
import org.truthtable.syntax.Formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * OPERAZIONE SEMANTICA - Base comune delle operazioni invocabili da riga di input
 *
 * Una riga ha la forma generale:
 *     SIMBOLO,argomento1,argomento2,...
 * già privata degli spazi. Ogni operazione sa estrarre i propri argomenti dalla riga
 * e calcolare il risultato; gli insiemi di formule sono scritti tra parentesi quadre.
 */
public abstract class Operation {

    protected static final char ARGUMENT_SEPARATOR = ',';
    protected static final char SET_OPEN = '[';
    protected static final char SET_CLOSE = ']';

    /** Simbolo che identifica l'operazione nelle righe di input */
    public abstract String symbol();

    /**
     * Calcola il risultato sugli argomenti testuali estratti dalla riga.
     *
     * @throws FormulaSyntaxException se un argomento non è una formula ben formata
     * @throws IllegalArgumentException se il numero di argomenti è errato
     */
    public abstract OperationResult perform(List<String> arguments);

    /**
     * Esegue l'operazione su una riga completa, simbolo incluso.
     */
    public OperationResult execute(String line) {
        return perform(parseArguments(line));
    }

    /**
     * Estrazione generica: valori separati da virgola, simbolo escluso.
     */
    public List<String> parseArguments(String line) {
        String body = argumentsOf(line);
        return Arrays.asList(body.split(String.valueOf(ARGUMENT_SEPARATOR), -1));
    }

    /**
     * Restituisce la parte della riga che segue "SIMBOLO,".
     *
     * @throws IllegalArgumentException se la riga non inizia con il simbolo dell'operazione
     */
    protected String argumentsOf(String line) {
        String prefix = symbol() + ARGUMENT_SEPARATOR;
        if (line == null || !line.startsWith(prefix)) {
            throw new IllegalArgumentException("Riga non valida per l'operazione " + symbol() + ": " + line);
        }
        return line.substring(prefix.length());
    }

    /**
     * Divide il contenuto di un insieme "[f1,f2,...]" nei suoi elementi testuali.
     * L'insieme vuoto "[]" produce un solo elemento vuoto.
     *
     * @throws IllegalArgumentException se il testo non è racchiuso tra parentesi quadre
     */
    protected static List<String> splitSet(String set) {
        if (set.length() < 2 || set.charAt(0) != SET_OPEN || set.charAt(set.length() - 1) != SET_CLOSE) {
            throw new IllegalArgumentException("Insieme di formule non racchiuso tra parentesi quadre: " + set);
        }
        String content = set.substring(1, set.length() - 1);
        return Arrays.asList(content.split(String.valueOf(ARGUMENT_SEPARATOR), -1));
    }

    /**
     * Analizza gli elementi di un insieme di formule.
     *
     * Un insieme composto da un solo elemento vuoto rappresenta l'insieme vuoto;
     * un insieme che mescola elementi vuoti e non vuoti è rifiutato.
     *
     * @throws FormulaSyntaxException se un elemento non è valido o l'insieme è misto
     */
    protected static List<Formula> parseFormulaSet(List<String> elements) {
        if (isEmptySet(elements)) {
            return List.of();
        }
        List<Formula> formulas = new ArrayList<>(elements.size());
        for (String element : elements) {
            if (element.isEmpty()) {
                throw new FormulaSyntaxException("Insieme con elementi vuoti e non vuoti",
                        String.join(String.valueOf(ARGUMENT_SEPARATOR), elements));
            }
            formulas.add(FormulaParser.parse(element));
        }
        return formulas;
    }

    protected static boolean isEmptySet(List<String> elements) {
        return elements.isEmpty() || (elements.size() == 1 && elements.get(0).isEmpty());
    }

    protected void requireArgumentCount(List<String> arguments, int expected) {
        if (arguments.size() != expected) {
            throw new IllegalArgumentException("L'operazione " + symbol() + " richiede " + expected
                    + " argomenti, ricevuti " + arguments.size() + ": " + arguments);
        }
    }
}
