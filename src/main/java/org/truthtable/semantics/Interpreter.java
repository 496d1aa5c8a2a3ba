package org.truthtable.semantics;

import org.truthtable.syntax.Formula;
import org.truthtable.syntax.PropositionalVariable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * INTERPRETE - Motore di valutazione per tabelle di verità
 *
 * PIPELINE DI COSTRUZIONE TABELLA:
 * 1. Raccolta dell'universo di variabili dalle sottoformule di tutti gli input
 * 2. Ordinamento deterministico delle variabili (lettera, poi indice numerico)
 * 3. Enumerazione delle 2^n valutazioni in ordine canonico
 * 4. Valutazione di ogni formula su ogni valutazione
 *
 * ORDINE CANONICO:
 * Contatore binario di ampiezza n in cui la prima variabile è il bit più significativo.
 * La riga 0 assegna vero a tutte le variabili; l'ultima variabile alterna a ogni riga.
 *
 * Tutte le operazioni sono funzioni pure sui parametri: nessuno stato condiviso.
 */
public final class Interpreter {

    private static final Logger LOGGER = Logger.getLogger(Interpreter.class.getName());

    /** Numero massimo di variabili distinte per tabella (2^20 righe) */
    public static final int MAX_VARIABLES = 20;

    private Interpreter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region UNIVERSO DELLE VARIABILI

    /**
     * Unione delle variabili delle formule, senza ripetizioni, in ordine naturale.
     * Lo stesso insieme di variabili produce sempre lo stesso ordine.
     */
    public static List<String> variablesOf(Collection<Formula> formulas) {
        Set<String> names = new LinkedHashSet<>();
        for (Formula formula : formulas) {
            for (Formula subformula : formula.subformulas()) {
                if (subformula.isAtom()) {
                    names.add(subformula.name());
                }
            }
        }
        List<String> ordered = new ArrayList<>(names);
        ordered.sort(PropositionalVariable::compareNames);
        return Collections.unmodifiableList(ordered);
    }

    //endregion

    //region ENUMERAZIONE DELLE VALUTAZIONI

    /**
     * Genera tutte le valutazioni sulle variabili indicate, in ordine canonico.
     * Senza variabili produce una sola valutazione, quella vuota.
     *
     * @throws IllegalArgumentException se le variabili superano {@link #MAX_VARIABLES}
     */
    public static List<Valuation> valuations(List<String> variables) {
        int n = variables.size();
        if (n > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili distinte: " + n
                    + " (massimo " + MAX_VARIABLES + ")");
        }

        int rowCount = 1 << n;
        List<Valuation> valuations = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            Map<String, Boolean> values = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                // Bit a 0 -> vero: la prima metà delle righe ha la prima variabile vera
                int bit = (row >> (n - 1 - i)) & 1;
                values.put(variables.get(i), bit == 0);
            }
            valuations.add(new Valuation(values));
        }
        return Collections.unmodifiableList(valuations);
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta la formula per ricorsione strutturale.
     *
     * FUNZIONI DI VERITÀ:
     * - -A: vero se A è falso
     * - A & B: vero se entrambi veri
     * - A | B: vero se almeno uno vero
     * - A -> B ~ -A | B
     * - A <-> B ~ (A -> B) & (B -> A)
     *
     * @throws UnboundVariableException se una variabile della formula non è assegnata
     */
    public static boolean evaluate(Formula formula, Valuation valuation) {
        return switch (formula.type()) {
            case ATOM -> valuation.valueOf(formula.name());
            case NOT -> !evaluate(formula.operand(), valuation);
            case AND -> evaluate(formula.left(), valuation) && evaluate(formula.right(), valuation);
            case OR -> evaluate(formula.left(), valuation) || evaluate(formula.right(), valuation);
            case IMPLIES -> !evaluate(formula.left(), valuation) || evaluate(formula.right(), valuation);
            case IFF -> evaluate(formula.left(), valuation) == evaluate(formula.right(), valuation);
        };
    }

    //endregion

    //region COSTRUZIONE TABELLA

    /**
     * Costruisce la tabella condivisa delle formule indicate.
     * I risultati di ogni riga seguono l'ordine delle formule in input.
     *
     * @throws IllegalArgumentException se l'universo supera {@link #MAX_VARIABLES}
     */
    public static TruthTable buildTable(List<Formula> formulas) {
        List<String> variables = variablesOf(formulas);
        LOGGER.fine("Costruzione tabella: " + formulas.size() + " formule, "
                + variables.size() + " variabili " + variables);

        List<Valuation> valuations = valuations(variables);
        List<TruthTableRow> rows = new ArrayList<>(valuations.size());
        for (int index = 0; index < valuations.size(); index++) {
            Valuation valuation = valuations.get(index);
            List<Boolean> results = new ArrayList<>(formulas.size());
            for (Formula formula : formulas) {
                results.add(evaluate(formula, valuation));
            }
            rows.add(new TruthTableRow(index, valuation, results));
        }

        LOGGER.finest("Tabella completata: " + rows.size() + " righe");
        return new TruthTable(variables, formulas, rows);
    }

    public static TruthTable buildTable(Formula... formulas) {
        return buildTable(Arrays.asList(formulas));
    }

    //endregion

    //region INTERROGAZIONE MODELLI

    /**
     * Indici delle righe in cui la formula vale vero.
     */
    public static Set<Integer> modelsOf(TruthTable table, Formula formula) {
        return table.modelsOf(formula);
    }

    /**
     * Indici delle righe in cui tutte le formule valgono vero; tutte le righe se l'insieme è vuoto.
     */
    public static Set<Integer> commonModels(TruthTable table, Collection<Formula> formulas) {
        return table.commonModels(formulas);
    }

    //endregion
}
