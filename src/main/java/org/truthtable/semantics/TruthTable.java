package org.truthtable.semantics;

import org.truthtable.syntax.Formula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * TABELLA DI VERITÀ - Risultato immutabile della valutazione esaustiva
 *
 * Contiene l'universo ordinato delle variabili, le formule tracciate e una riga per
 * ciascuna delle 2^n valutazioni, nell'ordine canonico prodotto da {@link Interpreter}.
 *
 * INSIEMI DI MODELLI:
 * Un insieme di modelli è l'insieme degli indici di riga in cui una formula (o tutte
 * le formule di un insieme) vale vero. Gli insiemi sono ricalcolati a ogni richiesta.
 */
public final class TruthTable {

    private static final String TRUE_MARK = "V";
    private static final String FALSE_MARK = "F";

    private final List<String> variables;
    private final List<Formula> formulas;
    private final List<TruthTableRow> rows;

    TruthTable(List<String> variables, List<Formula> formulas, List<TruthTableRow> rows) {
        this.variables = List.copyOf(variables);
        this.formulas = List.copyOf(formulas);
        this.rows = List.copyOf(rows);
    }

    //region ACCESSO AI DATI

    public List<String> variables() {
        return variables;
    }

    public List<Formula> formulas() {
        return formulas;
    }

    public List<TruthTableRow> rows() {
        return rows;
    }

    public TruthTableRow row(int index) {
        return rows.get(index);
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Posizione della formula tra quelle tracciate (uguaglianza strutturale).
     *
     * @throws IllegalArgumentException se la formula non è tracciata dalla tabella
     */
    public int indexOf(Formula formula) {
        int index = formulas.indexOf(formula);
        if (index < 0) {
            throw new IllegalArgumentException("Formula non presente nella tabella: " + formula);
        }
        return index;
    }

    /**
     * Colonna dei valori di una formula, una voce per riga.
     */
    public List<Boolean> column(int formulaIndex) {
        List<Boolean> column = new ArrayList<>(rows.size());
        for (TruthTableRow row : rows) {
            column.add(row.result(formulaIndex));
        }
        return Collections.unmodifiableList(column);
    }

    public List<Boolean> column(Formula formula) {
        return column(indexOf(formula));
    }

    //endregion

    //region INSIEMI DI MODELLI

    /** Tutti gli indici di riga */
    public Set<Integer> allRows() {
        Set<Integer> all = new TreeSet<>();
        for (TruthTableRow row : rows) {
            all.add(row.index());
        }
        return Collections.unmodifiableSet(all);
    }

    /**
     * Indici delle righe in cui la formula tracciata vale vero.
     */
    public Set<Integer> modelsOf(int formulaIndex) {
        Set<Integer> models = new TreeSet<>();
        for (TruthTableRow row : rows) {
            if (row.result(formulaIndex)) {
                models.add(row.index());
            }
        }
        return Collections.unmodifiableSet(models);
    }

    /**
     * @throws IllegalArgumentException se la formula non è tracciata dalla tabella
     */
    public Set<Integer> modelsOf(Formula formula) {
        return modelsOf(indexOf(formula));
    }

    /**
     * Indici delle righe in cui tutte le formule indicate valgono vero.
     * Per un insieme vuoto di formule sono tutte le righe (verità vacua).
     *
     * @throws IllegalArgumentException se una formula non è tracciata dalla tabella
     */
    public Set<Integer> commonModels(Collection<Formula> selected) {
        Set<Integer> common = new TreeSet<>(allRows());
        for (Formula formula : selected) {
            common.retainAll(modelsOf(formula));
        }
        return Collections.unmodifiableSet(common);
    }

    /** Modelli comuni a tutte le formule tracciate */
    public Set<Integer> commonModels() {
        return commonModels(formulas);
    }

    //endregion

    //region RESA TESTUALE

    /**
     * Rende la tabella come intestazione seguita da una riga per valutazione.
     *
     * ESEMPIO per p|-p:
     * [p, p|-p], [V, V], [F, V]
     */
    public String render() {
        StringJoiner table = new StringJoiner(", ");

        StringJoiner header = new StringJoiner(", ", "[", "]");
        variables.forEach(header::add);
        formulas.forEach(formula -> header.add(formula.render()));
        table.add(header.toString());

        for (TruthTableRow row : rows) {
            StringJoiner line = new StringJoiner(", ", "[", "]");
            for (String variable : variables) {
                line.add(mark(row.valuation().valueOf(variable)));
            }
            for (Boolean result : row.results()) {
                line.add(mark(result));
            }
            table.add(line.toString());
        }
        return table.toString();
    }

    private static String mark(boolean value) {
        return value ? TRUE_MARK : FALSE_MARK;
    }

    @Override
    public String toString() {
        return render();
    }

    //endregion
}
