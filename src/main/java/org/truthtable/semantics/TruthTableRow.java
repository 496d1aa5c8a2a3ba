package org.truthtable.semantics;

import java.util.List;

/**
 * Riga della tabella di verità: una valutazione e i valori delle formule tracciate,
 * nell'ordine in cui le formule sono state fornite.
 *
 * @param index posizione della riga nell'enumerazione canonica
 * @param valuation valutazione della riga
 * @param results valori delle formule tracciate
 */
public record TruthTableRow(int index, Valuation valuation, List<Boolean> results) {

    public TruthTableRow {
        results = List.copyOf(results);
    }

    public boolean result(int formulaIndex) {
        return results.get(formulaIndex);
    }

    /** Vero se tutte le formule tracciate valgono vero */
    public boolean allTrue() {
        return !results.contains(Boolean.FALSE);
    }
}
