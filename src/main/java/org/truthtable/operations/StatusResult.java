package org.truthtable.operations;

import org.truthtable.semantics.TruthTable;

/**
 * Esito della verifica dello stato semantico di una formula.
 */
public record StatusResult(FormulaStatus status, TruthTable table) implements OperationResult {

    @Override
    public String label() {
        return status.label();
    }

    @Override
    public String toString() {
        return format();
    }
}
