package org.truthtable.operations;

import org.truthtable.semantics.TruthTable;

/**
 * Esito di un'operazione a risposta sì/no (equivalenza, consistenza, conseguenza logica).
 */
public record DecisionResult(boolean verdict, TruthTable table) implements OperationResult {

    public static final String YES = "SIM";
    public static final String NO = "NAO";

    @Override
    public String label() {
        return verdict ? YES : NO;
    }

    @Override
    public String toString() {
        return format();
    }
}
