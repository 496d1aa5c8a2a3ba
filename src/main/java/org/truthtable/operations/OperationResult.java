package org.truthtable.operations;

import org.truthtable.semantics.TruthTable;

/**
 * Esito di un'operazione semantica: un verdetto e la tabella da cui è stato ricavato.
 */
public interface OperationResult {

    /** Etichetta testuale del verdetto */
    String label();

    /** Tabella completa usata per il verdetto */
    TruthTable table();

    /**
     * Formato di output: [ETICHETTA, [tabella]]
     */
    default String format() {
        return "[" + label() + ", [" + table().render() + "]]";
    }
}
