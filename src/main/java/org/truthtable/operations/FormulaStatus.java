package org.truthtable.operations;

/**
 * Stato semantico di una formula, con l'etichetta usata nei risultati testuali.
 */
public enum FormulaStatus {

    TAUTOLOGY("TAUTOLOGIA"),            // Vera in ogni valutazione
    CONTRADICTION("CONTRADICAO"),       // Falsa in ogni valutazione
    CONTINGENCY("CONTINGENCIA");        // Vera in alcune valutazioni, falsa in altre

    private final String label;

    FormulaStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
