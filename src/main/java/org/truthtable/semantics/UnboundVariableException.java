package org.truthtable.semantics;

/**
 * Violazione di invariante: la valutazione ha incontrato una variabile assente dalla valutazione.
 * Indica un errore nella raccolta delle variabili, mai un errore dell'utente.
 */
public class UnboundVariableException extends IllegalStateException {

    private final String variable;

    public UnboundVariableException(String variable) {
        super("Variabile non assegnata nella valutazione: " + variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
