package org.truthtable.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * VALUTAZIONE - Assegnamento totale di valori di verità a un insieme fisso di variabili
 *
 * Immutabile; l'ordine delle variabili è quello dell'universo da cui è stata generata.
 */
public final class Valuation {

    private final Map<String, Boolean> values;

    /**
     * @param values assegnamento variabile -> valore (copiato, ordine preservato)
     * @throws IllegalArgumentException se contiene chiavi o valori null
     */
    public Valuation(Map<String, Boolean> values) {
        if (values == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }
        Map<String, Boolean> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Boolean> entry : values.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Assegnamento con variabile o valore null: " + values);
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /** Valutazione vuota, unica riga di una tabella senza variabili */
    public static Valuation empty() {
        return new Valuation(Map.of());
    }

    /**
     * @throws UnboundVariableException se la variabile non è assegnata
     */
    public boolean valueOf(String variable) {
        Boolean value = values.get(variable);
        if (value == null) {
            throw new UnboundVariableException(variable);
        }
        return value;
    }

    public boolean isAssigned(String variable) {
        return values.containsKey(variable);
    }

    public List<String> variables() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public Map<String, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Valuation)) return false;
        return values.equals(((Valuation) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
