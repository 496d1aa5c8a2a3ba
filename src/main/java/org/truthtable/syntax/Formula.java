package org.truthtable.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * FORMULA - Albero sintattico immutabile della logica proposizionale
 *
 * Ogni nodo è una variabile proposizionale (foglia) oppure un operatore che possiede
 * uno (negazione) o due (connettivi binari) sotto-alberi. L'albero non condivide nodi
 * e non ha cicli: viene costruito una sola volta dal parser e mai modificato.
 *
 * RESA TESTUALE (parentesizzazione minima):
 * Un figlio è scritto senza parentesi se è una variabile, oppure se il suo operatore
 * ha precedenza maggiore o uguale a quella del padre; altrimenti è racchiuso tra parentesi.
 * La regola non distingue il lato sinistro dal destro: p&(q&r) viene reso "p&q&r".
 *
 * ESEMPI:
 * - And(Or(p, q), r)  ~ "(p|q)&r"
 * - Or(And(p, q), r)  ~ "p&q|r"
 * - Not(Not(p))       ~ "--p"
 * - Not(And(p, q))    ~ "-(p&q)"
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo: uno per ciascun operatore più la foglia atomica.
     */
    public enum Type {
        ATOM(null),                         // Variabile: p, q1, ...
        NOT(Operator.NEGATION),             // -A
        AND(Operator.CONJUNCTION),          // A & B
        OR(Operator.DISJUNCTION),           // A | B
        IMPLIES(Operator.IMPLICATION),      // A -> B
        IFF(Operator.BIIMPLICATION);        // A <-> B

        private final Operator operator;

        Type(Operator operator) {
            this.operator = operator;
        }

        /** Operatore del nodo, null per le foglie */
        public Operator operator() {
            return operator;
        }

        public static Type of(Operator operator) {
            for (Type type : values()) {
                if (type.operator == operator) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Operatore non supportato: " + operator);
        }
    }

    private final Type type;

    /** Variabile (solo nodi ATOM) */
    private final PropositionalVariable variable;

    /** Primo operando: unico operando per NOT, operando sinistro per i binari */
    private final Formula left;

    /** Operando destro (solo nodi binari) */
    private final Formula right;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, PropositionalVariable variable, Formula left, Formula right) {
        this.type = type;
        this.variable = variable;
        this.left = left;
        this.right = right;
    }

    /**
     * @throws IllegalArgumentException se il nome non è una variabile valida
     */
    public static Formula variable(String name) {
        return new Formula(Type.ATOM, new PropositionalVariable(name), null, null);
    }

    public static Formula not(Formula operand) {
        return new Formula(Type.NOT, null, requireOperand(operand), null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Operator.CONJUNCTION, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Operator.DISJUNCTION, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Operator.IMPLICATION, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Operator.BIIMPLICATION, left, right);
    }

    /**
     * Costruisce un nodo binario per l'operatore indicato.
     *
     * @throws IllegalArgumentException se l'operatore non è binario o un operando è null
     */
    public static Formula binary(Operator operator, Formula left, Formula right) {
        if (operator == null || !operator.isBinary()) {
            throw new IllegalArgumentException("Operatore binario richiesto, ricevuto: " + operator);
        }
        return new Formula(Type.of(operator), null, requireOperand(left), requireOperand(right));
    }

    private static Formula requireOperand(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando non può essere null");
        }
        return operand;
    }

    //endregion

    //region ACCESSO ALLA STRUTTURA

    public Type type() {
        return type;
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    /** Operatore del nodo, null per le variabili */
    public Operator operator() {
        return type.operator();
    }

    /**
     * @throws IllegalStateException se il nodo non è una variabile
     */
    public String name() {
        if (type != Type.ATOM) {
            throw new IllegalStateException("Il nodo " + type + " non è una variabile");
        }
        return variable.name();
    }

    /**
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public Formula operand() {
        if (type != Type.NOT) {
            throw new IllegalStateException("Il nodo " + type + " non è una negazione");
        }
        return left;
    }

    /**
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula left() {
        requireBinary();
        return left;
    }

    /**
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula right() {
        requireBinary();
        return right;
    }

    private void requireBinary() {
        if (type == Type.ATOM || type == Type.NOT) {
            throw new IllegalStateException("Il nodo " + type + " non è binario");
        }
    }

    /**
     * Figli diretti del nodo, da sinistra a destra.
     */
    public List<Formula> children() {
        return switch (type) {
            case ATOM -> List.of();
            case NOT -> List.of(left);
            case AND, OR, IMPLIES, IFF -> List.of(left, right);
        };
    }

    //endregion

    //region SOTTOFORMULE E VARIABILI

    /**
     * Restituisce la formula stessa seguita dalle sottoformule di ciascun figlio, in pre-ordine.
     * Le ripetizioni sono mantenute: in p&p la variabile p compare due volte.
     *
     * @return lista non modificabile delle sottoformule
     */
    public List<Formula> subformulas() {
        List<Formula> result = new ArrayList<>();
        collectSubformulas(result);
        return Collections.unmodifiableList(result);
    }

    private void collectSubformulas(List<Formula> accumulator) {
        accumulator.add(this);
        for (Formula child : children()) {
            child.collectSubformulas(accumulator);
        }
    }

    /**
     * Nomi delle variabili della formula, senza ripetizioni, in ordine di prima occorrenza.
     */
    public Set<String> variables() {
        Set<String> names = new LinkedHashSet<>();
        for (Formula subformula : subformulas()) {
            if (subformula.isAtom()) {
                names.add(subformula.name());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    /** Numero di nodi dell'albero */
    public int size() {
        return subformulas().size();
    }

    /** Profondità dell'albero, 1 per una variabile */
    public int depth() {
        int childDepth = 0;
        for (Formula child : children()) {
            childDepth = Math.max(childDepth, child.depth());
        }
        return childDepth + 1;
    }

    //endregion

    //region RESA TESTUALE

    /**
     * Rende la formula nella notazione di superficie con parentesizzazione minima.
     */
    public String render() {
        StringBuilder builder = new StringBuilder();
        appendTo(builder);
        return builder.toString();
    }

    private void appendTo(StringBuilder builder) {
        switch (type) {
            case ATOM -> builder.append(variable.name());
            case NOT -> {
                builder.append(operator().symbol());
                appendChild(builder, left);
            }
            case AND, OR, IMPLIES, IFF -> {
                appendChild(builder, left);
                builder.append(operator().symbol());
                appendChild(builder, right);
            }
        }
    }

    private void appendChild(StringBuilder builder, Formula child) {
        if (child.isAtom() || child.operator().bindsAtLeastAs(operator())) {
            child.appendTo(builder);
        } else {
            builder.append(Parenthesis.OPEN.symbol());
            child.appendTo(builder);
            builder.append(Parenthesis.CLOSE.symbol());
        }
    }

    //endregion

    //region UGUAGLIANZA STRUTTURALE

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        Formula other = (Formula) o;
        return type == other.type
                && Objects.equals(variable, other.variable)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, variable, left, right);
    }

    @Override
    public String toString() {
        return render();
    }

    //endregion
}
