package org.truthtable.syntax;

import java.util.Optional;

/**
 * OPERATORI LOGICI - Insieme chiuso dei connettivi della logica proposizionale
 *
 * Ogni operatore porta con sé i metadati grammaticali usati dal parser e dalla
 * resa testuale delle formule: simbolo di superficie, arietà, precedenza e associatività.
 *
 * TABELLA DELLE PRECEDENZE (numero più alto = lega più stretto):
 * - Negazione (-):        arietà 1, precedenza 6, associativa a destra
 * - Congiunzione (&):     arietà 2, precedenza 5, associativa a sinistra
 * - Disgiunzione (|):     arietà 2, precedenza 4, associativa a sinistra
 * - Implicazione (->):    arietà 2, precedenza 3, associativa a sinistra
 * - Biimplicazione (<->): arietà 2, precedenza 2, associativa a sinistra
 *
 * Nota: '-' è carattere iniziale sia della negazione sia dell'implicazione,
 * il riconoscimento va quindi fatto sul simbolo completo con {@link #matchAt(String, int)}.
 */
public enum Operator {

    NEGATION("-", 1, 6, Associativity.RIGHT),
    CONJUNCTION("&", 2, 5, Associativity.LEFT),
    DISJUNCTION("|", 2, 4, Associativity.LEFT),
    IMPLICATION("->", 2, 3, Associativity.LEFT),
    BIIMPLICATION("<->", 2, 2, Associativity.LEFT);

    private final String symbol;
    private final int arity;
    private final int precedence;
    private final Associativity associativity;

    Operator(String symbol, int arity, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.arity = arity;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    //region METADATI GRAMMATICALI

    /** Simbolo canonico di superficie */
    public String symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    /**
     * Verifica se questo operatore lega almeno quanto l'operatore indicato.
     *
     * @param other operatore di confronto
     * @return true se la precedenza di questo operatore è maggiore o uguale
     */
    public boolean bindsAtLeastAs(Operator other) {
        return this.precedence >= other.precedence;
    }

    //endregion

    //region RICONOSCIMENTO SIMBOLI

    /**
     * Verifica se il carattere può aprire il simbolo di questo operatore.
     */
    public boolean acceptsInitialChar(char c) {
        return symbol.charAt(0) == c;
    }

    /**
     * Verifica se il simbolo di questo operatore compare nel testo alla posizione indicata.
     */
    public boolean matchesAt(String text, int offset) {
        return text != null && offset >= 0 && text.startsWith(symbol, offset);
    }

    /**
     * Riconosce l'operatore che inizia alla posizione indicata, preferendo il simbolo più lungo.
     *
     * ESEMPI:
     * - "->q" in posizione 0: IMPLICATION (non NEGATION)
     * - "-p"  in posizione 0: NEGATION
     * - "<-"  in posizione 0: nessun operatore
     *
     * @param text testo da esaminare
     * @param offset posizione di partenza
     * @return operatore riconosciuto, vuoto se nessun simbolo corrisponde
     */
    public static Optional<Operator> matchAt(String text, int offset) {
        Operator best = null;
        for (Operator operator : values()) {
            if (operator.matchesAt(text, offset)
                    && (best == null || operator.symbol.length() > best.symbol.length())) {
                best = operator;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Restituisce l'operatore con il simbolo esatto indicato.
     *
     * @throws IllegalArgumentException se il simbolo non appartiene al linguaggio
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Simbolo operatore sconosciuto: " + symbol);
    }

    //endregion

    @Override
    public String toString() {
        return symbol;
    }
}
