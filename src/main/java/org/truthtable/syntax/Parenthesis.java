package org.truthtable.syntax;

/**
 * Simboli di punteggiatura del linguaggio.
 * Delimitano i raggruppamenti in fase di parsing e non compaiono mai nell'albero.
 */
public enum Parenthesis {

    OPEN('('),
    CLOSE(')');

    private final char symbol;

    Parenthesis(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public boolean accepts(char c) {
        return symbol == c;
    }

    /**
     * Verifica se le parentesi del testo sono bilanciate e mai chiuse prima di essere aperte.
     */
    public static boolean isBalanced(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (OPEN.accepts(c)) {
                depth++;
            } else if (CLOSE.accepts(c) && --depth < 0) {
                return false;
            }
        }
        return depth == 0;
    }
}
