package org.truthtable.syntax;

import java.util.regex.Pattern;

/**
 * Alfabeto del linguaggio: l'insieme dei caratteri ammessi in una formula ben formata.
 *
 * I caratteri '<' e '>' sono ammessi solo come parte di "<->" e "->": la loro
 * posizione viene controllata dal lexer, non da questa classe.
 */
public final class Alphabet {

    /** Classe dei caratteri accettati */
    public static final Pattern ACCEPTED_CHARS = Pattern.compile("[a-z0-9&|><()\\-]*");

    private Alphabet() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static boolean isAccepted(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '&' || c == '|' || c == '>' || c == '<' || c == '-'
                || Parenthesis.OPEN.accepts(c) || Parenthesis.CLOSE.accepts(c);
    }

    public static boolean isAccepted(String text) {
        return text != null && ACCEPTED_CHARS.matcher(text).matches();
    }

    /**
     * Restituisce la posizione del primo carattere fuori alfabeto.
     *
     * @return indice del primo carattere non ammesso, -1 se il testo è interamente valido
     */
    public static int firstRejectedChar(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!isAccepted(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
