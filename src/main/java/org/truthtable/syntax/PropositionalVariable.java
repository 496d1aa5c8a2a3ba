package org.truthtable.syntax;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * VARIABILE PROPOSIZIONALE - Simbolo atomico del linguaggio
 *
 * Una lettera minuscola seguita, facoltativamente, da un indice intero non negativo.
 * Esempi validi: p, p1, q23, r1890. Esempi non validi: pq, p1q, 1p, P.
 *
 * ORDINAMENTO NATURALE:
 * Per lettera e poi per valore numerico dell'indice (p < p1 < p2 < p10 < q),
 * così che lo stesso insieme di variabili produca sempre lo stesso ordine di enumerazione.
 *
 * @param name nome testuale, che ne costituisce l'identità
 */
public record PropositionalVariable(String name) implements Comparable<PropositionalVariable> {

    /** Pattern dei nomi di variabile */
    public static final Pattern PATTERN = Pattern.compile("[a-z][0-9]*");

    private static final Comparator<String> NAME_ORDER = Comparator
            .comparing((String name) -> name.charAt(0))
            .thenComparing((first, second) -> compareIndices(first, second))
            .thenComparing(Comparator.<String>naturalOrder());

    /**
     * @throws IllegalArgumentException se il nome non rispetta {@link #PATTERN}
     */
    public PropositionalVariable {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Nome variabile non valido: '" + name + "'");
        }
    }

    public static boolean isValidName(String name) {
        return name != null && PATTERN.matcher(name).matches();
    }

    public static boolean acceptsInitialChar(char c) {
        return c >= 'a' && c <= 'z';
    }

    /**
     * Confronta due nomi di variabile secondo l'ordinamento naturale.
     */
    public static int compareNames(String first, String second) {
        return NAME_ORDER.compare(first, second);
    }

    @Override
    public int compareTo(PropositionalVariable other) {
        return compareNames(this.name, other.name);
    }

    /**
     * Confronta gli indici numerici senza conversione, così da non avere limiti di lunghezza.
     * Un nome senza indice precede qualunque nome indicizzato.
     */
    private static int compareIndices(String first, String second) {
        String firstIndex = stripLeadingZeros(first.substring(1));
        String secondIndex = stripLeadingZeros(second.substring(1));
        boolean firstEmpty = first.length() == 1;
        boolean secondEmpty = second.length() == 1;

        if (firstEmpty || secondEmpty) {
            return Boolean.compare(!firstEmpty, !secondEmpty);
        }
        if (firstIndex.length() != secondIndex.length()) {
            return Integer.compare(firstIndex.length(), secondIndex.length());
        }
        return firstIndex.compareTo(secondIndex);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    @Override
    public String toString() {
        return name;
    }
}
