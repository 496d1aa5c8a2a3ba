package org.truthtable.parser;

/**
 * Errore di sintassi in una formula: carattere non ammesso, parentesi non bilanciate,
 * operando mancante o nome di variabile non valido.
 *
 * Il parsing si interrompe al primo errore, senza alcun risultato parziale.
 */
public class FormulaSyntaxException extends RuntimeException {

    /** Posizione (0-based) del problema nel testo, -1 se non applicabile */
    private final int position;

    /** Testo che ha generato l'errore */
    private final String text;

    public FormulaSyntaxException(String message, String text, int position) {
        super(position >= 0
                ? message + " (posizione " + position + " in '" + text + "')"
                : message + " ('" + text + "')");
        this.text = text;
        this.position = position;
    }

    public FormulaSyntaxException(String message, String text) {
        this(message, text, -1);
    }

    public int getPosition() {
        return position;
    }

    public String getText() {
        return text;
    }
}
