package org.fol.support;

/**
 * Fallimento nella costruzione del condizionale globale.
 *
 * Identifica l'elemento che ha causato l'errore: indice 0-based della
 * premessa, oppure {@link #CONCLUSION_INDEX} per la conclusione.
 */
public class CompositionException extends FolException {

    /** Indice convenzionale della conclusione */
    public static final int CONCLUSION_INDEX = -1;

    private final int itemIndex;
    private final String itemText;

    public CompositionException(int itemIndex, String itemText, Throwable cause) {
        super(describe(itemIndex) + " non valida: " + (cause == null ? "valore assente" : cause.getMessage()), cause);
        this.itemIndex = itemIndex;
        this.itemText = itemText;
    }

    private static String describe(int itemIndex) {
        return itemIndex == CONCLUSION_INDEX ? "Conclusione" : "Premessa " + itemIndex;
    }

    /** Indice della premessa fallita, oppure {@link #CONCLUSION_INDEX}. */
    public int getItemIndex() {
        return itemIndex;
    }

    public boolean isConclusion() {
        return itemIndex == CONCLUSION_INDEX;
    }

    /** Testo dell'elemento fallito (può essere null se l'elemento mancava). */
    public String getItemText() {
        return itemText;
    }
}
