package org.fol.support;

/**
 * Formula sintatticamente non valida.
 *
 * Porta con sé la posizione dell'errore (offset in caratteri dall'inizio
 * della formula, riga e colonna) e la porzione di testo che l'ha causato.
 */
public class FormulaSyntaxException extends FolException {

    private final String formula;
    private final int offset;
    private final int line;
    private final int column;
    private final String offendingText;

    public FormulaSyntaxException(String reason, String formula, int offset, int line, int column,
                                  String offendingText) {
        super(buildMessage(reason, formula, offset, offendingText));
        this.formula = formula;
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.offendingText = offendingText;
    }

    private static String buildMessage(String reason, String formula, int offset, String offendingText) {
        String near = offendingText == null || offendingText.isEmpty()
                ? "fine della formula"
                : "'" + offendingText + "'";
        return String.format("Errore di sintassi alla posizione %d vicino a %s: %s [formula: %s]",
                offset, near, reason, formula);
    }

    /** Testo completo della formula analizzata. */
    public String getFormula() {
        return formula;
    }

    /** Offset (0-based, in caratteri) del punto di errore. */
    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** Porzione di testo che ha causato l'errore; vuota se la formula è terminata prematuramente. */
    public String getOffendingText() {
        return offendingText;
    }
}
