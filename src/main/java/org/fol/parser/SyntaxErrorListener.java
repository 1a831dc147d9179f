package org.fol.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.fol.support.FormulaSyntaxException;

/**
 * Listener ANTLR che trasforma il primo errore di lexer o parser in una
 * {@link FormulaSyntaxException}, interrompendo l'analisi.
 *
 * Sostituisce i listener di default (che stampano su console e lasciano
 * proseguire il recupero degli errori): nessun albero parziale arriva al
 * normalizzatore.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private final String formula;

    SyntaxErrorListener(String formula) {
        this.formula = formula;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        int codePointIndex;
        String offendingText;

        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            codePointIndex = Math.max(token.getStartIndex(), 0);
            offendingText = token.getType() == Token.EOF ? "" : token.getText();
        } else if (recognizer instanceof Lexer) {
            // Errore lessicale: carattere non riconosciuto all'inizio del token corrente
            codePointIndex = ((Lexer) recognizer)._tokenStartCharIndex;
            offendingText = codePointAt(codePointIndex);
        } else {
            codePointIndex = 0;
            offendingText = "";
        }

        throw new FormulaSyntaxException(msg, formula, toCharOffset(codePointIndex), line, charPositionInLine,
                offendingText);
    }

    /** Gli indici ANTLR sono in code point, gli offset esposti in caratteri Java. */
    private int toCharOffset(int codePointIndex) {
        int codePoints = formula.codePointCount(0, formula.length());
        return formula.offsetByCodePoints(0, Math.min(codePointIndex, codePoints));
    }

    private String codePointAt(int codePointIndex) {
        int offset = toCharOffset(codePointIndex);
        if (offset >= formula.length()) {
            return "";
        }
        return new String(Character.toChars(formula.codePointAt(offset)));
    }
}
