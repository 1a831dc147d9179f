package org.fol.parser;

import org.antlr.v4.runtime.Token;
import org.fol.antlr.FolFormulaLexer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Misura la profondità di annidamento di una formula già tokenizzata,
 * prima che il parser ricorsivo venga invocato.
 *
 * Gli operatori prefissi consecutivi (¬, ∀x, ∃x) contano un livello ciascuno.
 * Una parentesi aperta aggiunge un livello proprio solo se non è preceduta da
 * operatori prefissi: {@code ¬(} vale uno, come il nodo NOT che produce, mentre
 * {@code ((} vale due. Ogni parentesi aggiunge almeno un livello, quindi la
 * ricorsione del parser resta proporzionale alla misura.
 */
final class NestingDepthScanner {

    private NestingDepthScanner() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param tokens token prodotti dal lexer (EOF incluso)
     * @return massima profondità di annidamento osservata
     */
    static int measure(List<Token> tokens) {
        Deque<Integer> enclosingDepths = new ArrayDeque<>();
        int base = 0;
        int prefixRun = 0;
        int maxDepth = 0;

        for (Token token : tokens) {
            switch (token.getType()) {
                case FolFormulaLexer.NOT, FolFormulaLexer.FORALL, FolFormulaLexer.EXISTS -> prefixRun++;
                case FolFormulaLexer.LPAR -> {
                    enclosingDepths.push(base);
                    base = base + Math.max(prefixRun, 1);
                    prefixRun = 0;
                }
                case FolFormulaLexer.RPAR -> {
                    // Parentesi non bilanciate: l'errore viene segnalato dal parser
                    if (!enclosingDepths.isEmpty()) {
                        base = enclosingDepths.pop();
                    }
                    prefixRun = 0;
                }
                case FolFormulaLexer.IDENTIFIER -> {
                    // variabile del quantificatore o nome atomico: il livello non cambia
                }
                default -> prefixRun = 0;
            }
            maxDepth = Math.max(maxDepth, base + prefixRun);
        }
        return maxDepth;
    }
}
