package org.fol.conditional;

import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;
import org.fol.parser.FolParser;
import org.fol.render.FormulaRenderer;
import org.fol.support.AnalysisConfiguration;
import org.fol.support.CompositionException;
import org.fol.support.FolException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * CONDIZIONALE GLOBALE - Composizione di premesse e conclusione
 *
 * Costruisce l'AST della formula (P1 ∧ P2 ∧ ... ∧ Pn) → C a partire dai testi
 * delle singole premesse e della conclusione.
 *
 * ALGORITMO:
 * 1. Parsing indipendente di ogni premessa e della conclusione (i testi non
 *    vengono mai concatenati in un'unica formula)
 * 2. Ripiegamento a sinistra delle premesse in un albero AND, nell'ordine di
 *    input, senza riordinamenti né deduplicazioni
 * 3. Radice IMPLIES(congiunzione, conclusione)
 *
 * CASI PARTICOLARI:
 * - Una sola premessa: nessun nodo AND contenitore
 * - Nessuna premessa: antecedente sentinella {@value #EMPTY_ANTECEDENT_SYMBOL},
 *   un predicato senza argomenti che il lexer non accetta come identificatore
 *
 * Il primo errore interrompe l'intera composizione con una
 * {@link CompositionException} che riporta l'indice dell'elemento fallito.
 */
public final class GlobalConditionalComposer {

    private static final Logger LOGGER = Logger.getLogger(GlobalConditionalComposer.class.getName());

    /** Simbolo dell'antecedente vuoto (verum, U+22A4) */
    public static final String EMPTY_ANTECEDENT_SYMBOL = "⊤";

    private final FolParser parser;
    private final AnalysisConfiguration configuration;

    public GlobalConditionalComposer() {
        this(AnalysisConfiguration.defaults());
    }

    public GlobalConditionalComposer(AnalysisConfiguration configuration) {
        this(new FolParser(configuration));
    }

    public GlobalConditionalComposer(FolParser parser) {
        if (parser == null) {
            throw new IllegalArgumentException("Parser non può essere null");
        }
        this.parser = parser;
        this.configuration = parser.getConfiguration();
    }

    //region COMPOSIZIONE

    /**
     * Compone premesse e conclusione nel condizionale globale.
     *
     * @param premises premesse in ordine di input (anche vuota)
     * @param conclusion conclusione
     * @return AST con radice IMPLIES
     * @throws CompositionException se una premessa o la conclusione non è valida
     * @throws org.fol.support.DepthLimitExceededException se l'AST composto supera l'altezza massima
     */
    public FormulaNode composeGlobalConditional(List<String> premises, String conclusion) {
        if (premises == null) {
            throw new IllegalArgumentException("Lista premesse non può essere null");
        }

        List<FormulaNode> premiseAsts = new ArrayList<>(premises.size());
        for (int i = 0; i < premises.size(); i++) {
            premiseAsts.add(parseItem(i, premises.get(i)));
        }
        FormulaNode conclusionAst = parseItem(CompositionException.CONCLUSION_INDEX, conclusion);

        FormulaNode antecedent = premiseAsts.isEmpty()
                ? emptyAntecedent()
                : conjoinInOrder(premiseAsts);

        FormulaNode conditional = FormulaNode.implies(antecedent, conclusionAst);
        configuration.checkDepth(conditional.height());

        LOGGER.fine("Condizionale globale composto da " + premiseAsts.size() + " premesse");
        return conditional;
    }

    /**
     * Compone il condizionale globale e ne restituisce il testo.
     *
     * Senza premesse il testo inizia con la sentinella {@value #EMPTY_ANTECEDENT_SYMBOL}
     * ({@code ⊤ → C}), che il parser rifiuta: in quel caso il testo non può
     * essere rianalizzato.
     *
     * @see #composeGlobalConditional(List, String)
     */
    public String composeGlobalConditionalText(List<String> premises, String conclusion) {
        return FormulaRenderer.render(composeGlobalConditional(premises, conclusion), configuration);
    }

    private FormulaNode parseItem(int index, String text) {
        if (text == null) {
            throw new CompositionException(index, null, null);
        }
        try {
            return parser.parse(text);
        } catch (FolException e) {
            LOGGER.warning("Composizione interrotta: elemento " + index + " non valido (" + e.getMessage() + ")");
            throw new CompositionException(index, text, e);
        }
    }

    /** Ripiegamento a sinistra: ((P1 ∧ P2) ∧ P3) ∧ ... */
    private FormulaNode conjoinInOrder(List<FormulaNode> premiseAsts) {
        FormulaNode conjunction = premiseAsts.get(0);
        for (int i = 1; i < premiseAsts.size(); i++) {
            conjunction = FormulaNode.and(conjunction, premiseAsts.get(i));
            configuration.checkDepth(conjunction.height());
        }
        return conjunction;
    }

    //endregion

    //region ANTECEDENTE VUOTO

    /** Nuova istanza della sentinella per l'antecedente senza premesse. */
    public static FormulaNode emptyAntecedent() {
        return FormulaNode.predicate(EMPTY_ANTECEDENT_SYMBOL, List.of());
    }

    /**
     * @return true se il nodo è la sentinella dell'antecedente vuoto
     */
    public static boolean isEmptyAntecedent(FormulaNode node) {
        return node != null
                && node.kind() == NodeKind.PREDICATE
                && EMPTY_ANTECEDENT_SYMBOL.equals(node.value())
                && node.arguments().isEmpty();
    }

    //endregion
}
