package org.fol.render;

import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;
import org.fol.ast.Term;
import org.fol.support.AnalysisConfiguration;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializza un AST canonico nel testo della formula (inverso del parsing).
 *
 * Le parentesi vengono inserite solo dove la precedenza o l'associatività a
 * sinistra lo richiedono, quindi il parsing del testo prodotto restituisce lo
 * stesso AST. Lo scope dei quantificatori è sempre racchiuso fra parentesi:
 * {@code ∀x (P(x) → Q(x))}.
 *
 * Unica eccezione al round trip: la sentinella dell'antecedente vuoto
 * ({@code ⊤}) viene serializzata così com'è e il lexer non la accetta, quindi
 * il testo di un condizionale globale senza premesse non è rianalizzabile.
 *
 * L'altezza dell'AST viene verificata contro il limite configurato prima
 * della visita ricorsiva.
 */
public final class FormulaRenderer {

    private FormulaRenderer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Serializza con il limite di profondità di default.
     *
     * @see #render(FormulaNode, AnalysisConfiguration)
     */
    public static String render(FormulaNode node) {
        return render(node, AnalysisConfiguration.defaults());
    }

    /**
     * @param node radice dell'AST o di un qualunque sottoalbero
     * @param configuration limite di profondità da rispettare
     * @return testo della formula in notazione Unicode
     * @throws org.fol.support.DepthLimitExceededException se l'AST supera l'altezza massima
     */
    public static String render(FormulaNode node, AnalysisConfiguration configuration) {
        if (node == null) {
            throw new IllegalArgumentException("Nodo da serializzare non può essere null");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        configuration.checkDepth(node.height());
        return renderNode(node);
    }

    private static String renderNode(FormulaNode node) {
        return switch (node.kind()) {
            case PREDICATE -> node.arguments().isEmpty()
                    ? node.value()
                    : node.value() + "(" + joinTerms(node) + ")";
            case EQUALS -> node.arguments().get(0).name() + " = " + node.arguments().get(1).name();
            case NOT -> NodeKind.NOT.symbol() + renderOperand(node.operand(), node.operand().kind().isBinary());
            case FORALL, EXISTS -> node.kind().symbol() + node.value() + " (" + renderNode(node.operand()) + ")";
            case AND, OR, XOR, IMPLIES, BICOND ->
                    renderOperand(node.left(), needsParentheses(node.kind(), node.left(), false))
                            + " " + node.kind().symbol() + " "
                            + renderOperand(node.right(), needsParentheses(node.kind(), node.right(), true));
        };
    }

    private static String renderOperand(FormulaNode operand, boolean parenthesize) {
        String text = renderNode(operand);
        return parenthesize ? "(" + text + ")" : text;
    }

    private static String joinTerms(FormulaNode node) {
        List<String> names = new ArrayList<>(node.arguments().size());
        for (Term term : node.arguments()) {
            names.add(term.name());
        }
        return String.join(", ", names);
    }

    /**
     * Un operando binario richiede parentesi se lega meno del padre, oppure se
     * ha la stessa precedenza e sta a destra (le catene si ripiegano a sinistra).
     */
    static boolean needsParentheses(NodeKind parent, FormulaNode operand, boolean rightOperand) {
        if (!operand.kind().isBinary()) {
            return false;
        }
        int operandPrecedence = operand.kind().precedence();
        int parentPrecedence = parent.precedence();
        return operandPrecedence < parentPrecedence || (operandPrecedence == parentPrecedence && rightOperand);
    }
}
