package org.fol.render;

import org.fol.ast.FormulaNode;
import org.fol.support.AnalysisConfiguration;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Elenca tutte le sottoformule di un AST in ordine pre-order, ognuna con il
 * proprio testo. L'identificativo di ogni sottoformula coincide con quello
 * usato dalle mappe di scope delle metriche.
 */
public final class SubformulaExtractor {

    private SubformulaExtractor() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static List<Subformula> extract(FormulaNode root) {
        return extract(root, AnalysisConfiguration.defaults());
    }

    /**
     * @throws org.fol.support.DepthLimitExceededException se l'AST supera l'altezza massima
     */
    public static List<Subformula> extract(FormulaNode root, AnalysisConfiguration configuration) {
        if (root == null) {
            throw new IllegalArgumentException("Radice non può essere null");
        }
        configuration.checkDepth(root.height());

        List<Subformula> subformulas = new ArrayList<>();
        Deque<FormulaNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);

        int nextId = 0;
        while (!nodes.isEmpty()) {
            FormulaNode node = nodes.pop();
            int depth = depths.pop();
            subformulas.add(new Subformula(nextId++, depth, node.kind(), FormulaRenderer.render(node, configuration), node));

            // figli in ordine inverso: il primo viene estratto per primo
            List<FormulaNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                nodes.push(children.get(i));
                depths.push(depth + 1);
            }
        }
        return subformulas;
    }
}
