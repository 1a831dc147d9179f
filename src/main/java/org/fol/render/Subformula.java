package org.fol.render;

import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;

/**
 * Sottoformula di un AST, con il testo rigenerato dal renderer.
 *
 * @param nodeId indice pre-order del nodo (stessi identificativi delle metriche)
 * @param depth distanza dalla radice (0 per la radice)
 * @param kind tipo del nodo
 * @param text testo della sottoformula
 * @param node sottoalbero corrispondente
 */
public record Subformula(int nodeId, int depth, NodeKind kind, String text, FormulaNode node) {
}
