package org.fol.render;

import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;
import org.fol.metrics.FormulaMetrics;
import org.fol.metrics.MetricsEngine;
import org.fol.parser.FolParser;
import org.fol.support.AnalysisConfiguration;
import org.fol.support.DepthLimitExceededException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SubformulaExtractorTest {

    private final FolParser parser = new FolParser();

    @Test
    void listsSubformulasInPreOrder() {
        List<Subformula> subformulas = SubformulaExtractor.extract(parser.parse("∀x (P(x) → ¬Q(x))"));

        assertEquals(5, subformulas.size());
        assertEquals(List.of("∀x (P(x) → ¬Q(x))", "P(x) → ¬Q(x)", "P(x)", "¬Q(x)", "Q(x)"),
                subformulas.stream().map(Subformula::text).toList());
        assertEquals(List.of(0, 1, 2, 3, 4), subformulas.stream().map(Subformula::nodeId).toList());
        assertEquals(List.of(0, 1, 2, 2, 3), subformulas.stream().map(Subformula::depth).toList());
        assertEquals(NodeKind.NOT, subformulas.get(3).kind());
    }

    @Test
    void idsMatchMetricsScopes() {
        FormulaNode ast = parser.parse("(A ∧ ∃y B(y)) ∨ ¬C");
        List<Subformula> subformulas = SubformulaExtractor.extract(ast);
        FormulaMetrics metrics = new MetricsEngine().computeMetrics(ast);

        assertEquals(metrics.subformulaCount(), subformulas.size());
        for (int id : metrics.connectiveScope().keySet()) {
            assertTrue(subformulas.get(id).kind().isConnective(), "Nodo " + id);
        }
        for (int id : metrics.quantifierScope().keySet()) {
            assertEquals(NodeKind.EXISTS, subformulas.get(id).kind());
            assertEquals("∃y (B(y))", subformulas.get(id).text());
        }
    }

    @Test
    void deepTreesAreRejectedBeforeTraversal() {
        FormulaNode ast = parser.parse("¬¬¬P");

        assertThrows(DepthLimitExceededException.class,
                () -> SubformulaExtractor.extract(ast, AnalysisConfiguration.defaults().withMaxNestingDepth(3)));
        assertEquals(4, SubformulaExtractor.extract(ast).size());
    }

    @Test
    void nullRootIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SubformulaExtractor.extract(null));
    }
}
