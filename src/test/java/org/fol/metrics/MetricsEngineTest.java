package org.fol.metrics;

import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;
import org.fol.parser.FolParser;
import org.fol.support.AnalysisConfiguration;
import org.fol.support.DepthLimitExceededException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test delle metriche strutturali.
 */
public class MetricsEngineTest {

    private final FolParser parser = new FolParser();
    private final MetricsEngine engine = new MetricsEngine();

    private FormulaMetrics metricsOf(String formula) {
        return engine.computeMetrics(parser.parse(formula));
    }

    @Test
    void atomicFormula() {
        FormulaMetrics metrics = metricsOf("P(a)");

        assertEquals(1, metrics.totalDepth());
        assertEquals(0, metrics.operatorDepth());
        assertEquals(1, metrics.subformulaCount());
        assertEquals(1, metrics.atomCount());
        assertEquals(0, metrics.quantifierCount());
        assertTrue(metrics.quantifierScope().isEmpty());
        assertTrue(metrics.connectiveScope().isEmpty());
        assertEquals(0, metrics.totalConnectives());
        assertEquals(1, metrics.variableBinding().freeOccurrences());
    }

    @Test
    void universalImplication() {
        FormulaMetrics metrics = metricsOf("∀x (P(x) → Q(x))");

        assertEquals(3, metrics.totalDepth());
        assertEquals(1, metrics.operatorDepth());
        assertEquals(Map.of(0, 3), metrics.quantifierScope());
        assertEquals(Map.of(1, 3), metrics.connectiveScope());
        assertEquals(2, metrics.variableBinding().boundOccurrences());
        assertEquals(0, metrics.variableBinding().freeOccurrences());
        assertEquals(Map.of(0, 2), metrics.variableBinding().occurrencesByQuantifier());
        assertEquals(4, metrics.subformulaCount());
        assertEquals(1, metrics.quantifierCount());
        assertEquals(1, metrics.connectiveCount(NodeKind.IMPLIES));
    }

    @Test
    void innerQuantifierShadowsOuter() {
        FormulaMetrics metrics = metricsOf("∀x (P(x) ∧ ∃x Q(x))");

        VariableBinding binding = metrics.variableBinding();
        assertEquals(Map.of(0, 1, 3, 1), binding.occurrencesByQuantifier());
        assertEquals(2, binding.boundOccurrences());
        assertEquals(0, binding.freeOccurrences());
    }

    @Test
    void shadowingEndsWithTheInnerScope() {
        // la x di R(x) torna al quantificatore esterno
        FormulaMetrics metrics = metricsOf("∀x ((∃x Q(x)) ∧ R(x))");

        assertEquals(Map.of(0, 1, 2, 1), metrics.variableBinding().occurrencesByQuantifier());
    }

    @Test
    void occurrencesOutsideScopeAreFree() {
        FormulaMetrics metrics = metricsOf("∀x (P(x, y)) ∧ R(x)");

        VariableBinding binding = metrics.variableBinding();
        assertEquals(1, binding.boundOccurrences());
        assertEquals(2, binding.freeOccurrences());
        assertEquals(Set.of("x", "y"), binding.freeVariables());
        assertEquals(List.of("x", "y"), List.copyOf(binding.freeVariables()));
        assertEquals(3, binding.totalOccurrences());
    }

    @Test
    void vacuousQuantifierBindsNothing() {
        FormulaMetrics metrics = metricsOf("∃y P(a)");

        assertEquals(Map.of(0, 0), metrics.variableBinding().occurrencesByQuantifier());
        assertEquals(Map.of(0, 1), metrics.quantifierScope());
        assertEquals(Set.of("a"), metrics.variableBinding().freeVariables());
    }

    @Test
    void operatorDepthCountsConnectivesOnly() {
        FormulaMetrics nested = metricsOf("¬(P(a) ∧ ¬Q(b))");
        assertEquals(3, nested.operatorDepth());
        assertEquals(4, nested.totalDepth());

        FormulaMetrics quantified = metricsOf("∀x ∃y R(x, y)");
        assertEquals(0, quantified.operatorDepth());
        assertEquals(3, quantified.totalDepth());
        assertEquals(2, quantified.quantifierCount());
        assertEquals(Map.of(0, 2, 1, 1), quantified.quantifierScope());
    }

    @Test
    void connectiveScopeUsesPreOrderIds() {
        // IMPLIES(0) AND(1) A(2) B(3) NOT(4) C(5)
        FormulaMetrics metrics = metricsOf("A ∧ B → ¬C");

        assertEquals(Map.of(0, 6, 1, 3, 4, 2), metrics.connectiveScope());
        assertEquals(6, metrics.subformulaCount());
        assertEquals(3, metrics.atomCount());
    }

    @Test
    void distributionListsEveryConnective() {
        FormulaMetrics metrics = metricsOf("(A ⊕ B) ∨ (C ↔ D) ∨ ¬E");

        Set<NodeKind> connectives = EnumSet.of(NodeKind.AND, NodeKind.OR, NodeKind.XOR,
                NodeKind.IMPLIES, NodeKind.BICOND, NodeKind.NOT);
        assertEquals(connectives, metrics.connectiveDistribution().keySet());
        assertEquals(0, metrics.connectiveCount(NodeKind.AND));
        assertEquals(2, metrics.connectiveCount(NodeKind.OR));
        assertEquals(1, metrics.connectiveCount(NodeKind.XOR));
        assertEquals(1, metrics.connectiveCount(NodeKind.BICOND));
        assertEquals(1, metrics.connectiveCount(NodeKind.NOT));
        assertEquals(5, metrics.totalConnectives());
    }

    @Test
    void equalityTermsAreResolved() {
        FormulaMetrics metrics = metricsOf("∀x (x = john)");

        assertEquals(1, metrics.variableBinding().boundOccurrences());
        assertEquals(1, metrics.variableBinding().freeOccurrences());
        assertEquals(1, metrics.atomCount());
    }

    @Test
    void metricsDoNotAlterTheAst() {
        FormulaNode ast = parser.parse("∀x (P(x) → ∃y Q(x, y))");
        FormulaNode copy = parser.parse("∀x (P(x) → ∃y Q(x, y))");

        FormulaMetrics first = engine.computeMetrics(ast);
        FormulaMetrics second = engine.computeMetrics(ast);

        assertEquals(copy, ast);
        assertEquals(first, second);
    }

    @Test
    void resultMapsAreImmutable() {
        FormulaMetrics metrics = metricsOf("∀x (P(x) → Q(x))");

        assertThrows(UnsupportedOperationException.class, () -> metrics.quantifierScope().put(9, 9));
        assertThrows(UnsupportedOperationException.class, () -> metrics.connectiveDistribution().put(NodeKind.AND, 9));
        assertThrows(UnsupportedOperationException.class, () -> metrics.variableBinding().freeVariables().add("z"));
    }

    @Test
    void heightBeyondLimitIsRejected() {
        FormulaNode ast = parser.parse("¬¬¬P");
        MetricsEngine shallow = new MetricsEngine(AnalysisConfiguration.defaults().withMaxNestingDepth(3));

        assertThrows(DepthLimitExceededException.class, () -> shallow.computeMetrics(ast));
        assertThrows(IllegalArgumentException.class, () -> engine.computeMetrics(null));
    }
}
