package org.fol.render;

import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;
import org.fol.ast.Term;
import org.fol.parser.FolParser;
import org.fol.support.AnalysisConfiguration;
import org.fol.support.DepthLimitExceededException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FormulaRendererTest {

    private final FolParser parser = new FolParser();

    private static FormulaNode atom(String name) {
        return FormulaNode.predicate(name, List.of());
    }

    @Test
    void rendersAtoms() {
        assertEquals("P", FormulaRenderer.render(atom("P")));
        assertEquals("Loves(john, mary)", FormulaRenderer.render(
                FormulaNode.predicate("Loves", List.of(new Term("john"), new Term("mary")))));
        assertEquals("x = y", FormulaRenderer.render(FormulaNode.equality(new Term("x"), new Term("y"))));
    }

    @Test
    void omitsParenthesesImpliedByPrecedence() {
        assertEquals("A ∨ B ∧ C", FormulaRenderer.render(parser.parse("A ∨ (B ∧ C)")));
        assertEquals("A ∧ B → C", FormulaRenderer.render(parser.parse("(A ∧ B) → C")));
        assertEquals("¬A ∧ B", FormulaRenderer.render(parser.parse("(¬A) ∧ B")));
    }

    @Test
    void keepsParenthesesRequiredByStructure() {
        assertEquals("(A ∨ B) ∧ C", FormulaRenderer.render(parser.parse("(A ∨ B) ∧ C")));
        assertEquals("¬(A ∧ B)", FormulaRenderer.render(parser.parse("¬(A ∧ B)")));
        assertEquals("A → (B → C)", FormulaRenderer.render(parser.parse("A → (B → C)")));
    }

    @Test
    void rightNestedChainIsParenthesized() {
        FormulaNode ast = FormulaNode.and(atom("A"), FormulaNode.and(atom("B"), atom("C")));

        assertEquals("A ∧ (B ∧ C)", FormulaRenderer.render(ast));
        assertEquals(ast, parser.parse(FormulaRenderer.render(ast)));
    }

    @Test
    void quantifierScopeIsAlwaysParenthesized() {
        assertEquals("∀x (P(x) → Q(x))", FormulaRenderer.render(parser.parse("∀x(P(x)→Q(x))")));
        assertEquals("∀x (∃y (R(x, y)))", FormulaRenderer.render(parser.parse("∀x ∃y R(x, y)")));
        assertEquals("∀x (P(x)) ∧ Q(x)", FormulaRenderer.render(parser.parse("∀x P(x) ∧ Q(x)")));
    }

    @Test
    void parenthesesRuleComparesPrecedence() {
        FormulaNode or = FormulaNode.binary(NodeKind.OR, atom("A"), atom("B"));

        assertTrue(FormulaRenderer.needsParentheses(NodeKind.AND, or, false));
        assertFalse(FormulaRenderer.needsParentheses(NodeKind.IMPLIES, or, true));
        assertFalse(FormulaRenderer.needsParentheses(NodeKind.OR, or, false));
        assertTrue(FormulaRenderer.needsParentheses(NodeKind.OR, or, true));
        assertFalse(FormulaRenderer.needsParentheses(NodeKind.AND, atom("A"), true));
    }

    @Test
    void deepTreesAreBoundedByConfiguredDepth() {
        FormulaNode deep = atom("P");
        for (int i = 0; i < 300; i++) {
            deep = FormulaNode.not(deep);
        }
        FormulaNode chain = deep;

        DepthLimitExceededException e = assertThrows(DepthLimitExceededException.class,
                () -> FormulaRenderer.render(chain));
        assertEquals(301, e.getDepth());

        String text = FormulaRenderer.render(chain, AnalysisConfiguration.defaults().withMaxNestingDepth(400));
        assertEquals("¬".repeat(300) + "P", text);
    }

    @Test
    void renderedTextParsesBackToSameAst() {
        List<String> corpus = List.of(
                "∀x (Drinks(x) → Dependent(x))",
                "∀x (Drinks(x) ⊕ Jokes(x))",
                "¬(Student(rina) ⊕ ¬AwareThatDrug(rina, caffeine))",
                "∀x (Bulbophyllum(x) → Orchid(x))",
                "∃x (Dog(x) ∧ ¬∃y (Cat(y) ∧ Chases(x, y)))",
                "(A ↔ B) ↔ C",
                "A ↔ (B ↔ C)",
                "A ⊕ (B ⊕ C) ⊕ D",
                "¬¬¬P(a)",
                "∀x ¬(x = y)",
                "((P ∨ Q) ∧ (R ∨ S)) → (T ⊕ U)",
                "Étudiant(josé) → Λόγος(ß)");

        for (String formula : corpus) {
            FormulaNode ast = parser.parse(formula);
            String rendered = FormulaRenderer.render(ast);
            assertEquals(ast, parser.parse(rendered), "Round trip fallito per: " + formula + " -> " + rendered);
            assertEquals(rendered, FormulaRenderer.render(parser.parse(rendered)));
        }
    }
}
