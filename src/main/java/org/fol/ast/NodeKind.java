package org.fol.ast;

/**
 * Tipi di nodo dell'AST canonico.
 *
 * Ogni tipo fissa la propria arità:
 * - AND, OR, XOR, IMPLIES, BICOND: esattamente due figli
 * - NOT: un figlio
 * - FORALL, EXISTS: un figlio (lo scope), variabile legata come valore del nodo
 * - PREDICATE: nessun figlio, 0..N termini argomento
 * - EQUALS: nessun figlio, esattamente due termini
 *
 * L'ordine di dichiarazione dei connettivi è quello usato nella distribuzione
 * dei connettivi delle metriche.
 */
public enum NodeKind {

    AND("∧", Category.BINARY, 5),
    OR("∨", Category.BINARY, 4),
    XOR("⊕", Category.BINARY, 3),
    IMPLIES("→", Category.BINARY, 2),
    BICOND("↔", Category.BINARY, 1),
    NOT("¬", Category.NEGATION, 6),
    FORALL("∀", Category.QUANTIFIER, 7),
    EXISTS("∃", Category.QUANTIFIER, 7),
    PREDICATE("", Category.ATOMIC, 8),
    EQUALS("=", Category.ATOMIC, 8);

    private enum Category { BINARY, NEGATION, QUANTIFIER, ATOMIC }

    private final String symbol;
    private final Category category;
    private final int precedence;

    NodeKind(String symbol, Category category, int precedence) {
        this.symbol = symbol;
        this.category = category;
        this.precedence = precedence;
    }

    /** Simbolo Unicode dell'operatore (vuoto per i predicati). */
    public String symbol() {
        return symbol;
    }

    /** Precedenza sintattica: valori più alti legano più strettamente. */
    public int precedence() {
        return precedence;
    }

    public boolean isBinary() {
        return category == Category.BINARY;
    }

    /** Connettivi: i cinque binari più la negazione. */
    public boolean isConnective() {
        return category == Category.BINARY || category == Category.NEGATION;
    }

    public boolean isQuantifier() {
        return category == Category.QUANTIFIER;
    }

    /** Formule atomiche: predicati e uguaglianze. */
    public boolean isAtomic() {
        return category == Category.ATOMIC;
    }
}
