package org.fol.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Nodo immutabile dell'AST canonico di una formula FOL.
 *
 * Rappresenta un tipo somma chiuso governato da {@link NodeKind}: il tipo fissa
 * l'arità dei figli e la presenza del valore (nome del predicato o variabile
 * legata). I nodi vengono costruiti dal basso verso l'alto attraverso i metodi
 * factory, che validano l'arità, e non vengono mai modificati in seguito.
 *
 * INVARIANTI:
 * - connettivi binari: esattamente due figli
 * - NOT, FORALL, EXISTS: esattamente un figlio, mai collassati
 * - PREDICATE: nessun figlio formula, 0..N termini argomento
 * - EQUALS: nessun figlio formula, esattamente due termini
 *
 * Uguaglianza e hash sono strutturali. Altezza e hash vengono calcolati una
 * sola volta alla costruzione.
 */
public final class FormulaNode {

    //region STRUTTURA DATI

    /** Tipo del nodo */
    private final NodeKind kind;

    /** Nome del predicato o variabile legata dal quantificatore (null per i connettivi) */
    private final String value;

    /** Sottoformule, nell'ordine sintattico */
    private final List<FormulaNode> children;

    /** Termini argomento (solo PREDICATE ed EQUALS) */
    private final List<Term> arguments;

    /** Altezza del sottoalbero: 1 per una formula atomica */
    private final int height;

    private final int hash;

    //endregion

    //region COSTRUTTORI E FACTORY

    private FormulaNode(NodeKind kind, String value, List<FormulaNode> children, List<Term> arguments) {
        this.kind = kind;
        this.value = value;
        this.children = children;
        this.arguments = arguments;

        int maxChildHeight = 0;
        for (FormulaNode child : children) {
            maxChildHeight = Math.max(maxChildHeight, child.height);
        }
        this.height = maxChildHeight + 1;
        this.hash = Objects.hash(kind, value, children, arguments);
    }

    /**
     * Costruisce una formula atomica predicativa.
     *
     * @param name nome del predicato, conservato esattamente
     * @param arguments termini argomento (anche vuoto)
     * @throws IllegalArgumentException se nome o argomenti non validi
     */
    public static FormulaNode predicate(String name, List<Term> arguments) {
        requireIdentifier(name, "Nome del predicato");
        if (arguments == null) {
            throw new IllegalArgumentException("Argomenti del predicato " + name + " non possono essere null");
        }
        for (Term argument : arguments) {
            if (argument == null) {
                throw new IllegalArgumentException("Argomento null nel predicato " + name);
            }
        }
        return new FormulaNode(NodeKind.PREDICATE, name, List.of(), List.copyOf(arguments));
    }

    /**
     * Costruisce l'uguaglianza fra due termini.
     */
    public static FormulaNode equality(Term left, Term right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Termini dell'uguaglianza non possono essere null");
        }
        return new FormulaNode(NodeKind.EQUALS, null, List.of(), List.of(left, right));
    }

    /**
     * Costruisce la negazione di una sottoformula.
     */
    public static FormulaNode not(FormulaNode operand) {
        requireNode(operand, "Operando della negazione");
        return new FormulaNode(NodeKind.NOT, null, List.of(operand), List.of());
    }

    /**
     * Costruisce un nodo quantificatore.
     *
     * @param kind FORALL o EXISTS
     * @param variable variabile legata
     * @param scope sottoformula su cui agisce il quantificatore
     * @throws IllegalArgumentException se il tipo non è un quantificatore
     */
    public static FormulaNode quantified(NodeKind kind, String variable, FormulaNode scope) {
        if (kind == null || !kind.isQuantifier()) {
            throw new IllegalArgumentException("Tipo deve essere FORALL o EXISTS, ricevuto: " + kind);
        }
        requireIdentifier(variable, "Variabile quantificata");
        requireNode(scope, "Scope del quantificatore");
        return new FormulaNode(kind, variable, List.of(scope), List.of());
    }

    public static FormulaNode forall(String variable, FormulaNode scope) {
        return quantified(NodeKind.FORALL, variable, scope);
    }

    public static FormulaNode exists(String variable, FormulaNode scope) {
        return quantified(NodeKind.EXISTS, variable, scope);
    }

    /**
     * Costruisce un connettivo binario.
     *
     * @param kind AND, OR, XOR, IMPLIES o BICOND
     * @param left operando sinistro
     * @param right operando destro
     * @throws IllegalArgumentException se il tipo non è binario o gli operandi sono null
     */
    public static FormulaNode binary(NodeKind kind, FormulaNode left, FormulaNode right) {
        if (kind == null || !kind.isBinary()) {
            throw new IllegalArgumentException("Tipo deve essere un connettivo binario, ricevuto: " + kind);
        }
        requireNode(left, "Operando sinistro di " + kind);
        requireNode(right, "Operando destro di " + kind);
        return new FormulaNode(kind, null, List.of(left, right), List.of());
    }

    public static FormulaNode and(FormulaNode left, FormulaNode right) {
        return binary(NodeKind.AND, left, right);
    }

    public static FormulaNode implies(FormulaNode left, FormulaNode right) {
        return binary(NodeKind.IMPLIES, left, right);
    }

    //endregion

    //region ACCESSO

    public NodeKind kind() {
        return kind;
    }

    /**
     * @return nome del predicato o variabile legata; null per connettivi e uguaglianze
     */
    public String value() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    /** Sottoformule (lista immutabile). */
    public List<FormulaNode> children() {
        return children;
    }

    /** Termini argomento (lista immutabile, vuota per i nodi non atomici). */
    public List<Term> arguments() {
        return arguments;
    }

    /** Operando sinistro di un connettivo binario. */
    public FormulaNode left() {
        requireBinary();
        return children.get(0);
    }

    /** Operando destro di un connettivo binario. */
    public FormulaNode right() {
        requireBinary();
        return children.get(1);
    }

    /** Unico figlio di NOT, FORALL ed EXISTS. */
    public FormulaNode operand() {
        if (children.size() != 1) {
            throw new IllegalStateException("Il nodo " + kind + " non è unario");
        }
        return children.get(0);
    }

    public int height() {
        return height;
    }

    public boolean isAtomic() {
        return kind.isAtomic();
    }

    //endregion

    //region UTILITY

    private void requireBinary() {
        if (!kind.isBinary()) {
            throw new IllegalStateException("Il nodo " + kind + " non è un connettivo binario");
        }
    }

    private static void requireNode(FormulaNode node, String description) {
        if (node == null) {
            throw new IllegalArgumentException(description + " non può essere null");
        }
    }

    private static void requireIdentifier(String identifier, String description) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException(description + " non può essere null o vuoto");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormulaNode)) return false;
        FormulaNode other = (FormulaNode) o;
        return hash == other.hash
                && kind == other.kind
                && height == other.height
                && Objects.equals(value, other.value)
                && arguments.equals(other.arguments)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Rappresentazione strutturale compatta, es. {@code IMPLIES(PREDICATE P(x), NOT(PREDICATE Q(x)))}.
     * Per il testo della formula usare il renderer.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case PREDICATE -> "PREDICATE " + value + argumentsToString();
            case EQUALS -> "EQUALS" + argumentsToString();
            case FORALL, EXISTS -> kind + " " + value + "(" + children.get(0) + ")";
            case NOT, AND, OR, XOR, IMPLIES, BICOND -> {
                List<String> parts = new ArrayList<>();
                for (FormulaNode child : children) {
                    parts.add(child.toString());
                }
                yield kind + "(" + String.join(", ", parts) + ")";
            }
        };
    }

    private String argumentsToString() {
        List<String> names = new ArrayList<>();
        for (Term argument : arguments) {
            names.add(argument.name());
        }
        return "(" + String.join(", ", names) + ")";
    }

    //endregion
}
