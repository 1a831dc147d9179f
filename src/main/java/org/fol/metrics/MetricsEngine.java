package org.fol.metrics;

import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;
import org.fol.ast.Term;
import org.fol.support.AnalysisConfiguration;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * MOTORE METRICHE - Misure strutturali su un AST canonico
 *
 * Calcola tutte le metriche con un'unica visita in profondità, senza
 * modificare l'AST. Gli identificativi dei nodi sono gli indici pre-order
 * (radice = 0), gli stessi prodotti da
 * {@link org.fol.render.SubformulaExtractor}.
 *
 * CONVENZIONI:
 * - profondità totale: una formula atomica vale 1
 * - profondità di operatore: solo i connettivi incrementano, quantificatori
 *   e atomi vengono attraversati senza contare
 * - conteggio sottoformule: ogni nodo dell'AST, foglie comprese; i termini
 *   argomento non sono nodi
 * - legame variabili: ogni termine argomento è risolto sul quantificatore
 *   più interno con lo stesso nome (shadowing); senza quantificatore è libero
 *
 * L'altezza dell'AST viene verificata contro il limite configurato prima della visita.
 */
public final class MetricsEngine {

    private static final Logger LOGGER = Logger.getLogger(MetricsEngine.class.getName());

    private final AnalysisConfiguration configuration;

    public MetricsEngine() {
        this(AnalysisConfiguration.defaults());
    }

    public MetricsEngine(AnalysisConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        this.configuration = configuration;
    }

    //region PUNTO DI INGRESSO

    /**
     * Calcola le metriche di un AST canonico.
     *
     * @param ast radice dell'AST
     * @return metriche immutabili
     * @throws org.fol.support.DepthLimitExceededException se l'AST supera l'altezza massima
     */
    public FormulaMetrics computeMetrics(FormulaNode ast) {
        if (ast == null) {
            throw new IllegalArgumentException("AST non può essere null");
        }
        configuration.checkDepth(ast.height());

        Traversal traversal = new Traversal();
        SubtreeSummary root = traversal.visit(ast);

        VariableBinding binding = new VariableBinding(
                traversal.boundOccurrences,
                traversal.freeOccurrences,
                Collections.unmodifiableSortedMap(traversal.occurrencesByQuantifier),
                Collections.unmodifiableSortedSet(traversal.freeVariables));

        FormulaMetrics metrics = new FormulaMetrics(
                root.height,
                root.operatorDepth,
                Collections.unmodifiableSortedMap(traversal.quantifierScope),
                Collections.unmodifiableSortedMap(traversal.connectiveScope),
                binding,
                root.nodeCount,
                traversal.quantifierCount,
                Collections.unmodifiableMap(traversal.connectiveDistribution),
                traversal.atomCount);

        LOGGER.fine(String.format("Metriche[nodes=%d, depth=%d, opDepth=%d, quantifiers=%d]",
                metrics.subformulaCount(), metrics.totalDepth(), metrics.operatorDepth(),
                metrics.quantifierCount()));
        return metrics;
    }

    //endregion

    //region VISITA

    /** Riepilogo di un sottoalbero, restituito in post-order. */
    private record SubtreeSummary(int nodeCount, int height, int operatorDepth) {
    }

    /** Stato di una singola visita: mai condiviso fra chiamate. */
    private static final class Traversal {

        private int nextId = 0;
        private int quantifierCount = 0;
        private int atomCount = 0;
        private int boundOccurrences = 0;
        private int freeOccurrences = 0;

        private final SortedMap<Integer, Integer> quantifierScope = new TreeMap<>();
        private final SortedMap<Integer, Integer> connectiveScope = new TreeMap<>();
        private final SortedMap<Integer, Integer> occurrencesByQuantifier = new TreeMap<>();
        private final SortedSet<String> freeVariables = new TreeSet<>();
        private final Map<NodeKind, Integer> connectiveDistribution = new EnumMap<>(NodeKind.class);

        /** Variabile -> id del quantificatore più interno che la lega */
        private final Map<String, Integer> binders = new HashMap<>();

        private Traversal() {
            for (NodeKind kind : NodeKind.values()) {
                if (kind.isConnective()) {
                    connectiveDistribution.put(kind, 0);
                }
            }
        }

        private SubtreeSummary visit(FormulaNode node) {
            int id = nextId++;

            return switch (node.kind()) {
                case PREDICATE, EQUALS -> {
                    atomCount++;
                    for (Term argument : node.arguments()) {
                        resolve(argument);
                    }
                    yield new SubtreeSummary(1, 1, 0);
                }
                case NOT, AND, OR, XOR, IMPLIES, BICOND -> {
                    connectiveDistribution.merge(node.kind(), 1, Integer::sum);
                    int nodeCount = 1;
                    int height = 0;
                    int operatorDepth = 0;
                    for (FormulaNode child : node.children()) {
                        SubtreeSummary summary = visit(child);
                        nodeCount += summary.nodeCount();
                        height = Math.max(height, summary.height());
                        operatorDepth = Math.max(operatorDepth, summary.operatorDepth());
                    }
                    connectiveScope.put(id, nodeCount);
                    yield new SubtreeSummary(nodeCount, height + 1, operatorDepth + 1);
                }
                case FORALL, EXISTS -> {
                    quantifierCount++;
                    occurrencesByQuantifier.put(id, 0);

                    // shadowing: il binder esterno viene ripristinato all'uscita dallo scope
                    Integer outerBinder = binders.put(node.value(), id);
                    SubtreeSummary scope = visit(node.operand());
                    if (outerBinder == null) {
                        binders.remove(node.value());
                    } else {
                        binders.put(node.value(), outerBinder);
                    }

                    quantifierScope.put(id, scope.nodeCount());
                    yield new SubtreeSummary(scope.nodeCount() + 1, scope.height() + 1, scope.operatorDepth());
                }
            };
        }

        private void resolve(Term argument) {
            Integer binder = binders.get(argument.name());
            if (binder == null) {
                freeOccurrences++;
                freeVariables.add(argument.name());
            } else {
                boundOccurrences++;
                occurrencesByQuantifier.merge(binder, 1, Integer::sum);
            }
        }
    }

    //endregion
}
