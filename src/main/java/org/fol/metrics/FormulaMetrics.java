package org.fol.metrics;

import org.fol.ast.NodeKind;

import java.util.Map;

/**
 * METRICHE STRUTTURALI di una formula FOL
 *
 * Le mappe di scope usano come chiave l'indice pre-order del nodo (radice = 0,
 * i termini non sono nodi) e sono ordinate per chiave.
 *
 * @param totalDepth altezza dell'albero; una formula atomica ha profondità 1
 * @param operatorDepth massimo numero di connettivi (AND, OR, XOR, IMPLIES, BICOND, NOT) su un cammino radice-foglia
 * @param quantifierScope id del quantificatore -> numero di nodi del suo scope
 * @param connectiveScope id del connettivo -> numero di nodi del proprio sottoalbero
 * @param variableBinding occorrenze legate e libere
 * @param subformulaCount numero di nodi dell'AST, radice e foglie comprese
 * @param quantifierCount numero di nodi FORALL ed EXISTS
 * @param connectiveDistribution tipo di connettivo -> occorrenze (tutti i connettivi presenti, anche a 0)
 * @param atomCount numero di formule atomiche (PREDICATE ed EQUALS)
 */
public record FormulaMetrics(int totalDepth,
                             int operatorDepth,
                             Map<Integer, Integer> quantifierScope,
                             Map<Integer, Integer> connectiveScope,
                             VariableBinding variableBinding,
                             int subformulaCount,
                             int quantifierCount,
                             Map<NodeKind, Integer> connectiveDistribution,
                             int atomCount) {

    /** Occorrenze di un singolo tipo di connettivo. */
    public int connectiveCount(NodeKind kind) {
        return connectiveDistribution.getOrDefault(kind, 0);
    }

    /** Totale dei connettivi presenti nella formula. */
    public int totalConnectives() {
        int total = 0;
        for (int count : connectiveDistribution.values()) {
            total += count;
        }
        return total;
    }
}
