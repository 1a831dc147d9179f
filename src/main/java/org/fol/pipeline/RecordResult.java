package org.fol.pipeline;

import org.fol.ast.FormulaNode;
import org.fol.metrics.FormulaMetrics;

import java.util.List;

/**
 * Esito di un record elaborato con successo.
 *
 * @param recordId identificativo del record
 * @param originalFormula testo del condizionale globale
 * @param premises premesse originali
 * @param conclusion conclusione originale
 * @param ast AST del condizionale globale
 * @param metrics metriche dell'AST
 */
public record RecordResult(int recordId,
                           String originalFormula,
                           List<String> premises,
                           String conclusion,
                           FormulaNode ast,
                           FormulaMetrics metrics) {
}
