package org.fol.pipeline;

import java.util.List;

/**
 * Risultato di un'elaborazione batch, nell'ordine dei record in input.
 */
public record BatchReport(List<RecordResult> results, List<RecordFailure> failures) {

    public BatchReport {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public int totalProcessed() {
        return results.size();
    }

    public int totalFailed() {
        return failures.size();
    }
}
