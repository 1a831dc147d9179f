package org.fol.pipeline;

import java.util.List;

/**
 * Record del dataset: premesse e conclusione in notazione FOL.
 *
 * @param recordId identificativo del record nel dataset
 * @param premises premesse nell'ordine del dataset
 * @param conclusion conclusione
 */
public record DatasetRecord(int recordId, List<String> premises, String conclusion) {

    public DatasetRecord {
        if (premises == null) {
            throw new IllegalArgumentException("Premesse del record " + recordId + " non possono essere null");
        }
        for (String premise : premises) {
            if (premise == null) {
                throw new IllegalArgumentException("Premessa null nel record " + recordId);
            }
        }
        if (conclusion == null) {
            throw new IllegalArgumentException("Conclusione del record " + recordId + " non può essere null");
        }
        premises = List.copyOf(premises);
    }
}
