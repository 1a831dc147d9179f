package org.fol.pipeline;

/**
 * Record non elaborato.
 *
 * @param recordId identificativo del record
 * @param itemIndex premessa fallita (0-based), -1 per la conclusione, null se l'errore non riguarda un singolo elemento
 * @param message descrizione dell'errore
 */
public record RecordFailure(int recordId, Integer itemIndex, String message) {
}
