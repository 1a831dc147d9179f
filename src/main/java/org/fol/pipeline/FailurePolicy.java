package org.fol.pipeline;

/**
 * Comportamento del driver batch quando un record non può essere elaborato.
 */
public enum FailurePolicy {

    /** Registra l'errore nel report e prosegue con il record successivo */
    SKIP,

    /** Interrompe l'intero batch rilanciando il primo errore */
    ABORT
}
