package org.fol.support;

/**
 * Radice della gerarchia di errori del parser FOL.
 *
 * Tutti gli errori vengono propagati al chiamante: parsing e composizione
 * interrompono l'intera operazione al primo errore, senza risultati parziali.
 */
public class FolException extends RuntimeException {

    public FolException(String message) {
        super(message);
    }

    public FolException(String message, Throwable cause) {
        super(message, cause);
    }
}
