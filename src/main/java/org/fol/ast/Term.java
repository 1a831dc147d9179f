package org.fol.ast;

/**
 * Termine argomento di un predicato o di un'uguaglianza: variabile o costante.
 * Il nome è conservato esattamente come scritto, senza normalizzazioni.
 *
 * @param name identificatore del termine (non null, non vuoto)
 */
public record Term(String name) {

    public Term {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome del termine non può essere null o vuoto");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
