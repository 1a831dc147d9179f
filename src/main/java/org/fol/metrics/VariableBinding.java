package org.fol.metrics;

import java.util.Map;
import java.util.SortedSet;

/**
 * Legame delle variabili: occorrenze dei termini argomento risolte rispetto
 * al quantificatore più interno con lo stesso nome.
 *
 * @param boundOccurrences occorrenze legate da un quantificatore
 * @param freeOccurrences occorrenze libere (costanti comprese)
 * @param occurrencesByQuantifier id del quantificatore -> occorrenze che lega (anche 0)
 * @param freeVariables nomi con almeno un'occorrenza libera, in ordine alfabetico
 */
public record VariableBinding(int boundOccurrences,
                              int freeOccurrences,
                              Map<Integer, Integer> occurrencesByQuantifier,
                              SortedSet<String> freeVariables) {

    public int totalOccurrences() {
        return boundOccurrences + freeOccurrences;
    }
}
