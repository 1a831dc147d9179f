package org.fol.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configurazione immutabile dell'analisi delle formule.
 *
 * I valori provengono, in ordine di priorità crescente, da:
 * 1. costanti di default definite in questa classe
 * 2. risorsa di classpath {@value #RESOURCE_NAME}
 * 3. proprietà di sistema con le stesse chiavi ({@code -Dfol.maxNestingDepth=...})
 */
public final class AnalysisConfiguration {

    private static final Logger LOGGER = Logger.getLogger(AnalysisConfiguration.class.getName());

    //region CHIAVI E DEFAULT

    /** Risorsa di classpath con le impostazioni */
    public static final String RESOURCE_NAME = "fol-metrics.properties";

    public static final String MAX_NESTING_DEPTH_KEY = "fol.maxNestingDepth";
    public static final String BATCH_WORKERS_KEY = "fol.batch.workers";

    /** Profondità massima di annidamento e altezza massima dell'AST */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    /** Worker del driver batch: 1 = elaborazione sequenziale */
    public static final int DEFAULT_BATCH_WORKERS = 1;

    private static final int MIN_NESTING_DEPTH = 1;
    private static final int MAX_BATCH_WORKERS = 64;

    //endregion

    private final int maxNestingDepth;
    private final int batchWorkers;

    private AnalysisConfiguration(int maxNestingDepth, int batchWorkers) {
        if (maxNestingDepth < MIN_NESTING_DEPTH) {
            throw new IllegalArgumentException("Profondità massima deve essere almeno " + MIN_NESTING_DEPTH
                    + ", ricevuto: " + maxNestingDepth);
        }
        if (batchWorkers < 1 || batchWorkers > MAX_BATCH_WORKERS) {
            throw new IllegalArgumentException("Numero worker deve essere tra 1 e " + MAX_BATCH_WORKERS
                    + ", ricevuto: " + batchWorkers);
        }
        this.maxNestingDepth = maxNestingDepth;
        this.batchWorkers = batchWorkers;
    }

    //region CREAZIONE

    /** Configurazione con i soli valori di default, senza leggere risorse esterne. */
    public static AnalysisConfiguration defaults() {
        return new AnalysisConfiguration(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_BATCH_WORKERS);
    }

    /**
     * Carica la configurazione da classpath e proprietà di sistema.
     *
     * @throws IllegalArgumentException se un valore non è un intero valido
     * @throws UncheckedIOException se la risorsa esiste ma non è leggibile
     */
    public static AnalysisConfiguration load() {
        Properties properties = new Properties();
        try (InputStream in = AnalysisConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
                LOGGER.fine("Configurazione caricata da " + RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Lettura di " + RESOURCE_NAME + " fallita", e);
        }

        for (String key : new String[]{MAX_NESTING_DEPTH_KEY, BATCH_WORKERS_KEY}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    /**
     * Costruisce la configurazione da un insieme di proprietà; le chiavi assenti usano i default.
     *
     * @throws IllegalArgumentException se un valore non è valido
     */
    public static AnalysisConfiguration fromProperties(Properties properties) {
        int depth = readInt(properties, MAX_NESTING_DEPTH_KEY, DEFAULT_MAX_NESTING_DEPTH);
        int workers = readInt(properties, BATCH_WORKERS_KEY, DEFAULT_BATCH_WORKERS);
        return new AnalysisConfiguration(depth, workers);
    }

    public AnalysisConfiguration withMaxNestingDepth(int depth) {
        return new AnalysisConfiguration(depth, batchWorkers);
    }

    public AnalysisConfiguration withBatchWorkers(int workers) {
        return new AnalysisConfiguration(maxNestingDepth, workers);
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valore non valido per " + key + ": " + raw);
        }
    }

    //endregion

    //region ACCESSO E VERIFICHE

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    public int batchWorkers() {
        return batchWorkers;
    }

    /**
     * Verifica una profondità misurata rispetto al limite.
     *
     * @throws DepthLimitExceededException se {@code depth} supera il limite
     */
    public void checkDepth(int depth) {
        if (depth > maxNestingDepth) {
            throw new DepthLimitExceededException(maxNestingDepth, depth);
        }
    }

    @Override
    public String toString() {
        return "AnalysisConfiguration[maxNestingDepth=" + maxNestingDepth + ", batchWorkers=" + batchWorkers + "]";
    }

    //endregion
}
