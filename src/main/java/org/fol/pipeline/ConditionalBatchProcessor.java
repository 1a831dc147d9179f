package org.fol.pipeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fol.ast.FormulaNode;
import org.fol.conditional.GlobalConditionalComposer;
import org.fol.metrics.FormulaMetrics;
import org.fol.metrics.MetricsEngine;
import org.fol.render.FormulaRenderer;
import org.fol.serialize.AnalysisJsonExporter;
import org.fol.support.AnalysisConfiguration;
import org.fol.support.CompositionException;
import org.fol.support.FolException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DRIVER BATCH - Condizionale globale e metriche per ogni record del dataset
 *
 * PIPELINE PER RECORD:
 * 1. Composizione del condizionale globale da premesse e conclusione
 * 2. Calcolo delle metriche strutturali
 * 3. Testo del condizionale rigenerato dal renderer
 *
 * I record sono indipendenti: con più worker configurati vengono elaborati in
 * parallelo, ma i risultati restano nell'ordine di input. La politica di
 * errore decide se un record non valido viene saltato o interrompe il batch.
 */
public final class ConditionalBatchProcessor {

    private static final Logger LOGGER = Logger.getLogger(ConditionalBatchProcessor.class.getName());

    private final GlobalConditionalComposer composer;
    private final MetricsEngine metricsEngine;
    private final FailurePolicy failurePolicy;
    private final AnalysisConfiguration configuration;
    private final int workers;

    public ConditionalBatchProcessor(AnalysisConfiguration configuration, FailurePolicy failurePolicy) {
        if (configuration == null || failurePolicy == null) {
            throw new IllegalArgumentException("Configurazione e politica di errore sono obbligatorie");
        }
        this.composer = new GlobalConditionalComposer(configuration);
        this.metricsEngine = new MetricsEngine(configuration);
        this.failurePolicy = failurePolicy;
        this.configuration = configuration;
        this.workers = configuration.batchWorkers();
    }

    //region ELABORAZIONE

    /**
     * Elabora tutti i record.
     *
     * @param records record da elaborare
     * @return report con risultati e fallimenti nell'ordine di input
     * @throws FolException con politica ABORT, il primo errore in ordine di input
     */
    public BatchReport process(List<DatasetRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("Lista record non può essere null");
        }
        LOGGER.info("Inizio elaborazione di " + records.size() + " record (" + workers + " worker, "
                + failurePolicy + ")");

        List<Outcome> outcomes = workers == 1 || records.size() < 2
                ? processSequentially(records)
                : processInParallel(records);

        List<RecordResult> results = new ArrayList<>();
        List<RecordFailure> failures = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.result() != null) {
                results.add(outcome.result());
            } else {
                failures.add(outcome.failure());
            }
        }

        LOGGER.info("Elaborazione completata: " + results.size() + " record elaborati, "
                + failures.size() + " falliti");
        return new BatchReport(results, failures);
    }

    /**
     * Elabora un singolo record.
     *
     * @throws CompositionException se una premessa o la conclusione non è valida
     * @throws org.fol.support.DepthLimitExceededException se la formula supera il limite di annidamento
     */
    public RecordResult processRecord(DatasetRecord record) {
        FormulaNode ast = composer.composeGlobalConditional(record.premises(), record.conclusion());
        FormulaMetrics metrics = metricsEngine.computeMetrics(ast);
        return new RecordResult(record.recordId(), FormulaRenderer.render(ast, configuration), record.premises(),
                record.conclusion(), ast, metrics);
    }

    private List<Outcome> processSequentially(List<DatasetRecord> records) {
        List<Outcome> outcomes = new ArrayList<>(records.size());
        for (DatasetRecord record : records) {
            outcomes.add(attempt(record));
        }
        return outcomes;
    }

    private List<Outcome> processInParallel(List<DatasetRecord> records) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, records.size()));
        try {
            List<Future<Outcome>> futures = new ArrayList<>(records.size());
            for (DatasetRecord record : records) {
                Callable<Outcome> task = () -> attempt(record);
                futures.add(executor.submit(task));
            }

            List<Outcome> outcomes = new ArrayList<>(records.size());
            for (Future<Outcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Elaborazione batch interrotta", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Errore nell'elaborazione batch", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Elabora un record applicando la politica di errore: con SKIP l'errore
     * diventa un {@link RecordFailure}, con ABORT viene rilanciato.
     */
    private Outcome attempt(DatasetRecord record) {
        try {
            return new Outcome(processRecord(record), null);
        } catch (FolException e) {
            if (failurePolicy == FailurePolicy.ABORT) {
                LOGGER.log(Level.SEVERE, "Record " + record.recordId() + " non valido, batch interrotto", e);
                throw e;
            }
            LOGGER.warning("Record " + record.recordId() + " saltato: " + e.getMessage());
            Integer itemIndex = e instanceof CompositionException
                    ? ((CompositionException) e).getItemIndex()
                    : null;
            return new Outcome(null, new RecordFailure(record.recordId(), itemIndex, e.getMessage()));
        }
    }

    private record Outcome(RecordResult result, RecordFailure failure) {
    }

    //endregion

    //region RIEPILOGO JSON

    /**
     * Riepilogo {@code {totalProcessed, totalFailed, records, failures}}.
     */
    public static ObjectNode toSummaryDocument(BatchReport report, AnalysisJsonExporter exporter) {
        ObjectNode summary = exporter.getMapper().createObjectNode();
        summary.put("totalProcessed", report.totalProcessed());
        summary.put("totalFailed", report.totalFailed());

        ArrayNode records = summary.putArray("records");
        for (RecordResult result : report.results()) {
            ObjectNode json = records.addObject();
            json.put("recordId", result.recordId());
            json.put("originalFormula", result.originalFormula());
            ArrayNode premises = json.putArray("premises");
            result.premises().forEach(premises::add);
            json.put("conclusion", result.conclusion());
            json.set("metrics", exporter.toJson(result.metrics()));
        }

        ArrayNode failures = summary.putArray("failures");
        for (RecordFailure failure : report.failures()) {
            ObjectNode json = failures.addObject();
            json.put("recordId", failure.recordId());
            if (failure.itemIndex() == null) {
                json.putNull("itemIndex");
            } else {
                json.put("itemIndex", failure.itemIndex().intValue());
            }
            json.put("message", failure.message());
        }
        return summary;
    }

    /**
     * Scrive il riepilogo e, per ogni record elaborato, il documento di analisi
     * {@code record_NNNNN.json} nella directory indicata.
     *
     * @return percorso del file di riepilogo
     * @throws IllegalArgumentException se due record elaborati hanno lo stesso identificativo
     */
    public static Path writeOutputs(BatchReport report, AnalysisJsonExporter exporter, Path outputDir) {
        Set<Integer> recordIds = new HashSet<>();
        for (RecordResult result : report.results()) {
            if (!recordIds.add(result.recordId())) {
                throw new IllegalArgumentException("Identificativo di record duplicato: " + result.recordId());
            }
        }

        for (RecordResult result : report.results()) {
            ObjectNode document = exporter.toAnalysisDocument(result.originalFormula(), result.ast(), result.metrics());
            exporter.write(document, outputDir.resolve(String.format("record_%05d.json", result.recordId())));
        }
        return exporter.write(toSummaryDocument(report, exporter), outputDir.resolve("summary.json"));
    }

    //endregion
}
