package org.fol.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * LETTORE DATASET FOLIO - Da file JSON ai record da elaborare
 *
 * FORMATI ACCETTATI:
 * - array JSON di record
 * - JSON Lines (un record per riga)
 *
 * CAMPI DI OGNI RECORD:
 * - premesse: {@code premises-FOL} (array, oppure stringa con una premessa per
 *   riga), in alternativa {@code premises}
 * - conclusione: {@code conclusion-FOL}, in alternativa {@code conclusion}
 * - identificativo: {@code example_id} se numerico, altrimenti la posizione
 *
 * I record senza premesse o senza conclusione vengono saltati con un warning,
 * così come quelli il cui identificativo è già stato assegnato a un record
 * precedente (l'identificativo dà il nome al file di analisi).
 */
public final class FolioDatasetReader {

    private static final Logger LOGGER = Logger.getLogger(FolioDatasetReader.class.getName());

    private static final String PREMISES_FOL = "premises-FOL";
    private static final String CONCLUSION_FOL = "conclusion-FOL";
    private static final String PREMISES = "premises";
    private static final String CONCLUSION = "conclusion";
    private static final String EXAMPLE_ID = "example_id";

    private final ObjectMapper mapper;

    public FolioDatasetReader() {
        this(new ObjectMapper());
    }

    public FolioDatasetReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws UncheckedIOException se il file non è leggibile o non è JSON valido
     */
    public List<DatasetRecord> read(Path path) {
        try {
            String content = Files.readString(path).trim();
            List<DatasetRecord> records = content.startsWith("[")
                    ? readArray(mapper.readTree(content))
                    : readLines(content);
            LOGGER.info("Dataset letto da " + path + ": " + records.size() + " record");
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Lettura del dataset " + path + " fallita", e);
        }
    }

    private List<DatasetRecord> readArray(JsonNode root) {
        List<DatasetRecord> records = new ArrayList<>();
        Set<Integer> usedIds = new HashSet<>();
        for (int i = 0; i < root.size(); i++) {
            addIfComplete(records, usedIds, root.get(i), i);
        }
        return records;
    }

    private List<DatasetRecord> readLines(String content) throws IOException {
        List<DatasetRecord> records = new ArrayList<>();
        Set<Integer> usedIds = new HashSet<>();
        int position = 0;
        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            addIfComplete(records, usedIds, mapper.readTree(line), position++);
        }
        return records;
    }

    private void addIfComplete(List<DatasetRecord> records, Set<Integer> usedIds, JsonNode node, int position) {
        int recordId = node.path(EXAMPLE_ID).isInt() ? node.get(EXAMPLE_ID).asInt() : position;
        List<String> premises = readPremises(node);
        String conclusion = readText(node, CONCLUSION_FOL, CONCLUSION);

        if (premises.isEmpty() || conclusion == null || conclusion.isBlank()) {
            LOGGER.warning("Record " + recordId + " saltato: premesse o conclusione mancanti");
            return;
        }
        if (!usedIds.add(recordId)) {
            LOGGER.warning("Record in posizione " + position + " saltato: identificativo " + recordId
                    + " già assegnato");
            return;
        }
        records.add(new DatasetRecord(recordId, premises, conclusion.trim()));
    }

    /**
     * Le premesse FOL di FOLIO sono una stringa con una formula per riga;
     * alcune esportazioni usano invece un array.
     */
    static List<String> readPremises(JsonNode node) {
        JsonNode field = node.hasNonNull(PREMISES_FOL) ? node.get(PREMISES_FOL) : node.get(PREMISES);
        List<String> premises = new ArrayList<>();
        if (field == null || field.isNull()) {
            return premises;
        }
        if (field.isArray()) {
            for (JsonNode element : field) {
                addNonBlank(premises, element.asText());
            }
        } else {
            for (String line : field.asText().split("\\R")) {
                addNonBlank(premises, line);
            }
        }
        return premises;
    }

    private static void addNonBlank(List<String> premises, String text) {
        if (text != null && !text.isBlank()) {
            premises.add(text.trim());
        }
    }

    private static String readText(JsonNode node, String primary, String fallback) {
        JsonNode field = node.hasNonNull(primary) ? node.get(primary) : node.get(fallback);
        return field == null || field.isNull() ? null : field.asText();
    }
}
