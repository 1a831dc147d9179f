package org.fol.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FolioDatasetReaderTest {

    private final FolioDatasetReader reader = new FolioDatasetReader();

    private static Path write(Path dir, String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void readsJsonArrayWithNewlineSeparatedPremises(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "folio.json", """
                [
                  {"example_id": 7,
                   "premises-FOL": "∀x (Drinks(x) → Dependent(x))\\n∀x (Drinks(x) ⊕ Jokes(x))\\n",
                   "conclusion-FOL": "Jokes(rina)"},
                  {"premises-FOL": ["A(a)", "  ", "B(b)"],
                   "conclusion-FOL": "C(c)"}
                ]
                """);

        List<DatasetRecord> records = reader.read(file);

        assertEquals(2, records.size());
        assertEquals(7, records.get(0).recordId());
        assertEquals(List.of("∀x (Drinks(x) → Dependent(x))", "∀x (Drinks(x) ⊕ Jokes(x))"),
                records.get(0).premises());
        assertEquals("Jokes(rina)", records.get(0).conclusion());
        assertEquals(1, records.get(1).recordId());
        assertEquals(List.of("A(a)", "B(b)"), records.get(1).premises());
    }

    @Test
    void readsJsonLinesWithFallbackFields(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "folio.jsonl", """
                {"premises": ["P(a)"], "conclusion": "Q(a)"}

                {"premises-FOL": ["R(b)"], "premises": ["ignored"], "conclusion-FOL": "S(b)", "conclusion": "ignored"}
                """);

        List<DatasetRecord> records = reader.read(file);

        assertEquals(2, records.size());
        assertEquals(List.of("P(a)"), records.get(0).premises());
        assertEquals("Q(a)", records.get(0).conclusion());
        assertEquals(0, records.get(0).recordId());
        assertEquals(List.of("R(b)"), records.get(1).premises());
        assertEquals("S(b)", records.get(1).conclusion());
        assertEquals(1, records.get(1).recordId());
    }

    @Test
    void incompleteRecordsAreSkipped(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "partial.json", """
                [
                  {"premises-FOL": "A(a)"},
                  {"conclusion-FOL": "B(b)"},
                  {"premises-FOL": "", "conclusion-FOL": "B(b)"},
                  {"premises-FOL": "A(a)", "conclusion-FOL": "B(b)"}
                ]
                """);

        List<DatasetRecord> records = reader.read(file);

        assertEquals(1, records.size());
        assertEquals(3, records.get(0).recordId());
    }

    @Test
    void duplicateIdentifiersKeepFirstRecord(@TempDir Path tempDir) throws Exception {
        // il secondo record non ha example_id e prenderebbe la posizione 1, già usata
        Path file = write(tempDir, "clash.json", """
                [
                  {"example_id": 1, "premises-FOL": "A(a)", "conclusion-FOL": "B(b)"},
                  {"premises-FOL": "C(c)", "conclusion-FOL": "D(d)"},
                  {"example_id": 5, "premises-FOL": "E(e)", "conclusion-FOL": "F(f)"}
                ]
                """);

        List<DatasetRecord> records = reader.read(file);

        assertEquals(List.of(1, 5), records.stream().map(DatasetRecord::recordId).toList());
        assertEquals("B(b)", records.get(0).conclusion());
    }

    @Test
    void readsPremisesFromNode() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals(List.of("A", "B"), FolioDatasetReader.readPremises(mapper.readTree("{\"premises-FOL\": \"A\\r\\nB\"}")));
        assertTrue(FolioDatasetReader.readPremises(mapper.readTree("{\"premises-FOL\": null}")).isEmpty());
    }

    @Test
    void malformedFileFails(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "broken.json", "[ {\"premises-FOL\": ");

        assertThrows(UncheckedIOException.class, () -> reader.read(file));
        assertThrows(UncheckedIOException.class, () -> reader.read(tempDir.resolve("missing.json")));
    }
}
